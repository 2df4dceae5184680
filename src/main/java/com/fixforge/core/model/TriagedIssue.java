package com.fixforge.core.model;

/**
 * An issue together with its triage result.
 *
 * @param issue          the scored issue
 * @param difficulty     1 (easiest) to 5
 * @param recommendation human-readable verdict and the signals behind it
 * @param estimatedFiles estimated number of affected source files, at least 1
 */
public record TriagedIssue(
    Issue issue,
    int difficulty,
    String recommendation,
    int estimatedFiles
) {
    public int number() {
        return issue.number();
    }

    public int comments() {
        return issue.comments();
    }
}
