package com.fixforge.core.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Everything a single fix attempt needs.
 *
 * @param taskId     owning task, null for a standalone attempt
 * @param workflowId identifier used on events and in logs
 * @param repoPath   local checkout the attempt operates on
 * @param issue      the defect to fix
 * @param options    checkpoint configuration
 * @param owner      repository owner on the platform, required to open a pull request
 * @param repository repository name on the platform, required to open a pull request
 */
public record FixRequest(
    String taskId,
    String workflowId,
    Path repoPath,
    Issue issue,
    FixOptions options,
    String owner,
    String repository
) {
    public FixRequest {
        Objects.requireNonNull(repoPath, "repoPath");
        Objects.requireNonNull(issue, "issue");
        options = options != null ? options : FixOptions.reviewOnly();
        workflowId = workflowId != null ? workflowId : workflowIdFor(taskId, issue.number());
    }

    public static String workflowIdFor(String taskId, int issueNumber) {
        return taskId != null ? taskId + "-fix-" + issueNumber : "fix-" + issueNumber;
    }

    /** True when owner and repository are both known. */
    public boolean hasPlatformTarget() {
        return owner != null && !owner.isBlank() && repository != null && !repository.isBlank();
    }
}
