package com.fixforge.core.model;

import java.util.List;

/**
 * How far a fix attempt may go without a human confirming the diff.
 *
 * @param autoCommit      commit after the diff is ready
 * @param autoPush        push the fix branch after committing
 * @param autoPullRequest open a pull request after pushing
 * @param files           files handed to the code editor, empty to let it choose
 */
public record FixOptions(
    boolean autoCommit,
    boolean autoPush,
    boolean autoPullRequest,
    List<String> files
) {
    public FixOptions {
        files = files != null ? List.copyOf(files) : List.of();
    }

    /** Stops at the diff checkpoint. */
    public static FixOptions reviewOnly() {
        return new FixOptions(false, false, false, List.of());
    }

    public static FixOptions commitOnly() {
        return new FixOptions(true, false, false, List.of());
    }

    public static FixOptions fullyAutomatic() {
        return new FixOptions(true, true, true, List.of());
    }
}
