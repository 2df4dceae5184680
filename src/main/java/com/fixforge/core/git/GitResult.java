package com.fixforge.core.git;

/**
 * Outcome of one git invocation.
 *
 * @param exitCode process exit code
 * @param stdout   captured standard output, trailing newline removed
 * @param stderr   captured standard error, trailing newline removed
 */
public record GitResult(int exitCode, String stdout, String stderr) {

    public GitResult {
        stdout = stdout != null ? stdout : "";
        stderr = stderr != null ? stderr : "";
    }

    public static GitResult ok(String stdout) {
        return new GitResult(0, stdout, "");
    }

    public static GitResult failed(int exitCode, String stderr) {
        return new GitResult(exitCode, "", stderr);
    }

    public boolean succeeded() {
        return exitCode == 0;
    }

    /** Stderr when present, otherwise stdout; the text reported for a failure. */
    public String errorText() {
        return !stderr.isBlank() ? stderr : stdout;
    }
}
