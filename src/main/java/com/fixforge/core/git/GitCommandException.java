package com.fixforge.core.git;

/**
 * Thrown when the git executable cannot be started or is interrupted.
 * A command that runs and exits non-zero is reported through {@link GitResult} instead.
 */
public class GitCommandException extends RuntimeException {

    public GitCommandException(String message) {
        super(message);
    }

    public GitCommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
