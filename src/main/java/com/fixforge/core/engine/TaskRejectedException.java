package com.fixforge.core.engine;

/**
 * A run was requested on a task that cannot accept it: already running, or
 * not yet cloned.
 */
public class TaskRejectedException extends RuntimeException {

    public TaskRejectedException(String message) {
        super(message);
    }

    public TaskRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
