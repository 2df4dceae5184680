package com.fixforge.core.registry;

public class TaskNotFoundException extends RuntimeException {

    public TaskNotFoundException(String taskId) {
        super("Task not found: " + taskId);
    }

    public TaskNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
