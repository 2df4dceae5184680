package com.fixforge.core.model;

import java.util.Objects;

/**
 * One repository under management: its source URL, local checkout and the
 * status of the latest clone, review or fix run.
 * <p>
 * Instances are owned by the task registry and mutated in place by the worker
 * thread running an operation; accessors are synchronized so other threads
 * observe consistent values.
 */
public class Task {

    private final String id;
    private final String repoUrl;
    private final String repoName;

    private TaskState state;
    private String localPath;
    private String message;
    private final StringBuilder output;
    private String error;

    public Task(String id, String repoUrl, String repoName) {
        this(id, repoUrl, repoName, TaskState.PENDING, null, "", "", "");
    }

    private Task(String id, String repoUrl, String repoName, TaskState state,
                 String localPath, String message, String output, String error) {
        this.id = Objects.requireNonNull(id, "id");
        this.repoUrl = repoUrl != null ? repoUrl : "";
        this.repoName = repoName != null ? repoName : "";
        this.state = state;
        this.localPath = localPath;
        this.message = message != null ? message : "";
        this.output = new StringBuilder(output != null ? output : "");
        this.error = error != null ? error : "";
    }

    /**
     * Rebuilds a task from its persisted form without transition checks.
     */
    public static Task restore(String id, String repoUrl, String repoName, TaskState state,
                               String localPath, String message, String output, String error) {
        String path = localPath != null && !localPath.isBlank() ? localPath : null;
        return new Task(id, repoUrl, repoName, state, path, message, output, error);
    }

    /**
     * Derives the short repository name from its URL: the last path segment
     * without a trailing slash or {@code .git} suffix.
     */
    public static String repoNameOf(String url) {
        String trimmed = url.strip();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (trimmed.endsWith(".git")) {
            trimmed = trimmed.substring(0, trimmed.length() - 4);
        }
        int slash = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf(':'));
        return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
    }

    public String getId() { return id; }
    public String getRepoUrl() { return repoUrl; }
    public String getRepoName() { return repoName; }

    public synchronized TaskState getState() { return state; }
    public synchronized String getLocalPath() { return localPath; }
    public synchronized String getMessage() { return message; }
    public synchronized String getOutput() { return output.toString(); }
    public synchronized String getError() { return error; }

    public synchronized boolean hasLocalPath() {
        return localPath != null;
    }

    /**
     * Moves the task to {@code next}, rejecting edges the state table does not allow.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public synchronized void transitionTo(TaskState next, String message) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Task %s cannot move from %s to %s".formatted(id, state, next));
        }
        this.state = next;
        this.message = message != null ? message : "";
    }

    public synchronized void setLocalPath(String localPath) {
        this.localPath = localPath;
    }

    public synchronized void setError(String error) {
        this.error = error != null ? error : "";
    }

    /** Appends one line to the in-memory output log. Not persisted until the next save. */
    public synchronized void appendOutput(String line) {
        output.append(line).append('\n');
    }

    @Override
    public synchronized String toString() {
        return "Task[" + id + ", " + repoName + ", " + state + "]";
    }
}
