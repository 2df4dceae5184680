package com.fixforge.core.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fixforge.core.model.Task;
import com.fixforge.core.model.TaskState;

/**
 * Persisted form of one {@link Task}. Missing fields read as empty strings.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskRecord(
    @JsonProperty("id") String id,
    @JsonProperty("repo_url") String repoUrl,
    @JsonProperty("repo_name") String repoName,
    @JsonProperty("status") String status,
    @JsonProperty("local_path") String localPath,
    @JsonProperty("message") String message,
    @JsonProperty("output") String output,
    @JsonProperty("error") String error
) {
    public TaskRecord {
        id = id != null ? id : "";
        repoUrl = repoUrl != null ? repoUrl : "";
        repoName = repoName != null ? repoName : "";
        status = status != null ? status : "";
        message = message != null ? message : "";
        output = output != null ? output : "";
        error = error != null ? error : "";
    }

    /**
     * Snapshot of {@code task} with its output cut to the first {@code maxOutputChars} characters.
     */
    public static TaskRecord of(Task task, int maxOutputChars) {
        String output = task.getOutput();
        if (maxOutputChars >= 0 && output.length() > maxOutputChars) {
            output = output.substring(0, maxOutputChars);
        }
        return new TaskRecord(task.getId(), task.getRepoUrl(), task.getRepoName(),
                task.getState().value(), task.getLocalPath(), task.getMessage(), output, task.getError());
    }

    /**
     * Rebuilds the task with the state it presents after a restart: unknown
     * statuses load as PENDING and in-flight states are downgraded.
     *
     * @param fallbackId id to use when the record carries none (its map key)
     */
    public Task toTask(String fallbackId) {
        String taskId = !id.isBlank() ? id : fallbackId;
        boolean hasPath = localPath != null && !localPath.isBlank();
        TaskState state = TaskState.fromValue(status).orElse(TaskState.PENDING).recovered(hasPath);
        String name = !repoName.isBlank() || repoUrl.isBlank() ? repoName : Task.repoNameOf(repoUrl);
        return Task.restore(taskId, repoUrl, name, state, localPath, message, output, error);
    }
}
