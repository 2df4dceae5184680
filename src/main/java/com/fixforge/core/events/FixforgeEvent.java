package com.fixforge.core.events;

import com.fixforge.core.model.FixState;
import com.fixforge.core.model.TaskState;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A progress notification emitted while a task or fix attempt runs.
 *
 * @param eventType  one of {@code task.status}, {@code task.output}, {@code fix.status}, {@code fix.output}
 * @param taskId     the task this event belongs to (nullable for standalone fix attempts)
 * @param workflowId the fix attempt this event relates to (nullable for task-level events)
 * @param payload    event data: {@code state} and {@code message}, or {@code line}
 * @param timestamp  when the event occurred
 */
public record FixforgeEvent(
    String eventType,
    String taskId,
    String workflowId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String TASK_STATUS = "task.status";
    public static final String TASK_OUTPUT = "task.output";
    public static final String FIX_STATUS = "fix.status";
    public static final String FIX_OUTPUT = "fix.output";

    public FixforgeEvent {
        payload = payload != null ? Map.copyOf(payload) : Map.of();
        timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public static FixforgeEvent taskStatus(String taskId, TaskState state, String message) {
        return new FixforgeEvent(TASK_STATUS, taskId, null,
                Map.of("state", state.value(), "message", message != null ? message : ""), Instant.now());
    }

    public static FixforgeEvent taskOutput(String taskId, String line) {
        return new FixforgeEvent(TASK_OUTPUT, taskId, null,
                Map.of("line", line != null ? line : ""), Instant.now());
    }

    public static FixforgeEvent fixStatus(String taskId, String workflowId, FixState state, String message) {
        return new FixforgeEvent(FIX_STATUS, taskId, workflowId,
                Map.of("state", state.value(), "message", message != null ? message : ""), Instant.now());
    }

    public static FixforgeEvent fixOutput(String taskId, String workflowId, String line) {
        return new FixforgeEvent(FIX_OUTPUT, taskId, workflowId,
                Map.of("line", line != null ? line : ""), Instant.now());
    }

    /** Routing key: the task id, or the workflow id for standalone attempts. */
    public String channel() {
        return taskId != null ? taskId : workflowId;
    }
}
