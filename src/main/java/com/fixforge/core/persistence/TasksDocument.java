package com.fixforge.core.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The {@code tasks.json} document.
 *
 * @param version   schema version; documents written before versioning read as 1
 * @param updatedAt ISO-8601 time of the last save
 * @param lastId    highest id ever allocated, so deleted ids are not reused after a restart
 * @param tasks     task records keyed by id
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TasksDocument(
    @JsonProperty("version") Integer version,
    @JsonProperty("updated_at") String updatedAt,
    @JsonProperty("last_id") Long lastId,
    @JsonProperty("tasks") Map<String, TaskRecord> tasks
) {
    public static final int CURRENT_VERSION = 1;

    public TasksDocument {
        version = version != null ? version : CURRENT_VERSION;
        updatedAt = updatedAt != null ? updatedAt : "";
        lastId = lastId != null ? lastId : 0L;
        tasks = tasks != null ? new LinkedHashMap<>(tasks) : new LinkedHashMap<>();
    }

    public static TasksDocument empty() {
        return new TasksDocument(CURRENT_VERSION, "", 0L, Map.of());
    }
}
