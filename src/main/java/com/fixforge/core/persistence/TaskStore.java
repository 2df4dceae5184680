package com.fixforge.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fixforge.core.config.FixforgeProperties;
import com.fixforge.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.LinkedHashMap;

/**
 * Reads and writes the task set as the {@code tasks} document of a {@link DocumentStore}.
 */
@Component
public class TaskStore {

    private static final Logger log = LoggerFactory.getLogger(TaskStore.class);
    static final String DOCUMENT_NAME = "tasks";

    private final DocumentStore store;
    private final int maxOutputChars;
    private final ObjectMapper objectMapper;

    @Autowired
    public TaskStore(DocumentStore store, FixforgeProperties properties) {
        this(store, properties.getStore().getMaxOutputChars());
    }

    public TaskStore(DocumentStore store, int maxOutputChars) {
        this.store = store;
        this.maxOutputChars = maxOutputChars;
        this.objectMapper = store.objectMapper();
    }

    /**
     * Writes every task plus the id high-water mark.
     *
     * @return false if the write failed; the caller's in-memory state is unaffected
     */
    public boolean saveTasks(Collection<Task> tasks, long lastId) {
        var records = new LinkedHashMap<String, TaskRecord>();
        for (Task task : tasks) {
            records.put(task.getId(), TaskRecord.of(task, maxOutputChars));
        }
        var document = new TasksDocument(TasksDocument.CURRENT_VERSION,
                LocalDateTime.now().toString(), lastId, records);
        JsonNode node = objectMapper.valueToTree(document);
        return store.save(DOCUMENT_NAME, node);
    }

    /**
     * Loads the task document, or an empty one when none exists or it cannot be read.
     */
    public TasksDocument load() {
        JsonNode node = store.load(DOCUMENT_NAME, null);
        if (node == null || !node.isObject()) {
            return TasksDocument.empty();
        }
        try {
            TasksDocument document = objectMapper.treeToValue(node, TasksDocument.class);
            if (document.version() > TasksDocument.CURRENT_VERSION) {
                log.warn("Task document version {} is newer than supported version {}, reading known fields",
                        document.version(), TasksDocument.CURRENT_VERSION);
            }
            return document;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Failed to decode task document, starting empty", e);
            return TasksDocument.empty();
        }
    }

    /**
     * Highest id in use or ever allocated: the larger of the numeric task ids
     * and the stored high-water mark. Non-numeric ids are ignored.
     */
    public long lastTaskId() {
        return lastTaskId(load());
    }

    public static long lastTaskId(TasksDocument document) {
        long max = document.lastId();
        for (String id : document.tasks().keySet()) {
            try {
                max = Math.max(max, Long.parseLong(id.trim()));
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric task id '{}' for counter recovery", id);
            }
        }
        return max;
    }
}
