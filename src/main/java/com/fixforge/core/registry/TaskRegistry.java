package com.fixforge.core.registry;

import com.fixforge.core.events.EventBus;
import com.fixforge.core.events.FixforgeEvent;
import com.fixforge.core.metrics.FixforgeMetrics;
import com.fixforge.core.model.Task;
import com.fixforge.core.model.TaskState;
import com.fixforge.core.persistence.TaskRecord;
import com.fixforge.core.persistence.TaskStore;
import com.fixforge.core.persistence.TasksDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns every {@link Task}: allocates ids, applies state transitions and
 * persists the full task set after each change.
 * <p>
 * The id counter and the map are guarded by one lock held only for the
 * in-memory mutation. Saves run under a separate persistence lock that also
 * covers taking the snapshot, so snapshots reach the store in the order they
 * were taken.
 */
@Service
public class TaskRegistry {

    private static final Logger log = LoggerFactory.getLogger(TaskRegistry.class);

    private static final Comparator<Task> BY_NUMERIC_ID = Comparator
            .comparing((Task t) -> numericId(t.getId()) < 0)
            .thenComparingLong(t -> numericId(t.getId()))
            .thenComparing(Task::getId);

    private final TaskStore store;
    private final FixforgeMetrics metrics;
    private final EventBus eventBus;

    private final Object lock = new Object();
    private final Object persistLock = new Object();
    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private long counter;

    @Autowired
    public TaskRegistry(TaskStore store,
                        @Autowired(required = false) FixforgeMetrics metrics,
                        @Autowired(required = false) EventBus eventBus) {
        this.store = store;
        this.metrics = metrics;
        this.eventBus = eventBus;
        load();
    }

    public TaskRegistry(TaskStore store) {
        this(store, null, null);
    }

    private void load() {
        TasksDocument document = store.load();
        int downgraded = 0;
        synchronized (lock) {
            for (Map.Entry<String, TaskRecord> entry : document.tasks().entrySet()) {
                TaskRecord record = entry.getValue();
                if (record == null) {
                    log.warn("Skipping empty record for task {}", entry.getKey());
                    continue;
                }
                Task task;
                try {
                    task = record.toTask(entry.getKey());
                } catch (RuntimeException e) {
                    log.warn("Skipping unreadable record for task {}: {}", entry.getKey(), e.getMessage());
                    continue;
                }
                if (TaskState.fromValue(record.status()).map(TaskState::isInFlight).orElse(false)) {
                    downgraded++;
                }
                tasks.put(task.getId(), task);
            }
            counter = Math.max(counter, TaskStore.lastTaskId(document));
        }
        log.info("Loaded {} task(s), next id {}, {} in-flight task(s) recovered",
                tasks.size(), counter + 1, downgraded);
    }

    /**
     * Registers a repository and returns its task in PENDING.
     *
     * @throws IllegalArgumentException if {@code repoUrl} is blank
     */
    public Task create(String repoUrl) {
        if (repoUrl == null || repoUrl.isBlank()) {
            throw new IllegalArgumentException("Repository URL must not be blank");
        }
        String url = repoUrl.strip();
        Task task;
        synchronized (lock) {
            counter++;
            task = new Task(String.valueOf(counter), url, Task.repoNameOf(url));
            tasks.put(task.getId(), task);
        }
        persist();
        if (metrics != null) {
            metrics.recordTaskCreated();
        }
        log.info("Created task {} for {}", task.getId(), task.getRepoName());
        return task;
    }

    public Optional<Task> get(String id) {
        synchronized (lock) {
            return Optional.ofNullable(tasks.get(id));
        }
    }

    /**
     * @throws TaskNotFoundException if no task has this id
     */
    public Task require(String id) {
        return get(id).orElseThrow(() -> new TaskNotFoundException(id));
    }

    /** All tasks ordered by numeric id; non-numeric ids sort last. */
    public List<Task> list() {
        List<Task> snapshot;
        synchronized (lock) {
            snapshot = new ArrayList<>(tasks.values());
        }
        snapshot.sort(BY_NUMERIC_ID);
        return snapshot;
    }

    /**
     * Removes a task. Its id is never handed out again.
     *
     * @return false if no task had this id
     */
    public boolean delete(String id) {
        Task removed;
        synchronized (lock) {
            removed = tasks.remove(id);
        }
        if (removed == null) {
            return false;
        }
        persist();
        log.info("Deleted task {}", id);
        return true;
    }

    /**
     * Moves {@code task} to {@code state}, persists and publishes a status event.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public void transition(Task task, TaskState state, String message) {
        task.transitionTo(state, message);
        persist();
        log.debug("Task {} -> {}: {}", task.getId(), state, message);
        publish(FixforgeEvent.taskStatus(task.getId(), state, message));
    }

    /**
     * Records a failure and moves the task to ERROR. A task already in a
     * terminal state keeps it and only gets the error text.
     */
    public void recordError(Task task, String error, String message) {
        task.setError(error);
        if (task.getState().canTransitionTo(TaskState.ERROR)) {
            task.transitionTo(TaskState.ERROR, message);
        } else {
            log.warn("Task {} is {}, recording error without transition", task.getId(), task.getState());
        }
        persist();
        log.warn("Task {} failed: {}", task.getId(), message);
        publish(FixforgeEvent.taskStatus(task.getId(), task.getState(), message));
    }

    public void setLocalPath(Task task, String localPath) {
        task.setLocalPath(localPath);
        persist();
    }

    /**
     * Flushes the current task set, including output appended since the last change.
     */
    public boolean save() {
        return persist();
    }

    /** Highest id allocated so far. */
    public long lastId() {
        synchronized (lock) {
            return counter;
        }
    }

    private boolean persist() {
        synchronized (persistLock) {
            List<Task> snapshot;
            long lastId;
            synchronized (lock) {
                snapshot = new ArrayList<>(tasks.values());
                lastId = counter;
            }
            boolean saved = store.saveTasks(snapshot, lastId);
            if (!saved) {
                log.warn("Task set could not be persisted; continuing with in-memory state");
            }
            return saved;
        }
    }

    private void publish(FixforgeEvent event) {
        if (eventBus != null) {
            eventBus.publish(event);
        }
    }

    private static long numericId(String id) {
        try {
            return Long.parseLong(id.trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
