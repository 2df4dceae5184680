package com.fixforge.core.engine;

import com.fixforge.core.config.FixforgeProperties;
import com.fixforge.core.editor.CodeEditor;
import com.fixforge.core.editor.CodeEditorFactory;
import com.fixforge.core.editor.EditorResult;
import com.fixforge.core.events.EventBus;
import com.fixforge.core.events.FixforgeEvent;
import com.fixforge.core.git.GitClient;
import com.fixforge.core.git.GitCommandException;
import com.fixforge.core.git.GitResult;
import com.fixforge.core.logging.MdcContext;
import com.fixforge.core.metrics.FixforgeMetrics;
import com.fixforge.core.model.FixAttempt;
import com.fixforge.core.model.FixOptions;
import com.fixforge.core.model.FixRequest;
import com.fixforge.core.model.Issue;
import com.fixforge.core.model.Task;
import com.fixforge.core.model.TaskState;
import com.fixforge.core.platform.PlatformException;
import com.fixforge.core.platform.RepositoryCoordinates;
import com.fixforge.core.registry.TaskNotFoundException;
import com.fixforge.core.registry.TaskRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs clone, review and fix work for registered tasks on a fixed pool of
 * worker threads.
 * <p>
 * A task runs at most one operation at a time: a second request while one is
 * in flight is rejected with {@link TaskRejectedException}. Preconditions are
 * checked on the caller's thread so the asynchronous entry points fail fast.
 */
@Service
public class TaskOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TaskOrchestrator.class);

    private final TaskRegistry registry;
    private final GitClient git;
    private final CodeEditorFactory editorFactory;
    private final FixWorkflowEngine fixEngine;
    private final EventBus eventBus;
    private final FixforgeMetrics metrics;
    private final Path workDir;
    private final ExecutorService workers;

    /** Ids of tasks with an operation claimed or running. */
    private final Set<String> running = ConcurrentHashMap.newKeySet();

    /** Editor process of each task's running review or fix step, for {@link #stop}. */
    private final Map<String, CodeEditor> activeEditors = new ConcurrentHashMap<>();

    /** Stop request of each task's claimed fix, checked by the workflow between steps. */
    private final Map<String, AtomicBoolean> stopRequests = new ConcurrentHashMap<>();

    @Autowired
    public TaskOrchestrator(TaskRegistry registry,
                            GitClient git,
                            CodeEditorFactory editorFactory,
                            FixWorkflowEngine fixEngine,
                            FixforgeProperties properties,
                            @Autowired(required = false) EventBus eventBus,
                            @Autowired(required = false) FixforgeMetrics metrics) {
        this(registry, git, editorFactory, fixEngine, Path.of(properties.getWorkDir()),
                Executors.newFixedThreadPool(Math.max(1, properties.getWorkers()), workerThreads()),
                eventBus, metrics);
    }

    TaskOrchestrator(TaskRegistry registry, GitClient git, CodeEditorFactory editorFactory,
                     FixWorkflowEngine fixEngine, Path workDir, ExecutorService workers,
                     EventBus eventBus, FixforgeMetrics metrics) {
        this.registry = registry;
        this.git = git;
        this.editorFactory = editorFactory;
        this.fixEngine = fixEngine;
        this.workDir = workDir;
        this.workers = workers;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Clones the task's repository, or pulls it when a checkout already exists.
     *
     * @return true if the task reached CLONED
     */
    public boolean cloneRepository(String taskId) {
        Task task = registry.require(taskId);
        claim(task);
        try {
            return doClone(task);
        } finally {
            release(task);
        }
    }

    /**
     * Runs the read-only repository review on a cloned task.
     *
     * @return true if the review completed
     */
    public boolean review(String taskId) {
        Task task = registry.require(taskId);
        claim(task);
        try {
            requireState(task, TaskState.REVIEWING);
            return doReview(task);
        } finally {
            release(task);
        }
    }

    /**
     * Clone followed by review when the clone succeeded, on the calling thread.
     */
    public boolean runFull(String taskId) {
        Task task = registry.require(taskId);
        claim(task);
        try {
            return doClone(task) && doReview(task);
        } finally {
            release(task);
        }
    }

    /**
     * Validates the request, then runs {@link #runFull} on a worker thread.
     *
     * @throws TaskNotFoundException if no task has this id
     * @throws TaskRejectedException if the task is already running
     */
    public Future<Boolean> runFullAsync(String taskId) {
        Task task = registry.require(taskId);
        claim(task);
        return submit(task, () -> doClone(task) && doReview(task));
    }

    /**
     * Validates the request, moves the task to FIXING and runs the fix
     * workflow on a worker thread. The attempt's outcome is folded back into
     * the task: COMPLETED on success, ERROR otherwise.
     *
     * @throws TaskNotFoundException if no task has this id
     * @throws TaskRejectedException if the task is running or has no checkout
     * @throws PlatformException     if a pull request is requested without platform credentials
     */
    public Future<FixAttempt> startFix(String taskId, Issue issue, FixOptions options) {
        Task task = registry.require(taskId);
        Callable<FixAttempt> work = prepareFix(task, issue, options);
        return submit(task, work);
    }

    /**
     * Same as {@link #startFix} but runs on the calling thread.
     */
    public FixAttempt runFix(String taskId, Issue issue, FixOptions options) {
        Task task = registry.require(taskId);
        Callable<FixAttempt> work = prepareFix(task, issue, options);
        try {
            return work.call();
        } catch (RuntimeException e) {
            log.error("Task {} failed unexpectedly", task.getId(), e);
            registry.recordError(task, e.getMessage(), "Unexpected failure: " + e.getMessage());
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Fix of task %s failed".formatted(taskId), e);
        } finally {
            release(task);
        }
    }

    /**
     * Removes a task that is not running.
     *
     * @throws TaskRejectedException if an operation is running on the task
     */
    public boolean delete(String taskId) {
        if (!running.add(taskId)) {
            throw new TaskRejectedException("Task %s is running and cannot be deleted".formatted(taskId));
        }
        try {
            return registry.delete(taskId);
        } finally {
            running.remove(taskId);
        }
    }

    /**
     * Stops the task's running work. A fix ends in ERROR before its next
     * step; the editor process of a running review or fix step is terminated.
     *
     * @return false if neither a fix nor an editor was running for the task
     */
    public boolean stop(String taskId) {
        AtomicBoolean stopRequest = stopRequests.get(taskId);
        CodeEditor editor = activeEditors.get(taskId);
        if (stopRequest == null && editor == null) {
            return false;
        }
        log.info("Stopping task {}", taskId);
        if (stopRequest != null) {
            stopRequest.set(true);
        }
        if (editor != null) {
            editor.stop();
        }
        return true;
    }

    public boolean isRunning(String taskId) {
        return running.contains(taskId);
    }

    @PreDestroy
    public void shutdown() {
        activeEditors.values().forEach(CodeEditor::stop);
        workers.shutdownNow();
    }

    private Callable<FixAttempt> prepareFix(Task task, Issue issue, FixOptions options) {
        if (issue == null) {
            throw new IllegalArgumentException("An issue is required to start a fix");
        }
        FixOptions effective = options != null ? options : FixOptions.reviewOnly();
        if (effective.autoPullRequest() && !fixEngine.hasPlatform()) {
            throw new PlatformException("Pull request requested but no platform credentials are configured");
        }
        if (!task.hasLocalPath()) {
            throw new TaskRejectedException("Task %s has not been cloned".formatted(task.getId()));
        }
        claim(task);
        try {
            requireState(task, TaskState.FIXING);
            var coordinates = RepositoryCoordinates.parse(task.getRepoUrl());
            var request = new FixRequest(task.getId(), null, Path.of(task.getLocalPath()), issue, effective,
                    coordinates.map(RepositoryCoordinates::owner).orElse(null),
                    coordinates.map(RepositoryCoordinates::name).orElse(null));
            var stopRequest = new AtomicBoolean();
            stopRequests.put(task.getId(), stopRequest);
            registry.transition(task, TaskState.FIXING, "Fixing issue #" + issue.number());
            return () -> doFix(task, request, stopRequest);
        } catch (RuntimeException e) {
            release(task);
            throw e;
        }
    }

    private boolean doClone(Task task) {
        MdcContext.setTask(task.getId());
        Path target = workDir.resolve(task.getRepoName()).toAbsolutePath();
        try {
            registry.transition(task, TaskState.CLONING, "Cloning " + GitClient.maskSensitiveData(task.getRepoUrl()));
            Files.createDirectories(workDir);

            GitResult result;
            if (Files.isDirectory(target.resolve(".git"))) {
                output(task, "Repository exists, pulling latest changes");
                result = git.run(target, "pull");
            } else {
                result = git.run(workDir, "clone", task.getRepoUrl(), target.toString());
            }

            if (!result.succeeded()) {
                recordCloneResult(false);
                registry.recordError(task, result.stderr(), "Clone failed: " + result.errorText());
                return false;
            }
            registry.setLocalPath(task, target.toString());
            registry.transition(task, TaskState.CLONED, "Clone completed");
            recordCloneResult(true);
            return true;
        } catch (IOException | GitCommandException e) {
            recordCloneResult(false);
            registry.recordError(task, e.getMessage(), "Clone failed: " + e.getMessage());
            return false;
        } finally {
            MdcContext.clear();
        }
    }

    private boolean doReview(Task task) {
        MdcContext.setTask(task.getId());
        try {
            registry.transition(task, TaskState.REVIEWING, "Starting code review");
            CodeEditor editor = editorFactory.create(Path.of(task.getLocalPath()));
            activeEditors.put(task.getId(), editor);
            EditorResult result;
            try {
                result = editor.reviewRepository(line -> output(task, line));
            } finally {
                activeEditors.remove(task.getId());
            }

            recordReviewResult(result.succeeded());
            if (result.succeeded()) {
                registry.transition(task, TaskState.COMPLETED, "Review completed");
                return true;
            }
            String error = result.exitCode() < 0 ? result.transcript() : "exit code " + result.exitCode();
            registry.recordError(task, error, "Review failed with " + error);
            return false;
        } catch (RuntimeException e) {
            recordReviewResult(false);
            registry.recordError(task, e.getMessage(), "Review failed: " + e.getMessage());
            return false;
        } finally {
            MdcContext.clear();
        }
    }

    private FixAttempt doFix(Task task, FixRequest request, AtomicBoolean stopRequest) {
        FixListener listener = new FixListener() {
            @Override
            public void onOutput(String line) {
                task.appendOutput(line);
            }
        };

        CodeEditor editor;
        try {
            editor = editorFactory.create(request.repoPath());
        } catch (RuntimeException e) {
            return fold(task, fixEngine.failBeforeStart(request, listener, "Cannot start code editor: " + e.getMessage()));
        }

        FixAttempt attempt;
        activeEditors.put(task.getId(), editor);
        try {
            attempt = fixEngine.run(request, editor, listener, stopRequest);
        } finally {
            activeEditors.remove(task.getId());
        }
        return fold(task, attempt);
    }

    private FixAttempt fold(Task task, FixAttempt attempt) {
        int number = attempt.getIssueNumber();
        if (attempt.isSuccess()) {
            registry.transition(task, TaskState.COMPLETED, describe(attempt));
        } else {
            registry.recordError(task, attempt.getError(),
                    "Fix of issue #%d failed: %s".formatted(number, attempt.getError()));
        }
        return attempt;
    }

    private static String describe(FixAttempt attempt) {
        int number = attempt.getIssueNumber();
        String branch = attempt.getBranchName();
        return switch (attempt.getState()) {
            case COMPLETED -> "Fix of issue #%d published: %s".formatted(number, attempt.getPullRequestUrl());
            case PUSHING -> "Fix of issue #%d pushed to %s".formatted(number, branch);
            case COMMITTING -> "Fix of issue #%d committed on %s".formatted(number, branch);
            default -> "Fix of issue #%d ready for review on %s".formatted(number, branch);
        };
    }

    private <T> Future<T> submit(Task task, Callable<T> work) {
        try {
            return workers.submit(() -> {
                try {
                    return work.call();
                } catch (RuntimeException e) {
                    log.error("Task {} failed unexpectedly", task.getId(), e);
                    registry.recordError(task, e.getMessage(), "Unexpected failure: " + e.getMessage());
                    throw e;
                } finally {
                    release(task);
                }
            });
        } catch (RejectedExecutionException e) {
            if (task.getState().isInFlight()) {
                registry.recordError(task, e.getMessage(), "Worker pool is not accepting work");
            }
            release(task);
            throw new TaskRejectedException("Worker pool is not accepting work", e);
        }
    }

    private void claim(Task task) {
        if (!running.add(task.getId())) {
            throw new TaskRejectedException("Task %s is already running".formatted(task.getId()));
        }
        if (task.getState().isInFlight()) {
            running.remove(task.getId());
            throw new TaskRejectedException("Task %s is %s".formatted(task.getId(), task.getState().value()));
        }
    }

    private void release(Task task) {
        stopRequests.remove(task.getId());
        running.remove(task.getId());
    }

    private static void requireState(Task task, TaskState next) {
        if (!task.getState().canTransitionTo(next)) {
            throw new TaskRejectedException("Task %s is %s and cannot start %s".formatted(
                    task.getId(), task.getState().value(), next.value()));
        }
    }

    private void output(Task task, String line) {
        task.appendOutput(line);
        if (eventBus != null) {
            eventBus.publish(FixforgeEvent.taskOutput(task.getId(), line));
        }
    }

    private void recordCloneResult(boolean success) {
        if (metrics != null) {
            metrics.recordCloneResult(success);
        }
    }

    private void recordReviewResult(boolean success) {
        if (metrics != null) {
            metrics.recordReviewResult(success);
        }
    }

    private static ThreadFactory workerThreads() {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "fixforge-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
