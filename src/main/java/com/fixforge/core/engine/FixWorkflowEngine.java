package com.fixforge.core.engine;

import com.fixforge.core.editor.CodeEditor;
import com.fixforge.core.editor.CodeEditorFactory;
import com.fixforge.core.editor.EditorResult;
import com.fixforge.core.events.EventBus;
import com.fixforge.core.events.FixforgeEvent;
import com.fixforge.core.git.GitClient;
import com.fixforge.core.git.GitResult;
import com.fixforge.core.logging.MdcContext;
import com.fixforge.core.metrics.FixforgeMetrics;
import com.fixforge.core.model.FixAttempt;
import com.fixforge.core.model.FixRequest;
import com.fixforge.core.model.FixState;
import com.fixforge.core.model.Issue;
import com.fixforge.core.model.ReviewFinding;
import com.fixforge.core.model.ReviewReport;
import com.fixforge.core.platform.PlatformClient;
import com.fixforge.core.platform.PullRequestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one fix attempt in a local checkout:
 * branch, fix, capture and review the diff, then optionally commit, push and
 * open a pull request.
 * <p>
 * The attempt stops with success at the first checkpoint the request does
 * not authorise past (diff ready, committed, pushed). {@link #run} never
 * throws; every failure ends in {@link FixState#ERROR} with the error text
 * recorded on the returned {@link FixAttempt}.
 */
@Service
public class FixWorkflowEngine {

    private static final Logger log = LoggerFactory.getLogger(FixWorkflowEngine.class);

    static final String NO_CHANGES = "no changes detected";
    static final String STOPPED = "Stopped by caller";
    static final String FALLBACK_BRANCH = "main";

    private final GitClient git;
    private final CodeEditorFactory editorFactory;
    private final PlatformClient platform;
    private final EventBus eventBus;
    private final FixforgeMetrics metrics;
    private final ReviewParser reviewParser = new ReviewParser();

    public FixWorkflowEngine(GitClient git,
                             CodeEditorFactory editorFactory,
                             @Autowired(required = false) PlatformClient platform,
                             @Autowired(required = false) EventBus eventBus,
                             @Autowired(required = false) FixforgeMetrics metrics) {
        this.git = git;
        this.editorFactory = editorFactory;
        this.platform = platform;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public boolean hasPlatform() {
        return platform != null;
    }

    /**
     * Runs the attempt with an editor created for the request's checkout.
     */
    public FixAttempt run(FixRequest request, FixListener listener) {
        CodeEditor editor;
        try {
            editor = editorFactory.create(request.repoPath());
        } catch (RuntimeException e) {
            return failBeforeStart(request, listener, "Cannot start code editor: " + e.getMessage());
        }
        return run(request, editor, listener);
    }

    /**
     * Records an attempt that failed before its first step, notifying the
     * listener and the bus as a failed run would.
     */
    FixAttempt failBeforeStart(FixRequest request, FixListener listener, String error) {
        Issue issue = request.issue();
        var attempt = new FixAttempt(request.workflowId(), issue.number(), issue.title());
        new Run(request, attempt, listener != null ? listener : FixListener.NONE, new AtomicBoolean()).fail(error);
        if (metrics != null) {
            metrics.recordFixResult(attempt.getState(), 0);
        }
        return attempt;
    }

    public FixAttempt run(FixRequest request, CodeEditor editor, FixListener listener) {
        return run(request, editor, listener, new AtomicBoolean());
    }

    /**
     * Runs the attempt with the given editor. Setting {@code stopRequested}
     * from another thread ends the attempt in ERROR before its next step;
     * stopping the editor as well aborts a fix or review in progress.
     */
    public FixAttempt run(FixRequest request, CodeEditor editor, FixListener listener, AtomicBoolean stopRequested) {
        Issue issue = request.issue();
        var attempt = new FixAttempt(request.workflowId(), issue.number(), issue.title());
        var run = new Run(request, attempt, listener != null ? listener : FixListener.NONE, stopRequested);
        long start = System.currentTimeMillis();

        MdcContext.setFix(request.taskId(), request.workflowId(), issue.number());
        try {
            log.info("Starting fix of issue #{} in {}", issue.number(), request.repoPath());
            run.execute(editor);
        } catch (FixStepException e) {
            run.fail(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure fixing issue #{}", issue.number(), e);
            run.fail(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } finally {
            long elapsed = System.currentTimeMillis() - start;
            if (metrics != null) {
                metrics.recordFixResult(attempt.getState(), elapsed);
            }
            log.info("Fix of issue #{} finished in state {} (success={}, {}ms)",
                    issue.number(), attempt.getState(), attempt.isSuccess(), elapsed);
            MdcContext.clear();
        }
        return attempt;
    }

    /** Per-attempt mutable state; one instance per call to {@link #run}. */
    private final class Run {

        private final FixRequest request;
        private final FixAttempt attempt;
        private final FixListener listener;
        private final Path repo;
        private final Issue issue;
        private final AtomicBoolean stopRequested;

        Run(FixRequest request, FixAttempt attempt, FixListener listener, AtomicBoolean stopRequested) {
            this.request = request;
            this.attempt = attempt;
            this.listener = listener;
            this.stopRequested = stopRequested;
            this.repo = request.repoPath();
            this.issue = request.issue();
        }

        void execute(CodeEditor editor) {
            String branch = "fix/issue-" + issue.number();
            status(FixState.BRANCHING, "Creating branch " + branch);
            String defaultBranch = defaultBranch();
            createBranch(defaultBranch, branch);
            attempt.setBranchName(branch);
            line("Checked out branch " + branch);

            status(FixState.FIXING, "Editor is analysing and fixing the issue");
            EditorResult fix = editor.fixIssue(issue.title(), issue.body(), request.options().files(), this::line);
            checkStopped();
            if (!fix.succeeded()) {
                throw new FixStepException("Code editor failed with exit code " + fix.exitCode());
            }
            line("Code editor finished");

            status(FixState.REVIEWING, "Capturing changes");
            String diff = captureDiff();
            attempt.setDiff(diff);
            line("=== Git Diff ===\n" + diff);

            if (!diff.isBlank() && !NO_CHANGES.equals(diff)) {
                status(FixState.REVIEWING, "Reviewing changes");
                review(editor, diff);
            } else {
                log.warn("Issue #{}: {}", issue.number(), NO_CHANGES);
            }

            status(FixState.DIFF_READY, "Fix ready for confirmation");
            if (!request.options().autoCommit()) {
                attempt.succeed();
                return;
            }

            status(FixState.COMMITTING, "Committing changes");
            commit();
            if (!request.options().autoPush()) {
                attempt.succeed();
                return;
            }

            status(FixState.PUSHING, "Pushing branch " + branch);
            GitResult push = git.run(repo, "push", "-u", "origin", branch);
            if (!push.succeeded()) {
                throw new FixStepException("Push failed: " + push.errorText());
            }
            line("Pushed to origin/" + branch);
            if (!request.options().autoPullRequest() || !request.hasPlatformTarget()) {
                attempt.succeed();
                return;
            }

            status(FixState.CREATING_PR, "Creating pull request");
            PullRequestInfo pr = createPullRequest(branch, defaultBranch);
            attempt.setPullRequestUrl(pr.url());
            line("Pull request created: " + pr.url());

            attempt.succeed();
            attempt.advance(FixState.COMPLETED);
            notifyStatus(FixState.COMPLETED, "Fix completed");
        }

        private String defaultBranch() {
            GitResult result = git.run(repo, "symbolic-ref", "refs/remotes/origin/HEAD", "--short");
            if (!result.succeeded() || result.stdout().isBlank()) {
                return FALLBACK_BRANCH;
            }
            return result.stdout().strip().replace("origin/", "");
        }

        private void createBranch(String defaultBranch, String branch) {
            GitResult checkout = git.run(repo, "checkout", defaultBranch);
            if (!checkout.succeeded()) {
                log.warn("Could not check out {}: {}", defaultBranch, checkout.errorText());
            }
            GitResult pull = git.run(repo, "pull", "origin", defaultBranch);
            if (!pull.succeeded()) {
                log.warn("Could not update {}: {}", defaultBranch, pull.errorText());
            }

            GitResult exists = git.run(repo, "show-ref", "--verify", "refs/heads/" + branch);
            GitResult switched = exists.succeeded()
                    ? git.run(repo, "checkout", branch)
                    : git.run(repo, "checkout", "-b", branch);
            if (!switched.succeeded()) {
                throw new FixStepException("Failed to create branch %s: %s".formatted(branch, switched.errorText()));
            }
        }

        private String captureDiff() {
            GitResult staged = git.run(repo, "diff", "--cached");
            GitResult unstaged = git.run(repo, "diff");

            var diff = new StringBuilder();
            if (!staged.stdout().isEmpty()) {
                diff.append("=== Staged Changes ===\n").append(staged.stdout()).append('\n');
            }
            if (!unstaged.stdout().isEmpty()) {
                diff.append("=== Unstaged Changes ===\n").append(unstaged.stdout()).append('\n');
            }
            if (diff.isEmpty()) {
                GitResult status = git.run(repo, "status", "--porcelain");
                if (!status.stdout().isEmpty()) {
                    diff.append("=== File Status ===\n").append(status.stdout());
                }
            }
            return diff.isEmpty() ? NO_CHANGES : diff.toString();
        }

        private void review(CodeEditor editor, String diff) {
            EditorResult result = editor.reviewDiff(diff, this::line);
            checkStopped();
            if (!result.succeeded()) {
                log.warn("Review of issue #{} exited with code {}", issue.number(), result.exitCode());
            }
            line("Code review finished");

            Optional<ReviewReport> report = reviewParser.parse(result.transcript());
            if (report.isEmpty()) {
                if (!result.transcript().isBlank()) {
                    log.info("Review output present but no structured result found");
                }
                return;
            }
            attempt.setReview(report.get());
            List<ReviewFinding> critical = report.get().highPriorityFindings();
            if (!critical.isEmpty()) {
                line("Warning: %d high-priority finding(s)".formatted(critical.size()));
                for (ReviewFinding finding : critical) {
                    line("  - [P%d] %s".formatted(finding.priority(), finding.title()));
                }
            }
            line("Review verdict: " + report.get().overallCorrectness());
        }

        private void commit() {
            GitResult add = git.run(repo, "add", "-A");
            if (!add.succeeded()) {
                throw new FixStepException("Failed to stage changes: " + add.errorText());
            }
            String message = "fix: resolve issue #%d - %s".formatted(issue.number(), issue.title());
            GitResult commit = git.run(repo, "commit", "-m", message);
            if (commit.succeeded()) {
                line("Committed: " + message);
                return;
            }
            if (commit.stdout().contains("nothing to commit") || commit.stderr().contains("nothing to commit")) {
                log.warn("Issue #{}: nothing to commit", issue.number());
                line("Warning: no changes to commit");
                return;
            }
            throw new FixStepException("Commit failed: " + commit.errorText());
        }

        private PullRequestInfo createPullRequest(String branch, String base) {
            if (platform == null) {
                throw new FixStepException("No platform client configured");
            }
            String owner = request.owner();
            String repoName = request.repository();
            String title = "Fix #%d: %s".formatted(issue.number(), issue.title());
            String body = """
                    ## Summary
                    This PR fixes #%d.

                    ## Changes
                    - Automated fix generated by the code editor

                    ## Related Issue
                    Closes #%d
                    """.formatted(issue.number(), issue.number());
            try {
                String user = platform.currentIdentity();
                String head = user + ":" + branch;
                try {
                    if (user.equalsIgnoreCase(platform.repositoryOwner(owner, repoName))) {
                        head = branch;
                    }
                } catch (RuntimeException e) {
                    log.debug("Could not resolve owner of {}/{}, using prefixed head: {}", owner, repoName, e.getMessage());
                }
                return platform.createPullRequest(owner, repoName, title, body, head, base);
            } catch (RuntimeException e) {
                throw new FixStepException("Failed to create pull request: " + e.getMessage());
            }
        }

        void fail(String error) {
            attempt.fail(error);
            String message = "Error: " + error;
            line(message);
            notifyStatus(FixState.ERROR, message);
            log.error("Fix of issue #{} failed: {}", issue.number(), error);
        }

        private void checkStopped() {
            if (stopRequested.get()) {
                throw new FixStepException(STOPPED);
            }
        }

        private void status(FixState state, String message) {
            checkStopped();
            attempt.advance(state);
            notifyStatus(state, message);
        }

        private void notifyStatus(FixState state, String message) {
            log.info("[{}] {}", state, message);
            deliver(() -> listener.onStatus(state, message));
            publish(FixforgeEvent.fixStatus(request.taskId(), request.workflowId(), state, message));
        }

        private void line(String text) {
            attempt.appendLog(text);
            deliver(() -> listener.onOutput(text));
            publish(FixforgeEvent.fixOutput(request.taskId(), request.workflowId(), text));
        }

        private void deliver(Runnable callback) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.warn("Fix listener threw exception: {}", e.getMessage(), e);
            }
        }

        private void publish(FixforgeEvent event) {
            if (eventBus != null) {
                eventBus.publish(event);
            }
        }
    }

    /** A step failed; the message becomes the attempt's error text. */
    private static final class FixStepException extends RuntimeException {
        FixStepException(String message) {
            super(message);
        }
    }
}
