package com.fixforge.dispatch.cli;

import com.fixforge.core.engine.TaskOrchestrator;
import com.fixforge.core.engine.TaskRejectedException;
import com.fixforge.core.events.EventBus;
import com.fixforge.core.model.FixAttempt;
import com.fixforge.core.model.FixOptions;
import com.fixforge.core.model.Issue;
import com.fixforge.core.model.ReviewFinding;
import com.fixforge.core.model.Task;
import com.fixforge.core.platform.PlatformClient;
import com.fixforge.core.platform.PlatformException;
import com.fixforge.core.platform.RepositoryCoordinates;
import com.fixforge.core.registry.TaskNotFoundException;
import com.fixforge.core.registry.TaskRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * CLI command: fixforge fix &lt;task-id&gt; &lt;issue-number&gt;
 * <p>
 * Runs the fix workflow for one issue. By default it stops once the diff is
 * ready; {@code --commit}, {@code --push} and {@code --pr} let it go further,
 * each implying the previous ones.
 */
@Command(name = "fix", mixinStandardHelpOptions = true, description = "Fix an issue in a cloned task")
@Component
public class FixCommand implements Runnable {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    @Parameters(index = "1", description = "Issue number")
    private int issueNumber;

    @Option(names = "--commit", description = "Commit the fix")
    private boolean commit;

    @Option(names = "--push", description = "Commit and push the fix branch")
    private boolean push;

    @Option(names = "--pr", description = "Commit, push and open a pull request")
    private boolean pullRequest;

    @Option(names = {"--file", "-f"}, description = "File to hand to the code editor (repeatable)")
    private List<String> files = new ArrayList<>();

    @Option(names = "--title", description = "Issue title, when no GitHub token is configured")
    private String title;

    @Option(names = "--body", description = "Issue description, when no GitHub token is configured")
    private String body;

    private final TaskOrchestrator orchestrator;
    private final TaskRegistry registry;
    private final EventBus eventBus;
    private final PlatformClient platform;

    public FixCommand(TaskOrchestrator orchestrator, TaskRegistry registry,
                      @Autowired(required = false) EventBus eventBus,
                      @Autowired(required = false) PlatformClient platform) {
        this.orchestrator = orchestrator;
        this.registry = registry;
        this.eventBus = eventBus;
        this.platform = platform;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        var found = registry.get(taskId);
        if (found.isEmpty()) {
            ConsoleOutput.error("Task not found: " + taskId);
            return;
        }

        Optional<Issue> issue;
        try {
            issue = resolveIssue(found.get());
        } catch (PlatformException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }
        if (issue.isEmpty()) {
            ConsoleOutput.error("Issue #%d not found. Without a GitHub token pass --title and --body."
                    .formatted(issueNumber));
            return;
        }

        boolean autoPr = pullRequest;
        boolean autoPush = push || autoPr;
        boolean autoCommit = commit || autoPush;
        var options = new FixOptions(autoCommit, autoPush, autoPr, files);

        EventBus.Subscription subscription = eventBus != null
                ? eventBus.subscribe(taskId, ConsoleOutput::watchEvent)
                : null;
        try {
            FixAttempt attempt = orchestrator.runFix(taskId, issue.get(), options);
            printResult(attempt);
        } catch (TaskNotFoundException | TaskRejectedException | PlatformException e) {
            ConsoleOutput.error(e.getMessage());
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }
    }

    private Optional<Issue> resolveIssue(Task task) {
        if (title != null && !title.isBlank()) {
            return Optional.of(Issue.of(issueNumber, title, body));
        }
        if (platform == null) {
            return Optional.empty();
        }
        var coordinates = RepositoryCoordinates.parse(task.getRepoUrl());
        if (coordinates.isEmpty()) {
            return Optional.empty();
        }
        return platform.findIssue(coordinates.get().owner(), coordinates.get().name(), issueNumber);
    }

    private void printResult(FixAttempt attempt) {
        System.out.println(ConsoleOutput.RULE);
        if (!attempt.isSuccess()) {
            ConsoleOutput.error("Fix failed in state %s: %s".formatted(attempt.getState(), attempt.getError()));
            return;
        }

        ConsoleOutput.info("Branch: " + attempt.getBranchName());
        attempt.getDiff().lines().forEach(ConsoleOutput::diffLine);
        attempt.getReview().ifPresent(review -> {
            ConsoleOutput.info("Review verdict: " + review.overallCorrectness());
            for (ReviewFinding finding : review.highPriorityFindings()) {
                ConsoleOutput.warn("[P%d] %s".formatted(finding.priority(), finding.title()));
            }
        });

        if (!attempt.getPullRequestUrl().isEmpty()) {
            ConsoleOutput.success("Pull request: " + attempt.getPullRequestUrl());
        } else {
            ConsoleOutput.success("Fix stopped at %s".formatted(attempt.getState().value()));
        }
    }
}
