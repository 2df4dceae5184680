package com.fixforge.dispatch.cli;

import com.fixforge.core.model.Issue;
import com.fixforge.core.model.Task;
import com.fixforge.core.model.TriagedIssue;
import com.fixforge.core.platform.PlatformClient;
import com.fixforge.core.platform.PlatformException;
import com.fixforge.core.platform.RepositoryCoordinates;
import com.fixforge.core.registry.TaskRegistry;
import com.fixforge.core.triage.IssueTriageScorer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;

/**
 * CLI command: fixforge issues &lt;task-id&gt;
 * <p>
 * Fetches open issues of the task's repository and prints the easiest
 * candidates first. Without {@code --label} only issues carrying a
 * beginner-friendly label are considered.
 */
@Command(name = "issues", mixinStandardHelpOptions = true, description = "Rank open issues by difficulty")
@Component
public class IssuesCommand implements Runnable {

    /** Issues fetched per requested result, to leave room for filtering. */
    private static final int FETCH_FACTOR = 4;

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    @Option(names = {"--limit", "-n"}, description = "Number of issues to show (default: ${DEFAULT-VALUE})",
            defaultValue = "5")
    private int limit;

    @Option(names = {"--label", "-l"}, description = "Only issues with this label (repeatable)")
    private List<String> labels = new ArrayList<>();

    private final TaskRegistry registry;
    private final IssueTriageScorer scorer;
    private final PlatformClient platform;

    public IssuesCommand(TaskRegistry registry, IssueTriageScorer scorer,
                         @Autowired(required = false) PlatformClient platform) {
        this.registry = registry;
        this.scorer = scorer;
        this.platform = platform;
    }

    @Override
    public void run() {
        if (platform == null) {
            ConsoleOutput.error("No GitHub token configured. Set GITHUB_TOKEN to list issues.");
            return;
        }
        var found = registry.get(taskId);
        if (found.isEmpty()) {
            ConsoleOutput.error("Task not found: " + taskId);
            return;
        }
        Task task = found.get();
        var coordinates = RepositoryCoordinates.parse(task.getRepoUrl());
        if (coordinates.isEmpty()) {
            ConsoleOutput.error("Cannot determine owner and name from " + task.getRepoUrl());
            return;
        }
        String owner = coordinates.get().owner();
        String repo = coordinates.get().name();

        List<Issue> candidates;
        try {
            int fetch = Math.max(limit, 1) * FETCH_FACTOR;
            candidates = labels.isEmpty()
                    ? platform.goodFirstIssues(owner, repo, fetch)
                    : platform.listIssues(owner, repo, labels, "open", fetch);
        } catch (PlatformException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }

        List<TriagedIssue> best = scorer.best(candidates, limit);
        if (best.isEmpty()) {
            ConsoleOutput.info("No suitable issues found in " + coordinates.get().fullName());
            return;
        }

        System.out.printf("  %-7s %-5s %-9s %-40s %s%n", "ISSUE", "DIFF", "COMMENTS", "TITLE", "RECOMMENDATION");
        System.out.println("  " + "-".repeat(96));
        for (TriagedIssue t : best) {
            System.out.printf("  #%-6d %-5d %-9d %-40s %s%n",
                    t.number(), t.difficulty(), t.comments(),
                    ConsoleOutput.truncate(t.issue().title(), 40), t.recommendation());
        }
    }
}
