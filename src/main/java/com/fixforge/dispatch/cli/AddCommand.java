package com.fixforge.dispatch.cli;

import com.fixforge.core.model.Task;
import com.fixforge.core.registry.TaskRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: fixforge add &lt;repo-url&gt;
 */
@Command(name = "add", mixinStandardHelpOptions = true, description = "Register a repository as a new task")
@Component
public class AddCommand implements Runnable {

    @Parameters(index = "0", description = "Clone URL of the repository")
    private String repoUrl;

    private final TaskRegistry registry;

    public AddCommand(TaskRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void run() {
        try {
            Task task = registry.create(repoUrl);
            ConsoleOutput.success("Created task %s for %s".formatted(task.getId(), task.getRepoName()));
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
        }
    }
}
