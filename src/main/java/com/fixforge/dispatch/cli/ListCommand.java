package com.fixforge.dispatch.cli;

import com.fixforge.core.registry.TaskRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: fixforge list
 */
@Command(name = "list", mixinStandardHelpOptions = true, description = "List all tasks")
@Component
public class ListCommand implements Runnable {

    private final TaskRegistry registry;

    public ListCommand(TaskRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void run() {
        var tasks = registry.list();
        if (tasks.isEmpty()) {
            ConsoleOutput.info("No tasks. Add one with: fixforge add <repo-url>");
            return;
        }

        System.out.printf("  %-6s %-10s %-24s %s%n", "ID", "STATE", "REPOSITORY", "MESSAGE");
        System.out.println("  " + "-".repeat(72));
        for (var task : tasks) {
            System.out.printf("  %-6s %-10s %-24s %s%n",
                    task.getId(),
                    task.getState().value(),
                    ConsoleOutput.truncate(task.getRepoName(), 24),
                    ConsoleOutput.truncate(task.getMessage(), 40));
        }
    }
}
