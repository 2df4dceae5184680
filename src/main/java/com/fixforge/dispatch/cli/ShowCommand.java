package com.fixforge.dispatch.cli;

import com.fixforge.core.model.Task;
import com.fixforge.core.registry.TaskRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: fixforge show &lt;task-id&gt;
 * <p>
 * Prints a task's details and, with {@code --output}, its accumulated output.
 */
@Command(name = "show", mixinStandardHelpOptions = true, description = "Show task details")
@Component
public class ShowCommand implements Runnable {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    @Option(names = {"--output", "-o"}, description = "Print the accumulated output")
    private boolean showOutput;

    private final TaskRegistry registry;

    public ShowCommand(TaskRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void run() {
        var found = registry.get(taskId);
        if (found.isEmpty()) {
            ConsoleOutput.error("Task not found: " + taskId);
            return;
        }
        Task task = found.get();

        System.out.println("TASK " + task.getId());
        System.out.println("Repository: " + task.getRepoUrl());
        System.out.println("Name: " + task.getRepoName());
        System.out.println("Local path: " + (task.hasLocalPath() ? task.getLocalPath() : "-"));
        ConsoleOutput.state(task.getState(), task.getMessage());
        if (!task.getError().isBlank()) {
            ConsoleOutput.error("Error: " + task.getError());
        }

        if (showOutput) {
            System.out.println(ConsoleOutput.RULE);
            String output = task.getOutput();
            System.out.println(output.isEmpty() ? "(no output)" : output);
        }
    }
}
