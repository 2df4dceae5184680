package com.fixforge.dispatch.cli;

import com.fixforge.core.engine.TaskOrchestrator;
import com.fixforge.core.engine.TaskRejectedException;
import com.fixforge.core.events.EventBus;
import com.fixforge.core.model.Task;
import com.fixforge.core.registry.TaskNotFoundException;
import com.fixforge.core.registry.TaskRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: fixforge run &lt;task-id&gt;
 * <p>
 * Clones (or updates) the task's repository and runs the code review,
 * streaming progress to the terminal.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Clone and review a task's repository")
@Component
public class RunCommand implements Runnable {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    private final TaskOrchestrator orchestrator;
    private final TaskRegistry registry;
    private final EventBus eventBus;

    public RunCommand(TaskOrchestrator orchestrator, TaskRegistry registry,
                      @Autowired(required = false) EventBus eventBus) {
        this.orchestrator = orchestrator;
        this.registry = registry;
        this.eventBus = eventBus;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        EventBus.Subscription subscription = eventBus != null
                ? eventBus.subscribe(taskId, ConsoleOutput::watchEvent)
                : null;
        try {
            boolean ok = orchestrator.runFull(taskId);
            Task task = registry.require(taskId);
            System.out.println(ConsoleOutput.RULE);
            if (ok) {
                ConsoleOutput.success("Task %s: %s".formatted(taskId, task.getMessage()));
            } else {
                ConsoleOutput.error("Task %s: %s".formatted(taskId, task.getMessage()));
            }
        } catch (TaskNotFoundException | TaskRejectedException e) {
            ConsoleOutput.error(e.getMessage());
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }
    }
}
