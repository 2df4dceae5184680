package com.fixforge.dispatch.cli;

import com.fixforge.core.engine.TaskOrchestrator;
import com.fixforge.core.engine.TaskRejectedException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: fixforge delete &lt;task-id&gt;
 * <p>
 * Removes the task record. The local checkout is left on disk.
 */
@Command(name = "delete", mixinStandardHelpOptions = true, description = "Delete a task")
@Component
public class DeleteCommand implements Runnable {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    private final TaskOrchestrator orchestrator;

    public DeleteCommand(TaskOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        try {
            if (orchestrator.delete(taskId)) {
                ConsoleOutput.success("Deleted task " + taskId);
            } else {
                ConsoleOutput.error("Task not found: " + taskId);
            }
        } catch (TaskRejectedException e) {
            ConsoleOutput.error(e.getMessage());
        }
    }
}
