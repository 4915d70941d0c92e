package io.herald.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "remove", description = "Delete a task")
public final class TaskRemoveCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Task id")
    long id;

    public TaskRemoveCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            context.runtime().taskService().delete(id);
            System.out.println("Removed task " + id);
            return 0;
        } catch (Exception e) {
            System.err.println("Task remove failed: " + e.getMessage());
            return 1;
        }
    }
}
