package io.herald.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "show", description = "Show one task")
public final class TaskShowCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Task id")
    long id;

    public TaskShowCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            System.out.println(TaskFormatter.details(
                context.runtime().taskService().get(id),
                context.runtime().calculator().zone()
            ));
            return 0;
        } catch (Exception e) {
            System.err.println("Task show failed: " + e.getMessage());
            return 1;
        }
    }
}
