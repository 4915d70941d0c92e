package io.herald.cli;

import io.herald.core.poll.TaskRunResult;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "run", description = "Send a task's message now")
public final class TaskRunCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Task id")
    long id;

    public TaskRunCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            TaskRunResult result = context.runtime().taskService().executeNow(id);
            String next = TaskFormatter.time(result.nextRunAt(), context.runtime().calculator().zone());
            if (result.dispatch().success()) {
                System.out.println("Task " + id + " sent; next run " + next);
                return 0;
            }
            System.err.println("Task " + id + " not delivered: " + result.dispatch().status() + " " + result.dispatch().message());
            System.out.println("Next run " + next);
            return 1;
        } catch (Exception e) {
            System.err.println("Task run failed: " + e.getMessage());
            return 1;
        }
    }
}
