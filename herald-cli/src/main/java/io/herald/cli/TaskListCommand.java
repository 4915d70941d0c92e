package io.herald.cli;

import io.herald.core.task.RecurringTask;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "list", description = "List tasks")
public final class TaskListCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--active", description = "Only active tasks")
    boolean activeOnly;

    @Option(names = "--name", description = "Only tasks whose name contains this text")
    String nameFilter;

    @Option(names = "--json", description = "Print tasks as JSON")
    boolean json;

    public TaskListCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            List<RecurringTask> tasks = context.runtime().taskService().find(nameFilter, activeOnly);
            if (json) {
                System.out.println(TaskFormatter.json(tasks));
                return 0;
            }
            if (tasks.isEmpty()) {
                System.out.println("No tasks");
                return 0;
            }
            for (RecurringTask task : tasks) {
                System.out.println(TaskFormatter.line(task, context.runtime().calculator().zone()));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Task list failed: " + e.getMessage());
            return 1;
        }
    }
}
