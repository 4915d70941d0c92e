package io.herald.cli;

import io.herald.core.task.RecurringTask;
import io.herald.core.task.TaskUpdate;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "update", description = "Change fields of a task; omitted options keep their value")
public final class TaskUpdateCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Task id")
    long id;

    @Option(names = {"-n", "--name"}, description = "Task name")
    String name;

    @Option(names = {"-w", "--webhook"}, description = "Webhook send URL")
    String webhookUrl;

    @Option(names = {"-k", "--kind"}, description = "text, markdown, image or file")
    String kind;

    @Option(names = {"-c", "--content"}, description = "Message content")
    String content;

    @Option(names = {"-f", "--file"}, description = "Attachment path")
    String filePath;

    @Option(names = {"-s", "--schedule"}, description = "Cron expression or phrase")
    String schedule;

    @Option(names = "--active", negatable = true, description = "Activate (--active) or pause (--no-active) the task")
    Boolean active;

    public TaskUpdateCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            TaskUpdate update = new TaskUpdate(name, webhookUrl, kind, content, filePath, schedule, active);
            if (update.isEmpty()) {
                System.err.println("Task update failed: nothing to change");
                return 1;
            }
            RecurringTask task = context.runtime().taskService().update(id, update);
            System.out.println("Updated task " + TaskFormatter.line(task, context.runtime().calculator().zone()));
            return 0;
        } catch (Exception e) {
            System.err.println("Task update failed: " + e.getMessage());
            return 1;
        }
    }
}
