package io.herald.cli;

import io.herald.core.task.RecurringTask;
import io.herald.core.task.TaskRequest;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "add", description = "Create a recurring notification")
public final class TaskAddCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-n", "--name"}, required = true, description = "Task name")
    String name;

    @Option(names = {"-w", "--webhook"}, required = true, description = "Webhook send URL")
    String webhookUrl;

    @Option(names = {"-k", "--kind"}, defaultValue = "text", description = "text, markdown, image or file")
    String kind;

    @Option(names = {"-c", "--content"}, description = "Message content for text and markdown")
    String content;

    @Option(names = {"-f", "--file"}, description = "Attachment path for image and file")
    String filePath;

    @Option(names = {"-s", "--schedule"}, required = true, description = "Cron expression or phrase such as '每天9点' or 'every monday at 8:30'")
    String schedule;

    @Option(names = "--inactive", description = "Store the task without scheduling it")
    boolean inactive;

    public TaskAddCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            RecurringTask task = context.runtime().taskService().create(
                new TaskRequest(name, webhookUrl, kind, content, filePath, schedule, !inactive)
            );
            System.out.println("Created task " + TaskFormatter.line(task, context.runtime().calculator().zone()));
            return 0;
        } catch (Exception e) {
            System.err.println("Task add failed: " + e.getMessage());
            return 1;
        }
    }
}
