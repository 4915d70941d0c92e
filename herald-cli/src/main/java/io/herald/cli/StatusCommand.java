package io.herald.cli;

import io.herald.core.config.model.HeraldConfig;
import io.herald.core.task.RecurringTask;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and task store status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            HeraldConfig config = context.runtime().config();
            List<RecurringTask> tasks = context.runtime().taskService().list();
            long active = tasks.stream().filter(RecurringTask::active).count();

            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Task store: " + context.runtime().storePath());
            System.out.println("Zone: " + context.runtime().calculator().zone());
            System.out.println("Poll interval: " + config.scheduler().pollIntervalSeconds() + "s");
            System.out.println("Strict schedules: " + config.scheduler().strictSchedules());
            System.out.println("Strict message kinds: " + config.scheduler().strictMessageKinds());
            System.out.println("Tasks: " + tasks.size() + " (" + active + " active)");
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
