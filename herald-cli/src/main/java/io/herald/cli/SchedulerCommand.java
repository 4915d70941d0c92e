package io.herald.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "scheduler", description = "Run the scheduler until the process is stopped")
public final class SchedulerCommand implements Callable<Integer> {
    private final CliContext context;

    public SchedulerCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            return context.schedulerRunner().run();
        } catch (Exception e) {
            System.err.println("Scheduler command failed: " + e.getMessage());
            return 1;
        }
    }
}
