package io.herald.cli;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "schedule", description = "Show how a schedule is stored and when it fires next")
public final class ScheduleCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Cron expression or phrase")
    String expression;

    @Option(names = "--count", defaultValue = "5", description = "Number of upcoming runs to show")
    int count;

    public ScheduleCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            String cron = context.runtime().taskService().translate(expression);
            ZoneId zone = context.runtime().calculator().zone();
            Instant now = context.runtime().calculator().clock().instant();
            List<Instant> runs = context.runtime().calculator().upcoming(cron, now, Math.max(1, count));

            System.out.println("Cron: " + cron);
            if (runs.isEmpty()) {
                System.out.println("No upcoming runs");
            }
            for (Instant run : runs) {
                System.out.println("  " + TaskFormatter.time(run, zone));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Schedule command failed: " + e.getMessage());
            return 1;
        }
    }
}
