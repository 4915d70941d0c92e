package io.herald.cli;

import picocli.CommandLine;

public final class HeraldCli {

    private HeraldCli() {
    }

    public static CommandLine commandLine(CliContext context) {
        CommandLine task = new CommandLine(new TaskCommand());
        task.addSubcommand("add", new TaskAddCommand(context));
        task.addSubcommand("list", new TaskListCommand(context));
        task.addSubcommand("show", new TaskShowCommand(context));
        task.addSubcommand("update", new TaskUpdateCommand(context));
        task.addSubcommand("remove", new TaskRemoveCommand(context));
        task.addSubcommand("run", new TaskRunCommand(context));

        CommandLine commandLine = new CommandLine(new HeraldCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("task", task);
        commandLine.addSubcommand("send", new SendCommand(context));
        commandLine.addSubcommand("schedule", new ScheduleCommand(context));
        commandLine.addSubcommand("scheduler", new SchedulerCommand(context));
        return commandLine;
    }
}
