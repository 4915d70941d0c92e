package io.herald.cli;

import picocli.CommandLine.Command;

@Command(name = "task", mixinStandardHelpOptions = true, description = "Manage recurring notification tasks")
public final class TaskCommand implements Runnable {

    @Override
    public void run() {
        // Group command; the work happens in its subcommands.
    }
}
