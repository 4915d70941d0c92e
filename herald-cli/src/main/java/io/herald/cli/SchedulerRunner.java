package io.herald.cli;

@FunctionalInterface
public interface SchedulerRunner {
    int run() throws Exception;
}
