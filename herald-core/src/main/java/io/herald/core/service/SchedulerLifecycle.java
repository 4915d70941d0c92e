package io.herald.core.service;

import io.herald.core.poll.DueTaskPoller;
import io.herald.core.poll.PollSummary;
import io.herald.core.registry.JobRegistry;
import io.herald.core.schedule.NextRunCalculator;
import io.herald.core.task.RecurringTask;
import io.herald.core.task.TaskStore;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Restores scheduling state when the process starts: one trigger per active task, a fresh
 * {@code nextRunAt} for tasks whose run was missed while stopped, the due-task sweep and one
 * immediate sweep.
 *
 * <p>The process that calls {@link #start()} owns the triggers. Tasks may also be edited by other
 * processes sharing the store, so every sweep first reconciles the triggers with the active tasks.
 */
public final class SchedulerLifecycle implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(SchedulerLifecycle.class);

    private final TaskStore store;
    private final NextRunCalculator calculator;
    private final JobRegistry registry;
    private final DueTaskPoller poller;
    private final Clock clock;
    private final AutoCloseable substrate;
    private boolean started;
    private boolean closed;

    public SchedulerLifecycle(
        TaskStore store,
        NextRunCalculator calculator,
        JobRegistry registry,
        DueTaskPoller poller,
        Clock clock,
        AutoCloseable substrate
    ) {
        this.store = store;
        this.calculator = calculator;
        this.registry = registry;
        this.poller = poller;
        this.clock = clock;
        this.substrate = substrate;
    }

    public synchronized PollSummary start() throws IOException {
        if (started) {
            throw new IllegalStateException("scheduler already started");
        }

        Instant now = clock.instant();
        List<RecurringTask> active = store.listActive();
        int refreshed = 0;
        registry.reconcile(active);
        for (RecurringTask task : active) {
            if (task.nextRunAt() == null || task.nextRunAt().isBefore(now)) {
                Optional<Instant> next = calculator.nextRunAfter(task.scheduleExpression(), now);
                if (next.isPresent() && store.updateNextRunAt(task.id(), task.scheduleExpression(), next.get())) {
                    refreshed++;
                }
            }
        }
        registry.ensurePollerRegistered(this::sweep);
        started = true;
        LOG.info("Scheduler started: {} active task(s), {} missed run(s) moved forward", active.size(), refreshed);

        return poller.poll();
    }

    /** One periodic sweep: reconcile triggers with the store, then dispatch due tasks. Never throws. */
    public PollSummary sweep() {
        try {
            registry.reconcile(store.listActive());
        } catch (IOException | RuntimeException e) {
            LOG.warn("Trigger reconciliation skipped: {}", e.getMessage());
        }
        return poller.poll();
    }

    public synchronized boolean started() {
        return started;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            substrate.close();
        } catch (Exception e) {
            LOG.warn("Scheduler shutdown incomplete: {}", e.getMessage(), e);
        }
        started = false;
        LOG.info("Scheduler stopped");
    }
}
