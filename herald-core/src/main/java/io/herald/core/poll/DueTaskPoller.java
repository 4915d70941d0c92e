package io.herald.core.poll;

import io.herald.core.dispatch.DispatchResult;
import io.herald.core.dispatch.DispatchStatus;
import io.herald.core.dispatch.MessageDispatcher;
import io.herald.core.schedule.NextRunCalculator;
import io.herald.core.task.RecurringTask;
import io.herald.core.task.TaskNotFoundException;
import io.herald.core.task.TaskStore;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds due tasks, dispatches each once and moves its {@code nextRunAt} forward whatever the
 * delivery outcome.
 *
 * <p>Work on a single task is serialized by a per-task lock, so a periodic sweep and a per-task
 * trigger firing for the same occurrence dispatch it once: whichever runs second re-reads the
 * task, sees it is no longer due and skips it.
 */
public final class DueTaskPoller {
    private static final Logger LOG = LoggerFactory.getLogger(DueTaskPoller.class);

    private final TaskStore store;
    private final MessageDispatcher dispatcher;
    private final NextRunCalculator calculator;
    private final Clock clock;
    private final Map<Long, ReentrantLock> locks = new ConcurrentHashMap<>();

    public DueTaskPoller(TaskStore store, MessageDispatcher dispatcher, NextRunCalculator calculator, Clock clock) {
        this.store = store;
        this.dispatcher = dispatcher;
        this.calculator = calculator;
        this.clock = clock;
    }

    /** Runs one sweep over all due tasks. Never throws. */
    public PollSummary poll() {
        Instant startedAt = clock.instant();
        List<RecurringTask> due;
        try {
            due = store.listDue(startedAt);
        } catch (IOException | RuntimeException e) {
            LOG.error("Due task sweep aborted: {}", e.getMessage(), e);
            return PollSummary.aborted(startedAt, "listing due tasks failed: " + e.getMessage());
        }

        int sent = 0;
        int failed = 0;
        int skipped = 0;
        for (RecurringTask task : due) {
            try {
                Optional<TaskRunResult> result = process(task.id(), true, startedAt);
                if (result.isEmpty()) {
                    skipped++;
                } else if (result.get().dispatch().success()) {
                    sent++;
                } else {
                    failed++;
                }
            } catch (IOException | RuntimeException e) {
                failed++;
                LOG.warn("Task {} ({}) could not be processed: {}", task.id(), task.name(), e.getMessage(), e);
            }
        }

        String message = "due=" + due.size() + " sent=" + sent + " failed=" + failed + " skipped=" + skipped;
        if (due.isEmpty()) {
            LOG.debug("Due task sweep found nothing to send");
        } else {
            LOG.info("Due task sweep finished: {}", message);
        }
        return new PollSummary(startedAt, due.size(), sent, failed, skipped, false, message);
    }

    /**
     * Trigger callback for a single task: dispatches only if the task is still active and due.
     * Never throws.
     */
    public Optional<TaskRunResult> runIfDue(long taskId) {
        try {
            return process(taskId, true, clock.instant());
        } catch (IOException | RuntimeException e) {
            LOG.warn("Scheduled run of task {} failed: {}", taskId, e.getMessage(), e);
            return Optional.empty();
        }
    }

    /** Dispatches a task immediately, due or not, and advances its {@code nextRunAt}. */
    public TaskRunResult runNow(long taskId) throws IOException {
        return process(taskId, false, clock.instant()).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    /** Lock entries currently held for task ids; entries of deleted tasks are dropped. */
    int trackedLocks() {
        return locks.size();
    }

    // next runs count from the instant the run started, not from when the dispatch returned
    private Optional<TaskRunResult> process(long taskId, boolean requireDue, Instant now) throws IOException {
        ReentrantLock lock = locks.computeIfAbsent(taskId, id -> new ReentrantLock());
        boolean vanished = false;
        lock.lock();
        try {
            Optional<RecurringTask> current = store.get(taskId);
            if (current.isEmpty()) {
                vanished = true;
                LOG.info("Task {} no longer exists, skipping", taskId);
                return Optional.empty();
            }

            RecurringTask task = current.get();
            if (requireDue && !task.isDue(now)) {
                LOG.debug("Task {} is not due any more, skipping", taskId);
                return Optional.empty();
            }

            DispatchResult dispatch = dispatchSafely(task);
            if (dispatch.success()) {
                LOG.info("Task {} ({}) sent", task.id(), task.name());
            } else {
                LOG.warn("Task {} ({}) failed: {} {}", task.id(), task.name(), dispatch.status(), dispatch.message());
            }
            return Optional.of(advance(task, dispatch, now));
        } finally {
            lock.unlock();
            if (vanished) {
                locks.remove(taskId, lock);
            }
        }
    }

    private DispatchResult dispatchSafely(RecurringTask task) {
        try {
            return dispatcher.dispatch(task.webhookUrl(), task.message());
        } catch (RuntimeException e) {
            return DispatchResult.failed(DispatchStatus.DELIVERY_FAILED, "dispatcher error: " + e.getMessage());
        }
    }

    private TaskRunResult advance(RecurringTask task, DispatchResult dispatch, Instant now) throws IOException {
        Optional<Instant> next = calculator.nextRunAfter(task.scheduleExpression(), now);
        if (next.isEmpty()) {
            LOG.warn("Task {} has no next run for '{}', leaving nextRunAt unchanged", task.id(), task.scheduleExpression());
            return new TaskRunResult(task.id(), task.name(), dispatch, task.nextRunAt(), false);
        }

        Instant stored = task.nextRunAt();
        if (stored != null && next.get().isBefore(stored)) {
            // a manual run ahead of schedule keeps the later stored occurrence
            return new TaskRunResult(task.id(), task.name(), dispatch, stored, false);
        }

        boolean advanced = store.updateNextRunAt(task.id(), task.scheduleExpression(), next.get());
        if (!advanced) {
            LOG.info("Task {} changed during dispatch, nextRunAt left to the newer state", task.id());
            return new TaskRunResult(task.id(), task.name(), dispatch, stored, false);
        }
        return new TaskRunResult(task.id(), task.name(), dispatch, next.get(), true);
    }
}
