package io.herald.core.registry;

import io.herald.core.task.RecurringTask;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ExecutorJobRegistry implements JobRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(ExecutorJobRegistry.class);

    public static final String POLLER_KEY = "herald.check-due";
    private static final String TASK_KEY_PREFIX = "herald.task.";

    private final PeriodicExecutor executor;
    private final Duration pollInterval;
    private final LongConsumer taskCallback;
    // task id -> schedule expression of the trigger this registry armed
    private final Map<Long, String> armed = new ConcurrentHashMap<>();

    /**
     * @param taskCallback run with the task id whenever a task's own trigger fires
     */
    public ExecutorJobRegistry(PeriodicExecutor executor, Duration pollInterval, LongConsumer taskCallback) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval must not be null");
        this.taskCallback = Objects.requireNonNull(taskCallback, "taskCallback must not be null");
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be > 0");
        }
    }

    public static String taskKey(long taskId) {
        return TASK_KEY_PREFIX + taskId;
    }

    @Override
    public void register(RecurringTask task) {
        if (!task.active()) {
            LOG.debug("Task {} is inactive, not registering a trigger", task.id());
            return;
        }
        String key = taskKey(task.id());
        long taskId = task.id();
        try {
            executor.scheduleRecurring(key, task.scheduleExpression(), () -> taskCallback.accept(taskId));
            armed.put(taskId, task.scheduleExpression());
            LOG.info("Registered trigger {} with schedule '{}'", key, task.scheduleExpression());
        } catch (SchedulingUnavailableException | RuntimeException e) {
            LOG.warn("Could not register trigger {}: {}", key, e.getMessage());
        }
    }

    @Override
    public void update(RecurringTask task) {
        deregister(task.id());
        register(task);
    }

    @Override
    public void deregister(long taskId) {
        String key = taskKey(taskId);
        try {
            if (executor.unschedule(key)) {
                LOG.info("Removed trigger {}", key);
            }
            armed.remove(taskId);
        } catch (SchedulingUnavailableException | RuntimeException e) {
            LOG.warn("Could not remove trigger {}: {}", key, e.getMessage());
        }
    }

    @Override
    public void reconcile(Collection<RecurringTask> activeTasks) {
        Map<Long, RecurringTask> wanted = new LinkedHashMap<>();
        for (RecurringTask task : activeTasks) {
            if (task.active()) {
                wanted.put(task.id(), task);
            }
        }

        int removed = 0;
        for (Long taskId : List.copyOf(armed.keySet())) {
            if (!wanted.containsKey(taskId)) {
                deregister(taskId);
                removed++;
            }
        }
        int registered = 0;
        for (RecurringTask task : wanted.values()) {
            if (!task.scheduleExpression().equals(armed.get(task.id()))) {
                register(task);
                registered++;
            }
        }
        if (removed > 0 || registered > 0) {
            LOG.info("Reconciled triggers: {} registered, {} removed", registered, removed);
        }
    }

    @Override
    public void ensurePollerRegistered(Runnable sweep) {
        try {
            executor.scheduleAtFixedRate(POLLER_KEY, pollInterval, sweep);
            LOG.info("Due task sweep runs every {}s", pollInterval.toSeconds());
        } catch (SchedulingUnavailableException | RuntimeException e) {
            LOG.warn("Could not register due task sweep: {}", e.getMessage());
        }
    }
}
