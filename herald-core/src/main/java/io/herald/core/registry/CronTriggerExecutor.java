package io.herald.core.registry;

import io.herald.core.schedule.NextRunCalculator;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process {@link PeriodicExecutor}. Cron schedules are one-shot tasks that re-arm themselves
 * from the next computed occurrence after every run.
 */
public final class CronTriggerExecutor implements PeriodicExecutor, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(CronTriggerExecutor.class);
    private static final long SHUTDOWN_WAIT_SECONDS = 5;

    private final NextRunCalculator calculator;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final Map<String, Schedule> schedules = new ConcurrentHashMap<>();

    public CronTriggerExecutor(NextRunCalculator calculator, int threads) {
        this.calculator = calculator;
        this.clock = calculator.clock();
        this.scheduler = Executors.newScheduledThreadPool(Math.max(1, threads), new NamedThreadFactory());
    }

    @Override
    public void scheduleRecurring(String key, String cronExpression, Runnable callback) throws SchedulingUnavailableException {
        ensureRunning();
        if (calculator.nextRunAfter(cronExpression, clock.instant()).isEmpty()) {
            throw new IllegalArgumentException("schedule '" + cronExpression + "' has no upcoming run");
        }
        CronSchedule schedule = new CronSchedule(key, cronExpression, callback);
        replace(key, schedule);
        schedule.arm(clock.instant());
    }

    @Override
    public void scheduleAtFixedRate(String key, Duration interval, Runnable callback) throws SchedulingUnavailableException {
        ensureRunning();
        FixedRateSchedule schedule = new FixedRateSchedule();
        replace(key, schedule);
        try {
            schedule.future = scheduler.scheduleAtFixedRate(
                () -> runGuarded(key, callback),
                interval.toMillis(),
                interval.toMillis(),
                TimeUnit.MILLISECONDS
            );
        } catch (RejectedExecutionException e) {
            schedules.remove(key, schedule);
            throw new SchedulingUnavailableException("scheduler is shut down", e);
        }
    }

    @Override
    public boolean unschedule(String key) throws SchedulingUnavailableException {
        ensureRunning();
        Schedule removed = schedules.remove(key);
        if (removed == null) {
            return false;
        }
        removed.cancel();
        return true;
    }

    public Set<String> scheduledKeys() {
        return Set.copyOf(schedules.keySet());
    }

    @Override
    public void close() {
        scheduler.shutdown();
        schedules.values().forEach(Schedule::cancel);
        schedules.clear();
        try {
            if (!scheduler.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void ensureRunning() throws SchedulingUnavailableException {
        if (scheduler.isShutdown()) {
            throw new SchedulingUnavailableException("scheduler is shut down");
        }
    }

    private void replace(String key, Schedule schedule) {
        Schedule previous = schedules.put(key, schedule);
        if (previous != null) {
            previous.cancel();
        }
    }

    // an exception escaping a periodic task would cancel its later runs
    private static void runGuarded(String key, Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            LOG.warn("Scheduled job {} failed: {}", key, e.getMessage(), e);
        }
    }

    private abstract static class Schedule {
        volatile boolean cancelled;
        volatile ScheduledFuture<?> future;

        void cancel() {
            cancelled = true;
            ScheduledFuture<?> current = future;
            if (current != null) {
                current.cancel(false);
            }
        }
    }

    private static final class FixedRateSchedule extends Schedule {
    }

    private final class CronSchedule extends Schedule {
        private final String key;
        private final String cronExpression;
        private final Runnable callback;

        private CronSchedule(String key, String cronExpression, Runnable callback) {
            this.key = key;
            this.cronExpression = cronExpression;
            this.callback = callback;
        }

        void arm(Instant reference) {
            if (cancelled) {
                return;
            }
            Optional<Instant> next = calculator.nextRunAfter(cronExpression, reference);
            if (next.isEmpty()) {
                LOG.warn("Trigger {} has no further runs for '{}'", key, cronExpression);
                schedules.remove(key, this);
                return;
            }
            long delayMs = Math.max(0, Duration.between(clock.instant(), next.get()).toMillis());
            try {
                future = scheduler.schedule(() -> fire(next.get()), delayMs, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                LOG.debug("Trigger {} not re-armed, scheduler is shut down", key);
            }
        }

        private void fire(Instant scheduledFor) {
            if (cancelled) {
                return;
            }
            try {
                runGuarded(key, callback);
            } finally {
                Instant now = clock.instant();
                arm(now.isAfter(scheduledFor) ? now : scheduledFor);
            }
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "herald-scheduler-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
