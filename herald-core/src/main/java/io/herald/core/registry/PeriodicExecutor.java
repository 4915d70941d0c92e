package io.herald.core.registry;

import java.time.Duration;

/**
 * Runs callbacks on a recurrence, one schedule per key. Scheduling an existing key replaces its
 * previous schedule.
 */
public interface PeriodicExecutor {
    void scheduleRecurring(String key, String cronExpression, Runnable callback) throws SchedulingUnavailableException;

    void scheduleAtFixedRate(String key, Duration interval, Runnable callback) throws SchedulingUnavailableException;

    /** @return whether a schedule existed under {@code key} */
    boolean unschedule(String key) throws SchedulingUnavailableException;
}
