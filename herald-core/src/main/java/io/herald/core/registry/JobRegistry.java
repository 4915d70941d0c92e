package io.herald.core.registry;

import io.herald.core.task.RecurringTask;
import java.util.Collection;

/**
 * Keeps one trigger per active task plus the periodic due-task sweep. Substrate failures are
 * logged, never thrown: the sweep still picks up due tasks without per-task triggers.
 */
public interface JobRegistry {
    void register(RecurringTask task);

    void update(RecurringTask task);

    void deregister(long taskId);

    /**
     * Brings the triggers in line with the given active tasks: missing ones are registered,
     * changed schedules re-registered and triggers of tasks not in the collection removed.
     */
    void reconcile(Collection<RecurringTask> activeTasks);

    void ensurePollerRegistered(Runnable sweep);
}
