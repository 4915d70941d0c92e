package io.herald.core.task;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public interface TaskStore {
    /** Persists a new task and returns it with its assigned id. The id of {@code draft} is ignored. */
    RecurringTask create(RecurringTask draft) throws IOException;

    /**
     * Writes only {@code fields} (plus {@code updated_at}) from {@code values}.
     *
     * @return false when no task has this id
     */
    boolean update(long id, RecurringTask values, Set<TaskField> fields) throws IOException;

    boolean delete(long id) throws IOException;

    Optional<RecurringTask> get(long id) throws IOException;

    List<RecurringTask> listAll() throws IOException;

    List<RecurringTask> listActive() throws IOException;

    /** Active tasks with {@code nextRunAt <= now}, earliest first. */
    List<RecurringTask> listDue(Instant now) throws IOException;

    /**
     * Moves {@code nextRunAt} forward, touching no other column. The write only happens while the
     * task still carries {@code expectedExpression} and its stored value is not later than
     * {@code nextRunAt}.
     *
     * @return whether a row was changed
     */
    boolean updateNextRunAt(long id, String expectedExpression, Instant nextRunAt) throws IOException;
}
