package io.herald.core.poll;

import io.herald.core.dispatch.DispatchResult;
import java.time.Instant;

/**
 * @param nextRunAt the task's next run after this execution, {@code null} if none could be computed
 * @param advanced whether the stored {@code nextRunAt} was moved by this execution
 */
public record TaskRunResult(
    long taskId,
    String taskName,
    DispatchResult dispatch,
    Instant nextRunAt,
    boolean advanced
) {
}
