package io.herald.core.poll;

import java.time.Instant;

public record PollSummary(
    Instant startedAt,
    int due,
    int sent,
    int failed,
    int skipped,
    boolean aborted,
    String message
) {

    static PollSummary aborted(Instant startedAt, String message) {
        return new PollSummary(startedAt, 0, 0, 0, 0, true, message);
    }
}
