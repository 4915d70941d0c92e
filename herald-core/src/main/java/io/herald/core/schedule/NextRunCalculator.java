package io.herald.core.schedule;

import com.cronutils.model.time.ExecutionTime;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the next firing instant of a stored cron expression, interpreted in a fixed zone.
 * Invalid expressions yield an empty result instead of an exception.
 */
public final class NextRunCalculator {
    private static final Logger LOG = LoggerFactory.getLogger(NextRunCalculator.class);
    private static final int MAX_ADVANCE_ATTEMPTS = 3;

    private final Clock clock;
    private final ZoneId zone;

    public NextRunCalculator(Clock clock, ZoneId zone) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public Optional<Instant> nextRun(String cronExpression) {
        return nextRunAfter(cronExpression, clock.instant());
    }

    /**
     * @return the first firing instant strictly after {@code reference}, or empty when the
     *     expression is invalid or never fires again
     */
    public Optional<Instant> nextRunAfter(String cronExpression, Instant reference) {
        if (cronExpression == null || cronExpression.isBlank() || reference == null) {
            return Optional.empty();
        }
        try {
            ExecutionTime executionTime = ExecutionTime.forCron(CronFields.parse(cronExpression));
            ZonedDateTime cursor = reference.atZone(zone);
            for (int attempt = 0; attempt < MAX_ADVANCE_ATTEMPTS; attempt++) {
                Optional<ZonedDateTime> next = executionTime.nextExecution(cursor);
                if (next.isEmpty()) {
                    return Optional.empty();
                }
                Instant candidate = next.get().toInstant();
                if (candidate.isAfter(reference)) {
                    return Optional.of(candidate);
                }
                cursor = next.get().plusSeconds(1);
            }
            return Optional.empty();
        } catch (RuntimeException e) {
            LOG.warn("Unable to compute next run for '{}': {}", cronExpression, e.getMessage());
            return Optional.empty();
        }
    }

    /** Lists up to {@code count} consecutive firing instants after {@code reference}. */
    public List<Instant> upcoming(String cronExpression, Instant reference, int count) {
        List<Instant> runs = new ArrayList<>();
        Instant cursor = reference;
        while (runs.size() < count) {
            Optional<Instant> next = nextRunAfter(cronExpression, cursor);
            if (next.isEmpty()) {
                break;
            }
            runs.add(next.get());
            cursor = next.get();
        }
        return runs;
    }

    public ZoneId zone() {
        return zone;
    }

    public Clock clock() {
        return clock;
    }
}
