package io.herald.core.schedule;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class NextRunCalculatorTest {

    // Monday
    private static final Instant NOW = Instant.parse("2026-03-02T08:00:00Z");

    private final NextRunCalculator calculator = new NextRunCalculator(Clock.fixed(NOW, ZoneOffset.UTC), ZoneOffset.UTC);

    @Test
    void shouldComputeNextDailyRun() {
        assertThat(calculator.nextRun("0 0 9 * * ?")).contains(Instant.parse("2026-03-02T09:00:00Z"));
        assertThat(calculator.nextRun("0 9 * * *")).contains(Instant.parse("2026-03-02T09:00:00Z"));
    }

    @Test
    void shouldReturnInstantStrictlyAfterReference() {
        Instant nineOClock = Instant.parse("2026-03-02T09:00:00Z");

        assertThat(calculator.nextRunAfter("0 0 9 * * ?", nineOClock)).contains(Instant.parse("2026-03-03T09:00:00Z"));
    }

    @Test
    void shouldComputeWeeklyAndMonthlyRuns() {
        assertThat(calculator.nextRun("0 30 8 ? * 1")).contains(Instant.parse("2026-03-02T08:30:00Z"));
        assertThat(calculator.nextRun("0 0 10 ? * 0")).contains(Instant.parse("2026-03-08T10:00:00Z"));
        assertThat(calculator.nextRun("0 0 0 1 * ?")).contains(Instant.parse("2026-04-01T00:00:00Z"));
    }

    @Test
    void shouldEvaluateInConfiguredZone() {
        NextRunCalculator shanghai = new NextRunCalculator(
            Clock.fixed(Instant.parse("2026-03-02T00:00:00Z"), ZoneOffset.UTC),
            ZoneId.of("Asia/Shanghai")
        );

        assertThat(shanghai.nextRun("0 0 9 * * ?")).contains(Instant.parse("2026-03-02T01:00:00Z"));
    }

    @Test
    void shouldReturnEmptyForInvalidExpressions() {
        assertThat(calculator.nextRun("not a cron")).isEmpty();
        assertThat(calculator.nextRun("99 * * * *")).isEmpty();
        assertThat(calculator.nextRun("")).isEmpty();
        assertThat(calculator.nextRun(null)).isEmpty();
    }

    @Test
    void shouldListUpcomingRuns() {
        assertThat(calculator.upcoming("0 0 9 * * ?", NOW, 3)).containsExactly(
            Instant.parse("2026-03-02T09:00:00Z"),
            Instant.parse("2026-03-03T09:00:00Z"),
            Instant.parse("2026-03-04T09:00:00Z")
        );
    }
}
