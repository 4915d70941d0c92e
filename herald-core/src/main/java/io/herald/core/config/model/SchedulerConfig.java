package io.herald.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.ZoneId;

/**
 * @param zone zone that cron expressions are evaluated in; blank means the system default
 * @param strictSchedules reject unrecognized schedules instead of falling back to daily midnight
 * @param strictMessageKinds reject unknown message kinds instead of sending them as text
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SchedulerConfig(
    @JsonAlias({"poll_interval_seconds"}) int pollIntervalSeconds,
    String zone,
    @JsonAlias({"worker_threads"}) int workerThreads,
    @JsonAlias({"strict_schedules"}) boolean strictSchedules,
    @JsonAlias({"strict_message_kinds"}) boolean strictMessageKinds
) {

    public static SchedulerConfig defaults() {
        return new SchedulerConfig(60, "", 2, false, false);
    }

    public ZoneId resolveZone() {
        if (zone == null || zone.isBlank()) {
            return ZoneId.systemDefault();
        }
        return ZoneId.of(zone.trim());
    }
}
