package io.lapse4j.config;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Settings of the ticking scheduler. Cron schedules are evaluated in {@code zone}.
 */
public record SchedulerSettings(
        Duration tickInterval,
        ZoneId zone
) {

    public SchedulerSettings {
        Objects.requireNonNull(tickInterval, "tickInterval must not be null");
        Objects.requireNonNull(zone, "zone must not be null");
        if (tickInterval.isZero() || tickInterval.isNegative()) {
            throw new IllegalArgumentException("tickInterval must be a positive duration");
        }
    }

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(Duration.ofSeconds(1), ZoneId.systemDefault());
    }
}
