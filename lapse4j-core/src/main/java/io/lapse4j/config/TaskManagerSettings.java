package io.lapse4j.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings of the in-memory task manager.
 *
 * workerThreads   : size of the worker pool running job bodies
 * retention       : how long terminal tasks stay visible before gc() evicts them
 * shutdownTimeout : how long stop() waits for running bodies
 */
public record TaskManagerSettings(
        int workerThreads,
        Duration retention,
        Duration shutdownTimeout
) {

    public TaskManagerSettings {
        Objects.requireNonNull(retention, "retention must not be null");
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout must not be null");
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be at least 1");
        }
        if (retention.isNegative()) {
            throw new IllegalArgumentException("retention must not be negative");
        }
        if (shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("shutdownTimeout must not be negative");
        }
    }

    public static TaskManagerSettings defaults() {
        return new TaskManagerSettings(4, Duration.ofMinutes(5), Duration.ofSeconds(30));
    }
}
