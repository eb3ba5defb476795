package io.lapse4j.config;

import java.time.Duration;
import java.time.ZoneId;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for the scheduler and the task manager.
 */
@ConfigurationProperties(prefix = "lapse")
public class LapseProperties {
    private boolean enabled = true;
    private Duration tickInterval = Duration.ofSeconds(1);
    private int workerThreads = 4;
    private Duration taskRetention = Duration.ofMinutes(5); // terminal tasks stay listed this long
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private String zone; // IANA id; null means system default

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getTickInterval() {
        return tickInterval;
    }

    public void setTickInterval(Duration tickInterval) {
        this.tickInterval = tickInterval;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public Duration getTaskRetention() {
        return taskRetention;
    }

    public void setTaskRetention(Duration taskRetention) {
        this.taskRetention = taskRetention;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public ZoneId resolveZone() {
        return (zone == null || zone.isBlank()) ? ZoneId.systemDefault() : ZoneId.of(zone);
    }

    public TaskManagerSettings toTaskManagerSettings() {
        return new TaskManagerSettings(workerThreads, taskRetention, shutdownTimeout);
    }

    public SchedulerSettings toSchedulerSettings() {
        return new SchedulerSettings(tickInterval, resolveZone());
    }
}
