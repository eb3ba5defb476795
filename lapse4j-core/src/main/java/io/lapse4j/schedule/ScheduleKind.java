package io.lapse4j.schedule;

public enum ScheduleKind {
    CRON,
    INTERVAL
}
