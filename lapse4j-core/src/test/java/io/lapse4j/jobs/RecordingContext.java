package io.lapse4j.jobs;

import io.lapse4j.TaskContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Task context that keeps every message and can cancel itself after a number of reports.
 */
class RecordingContext implements TaskContext {
    final List<String> messages = new ArrayList<>();
    long current;
    long total;
    private final int cancelAfterReports;
    private int reports;

    RecordingContext() {
        this(Integer.MAX_VALUE);
    }

    RecordingContext(int cancelAfterReports) {
        this.cancelAfterReports = cancelAfterReports;
    }

    @Override
    public String taskId() {
        return "test-task";
    }

    @Override
    public void report(long current, long total, String message) {
        this.current = current;
        this.total = total;
        messages.add(message);
        if (current > 0) {
            reports++;
        }
    }

    @Override
    public void message(String message) {
        messages.add(message);
    }

    @Override
    public boolean isCancelled() {
        return reports >= cancelAfterReports;
    }
}
