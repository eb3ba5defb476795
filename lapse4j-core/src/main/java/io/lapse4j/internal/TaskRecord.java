package io.lapse4j.internal;

import io.lapse4j.core.JobKind;
import io.lapse4j.core.TaskSnapshot;
import io.lapse4j.core.TaskStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mutable state of one task. All mutation and {@link #snapshot(Instant)} are synchronized on the
 * record; the cancellation flag is read without locking.
 */
final class TaskRecord {

    private final String id;
    private final JobKind kind;
    private final String name;
    private final String subjectId;
    private final long sequence;
    private final Instant createdAt;

    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    private TaskStatus status = TaskStatus.PENDING;
    private double progress;
    private long current;
    private long total;
    private String message = "";
    private Instant startedAt;
    private Instant finishedAt;
    private String error;
    private Object result;

    TaskRecord(String id, JobKind kind, String name, String subjectId, long sequence, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.name = name == null ? kind.name() : name;
        this.subjectId = subjectId;
        this.sequence = sequence;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
    }

    String id() {
        return id;
    }

    JobKind kind() {
        return kind;
    }

    String subjectId() {
        return subjectId;
    }

    long sequence() {
        return sequence;
    }

    Instant createdAt() {
        return createdAt;
    }

    boolean isCancelRequested() {
        return cancelRequested.get();
    }

    synchronized TaskStatus status() {
        return status;
    }

    synchronized Instant finishedAt() {
        return finishedAt;
    }

    synchronized Object result() {
        return result;
    }

    /**
     * PENDING -> RUNNING. Returns false if the task is no longer pending (cancelled before start).
     */
    synchronized boolean markRunning(Instant now) {
        if (status != TaskStatus.PENDING) {
            return false;
        }
        status = TaskStatus.RUNNING;
        startedAt = now;
        return true;
    }

    synchronized void completed(Object value, Instant now) {
        if (finish(TaskStatus.COMPLETED, now)) {
            result = value;
            progress = 100;
            if (total > 0) {
                current = Math.max(current, total);
            }
        }
    }

    synchronized void failed(String errorText, Instant now) {
        if (finish(TaskStatus.FAILED, now)) {
            error = errorText;
        }
    }

    synchronized void cancelled(Instant now) {
        if (finish(TaskStatus.CANCELLED, now)) {
            message = "Cancelled";
        }
    }

    private boolean finish(TaskStatus terminal, Instant now) {
        if (status.isTerminal()) {
            return false;
        }
        status = terminal;
        finishedAt = now;
        return true;
    }

    synchronized void report(long current, long total, String message) {
        if (status != TaskStatus.RUNNING) {
            return;
        }
        this.current = Math.max(0, current);
        this.total = Math.max(0, total);
        if (message != null) {
            this.message = message;
        }
        if (this.total > 0) {
            double next = Math.min(100.0, 100.0 * this.current / this.total);
            progress = Math.max(progress, next);
        }
    }

    synchronized void message(String message) {
        if (status == TaskStatus.RUNNING && message != null) {
            this.message = message;
        }
    }

    /**
     * Record a cancellation request. A pending task becomes CANCELLED at once.
     *
     * @return false if the task was already terminal
     */
    synchronized boolean requestCancel(Instant now) {
        if (status.isTerminal()) {
            return false;
        }
        cancelRequested.set(true);
        if (status == TaskStatus.PENDING) {
            cancelled(now);
        }
        return true;
    }

    synchronized TaskSnapshot snapshot(Instant now) {
        double elapsed = 0;
        if (startedAt != null) {
            Instant end = finishedAt != null ? finishedAt : now;
            elapsed = Math.max(0, Duration.between(startedAt, end).toMillis() / 1000.0);
        }
        double rate = (elapsed > 0 && current > 0) ? current / elapsed : 0;
        double eta = 0;
        if (status == TaskStatus.RUNNING && rate > 0 && total > current) {
            eta = (total - current) / rate;
        }
        return new TaskSnapshot(
                id,
                kind,
                name,
                subjectId,
                status,
                progress,
                current,
                total,
                message,
                rate,
                elapsed,
                eta,
                status == TaskStatus.FAILED ? error : null
        );
    }
}
