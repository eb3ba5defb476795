package io.lapse4j.internal;

import io.lapse4j.JobBody;
import io.lapse4j.TaskContext;
import io.lapse4j.TaskManager;
import io.lapse4j.config.TaskManagerSettings;
import io.lapse4j.core.CancelResult;
import io.lapse4j.core.JobKind;
import io.lapse4j.core.SubmitResult;
import io.lapse4j.core.TaskCancelledException;
import io.lapse4j.core.TaskSnapshot;
import io.lapse4j.core.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Task manager keeping every record in memory and running job bodies on a fixed worker pool.
 *
 * <p>Typical usage:
 * <pre>{@code
 * TaskManager tasks = new InMemoryTaskManager(TaskManagerSettings.defaults(), Clock.systemUTC());
 * tasks.start();
 *
 * String id = tasks.submit(JobKind.RENDER, "Render Night", ctx -> {
 *     for (int i = 0; i < frames; i++) {
 *         ctx.throwIfCancelled();
 *         ctx.report(i + 1, frames, "Encoding frame " + (i + 1));
 *     }
 *     return output;
 * });
 *
 * tasks.get(id).map(TaskSnapshot::progress);
 * tasks.stop();
 * }</pre>
 */
public class InMemoryTaskManager implements TaskManager {
    private static final Logger log = LoggerFactory.getLogger(InMemoryTaskManager.class);

    private final TaskManagerSettings settings;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicLong sequence = new AtomicLong();

    private final ConcurrentHashMap<String, TaskRecord> tasks = new ConcurrentHashMap<>();
    // "<subjectId>:<kind>" -> id of the task last submitted for it
    private final ConcurrentHashMap<String, String> activeBySubject = new ConcurrentHashMap<>();

    private volatile ExecutorService workerPool;

    public InMemoryTaskManager(TaskManagerSettings settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Start the worker pool. Should be idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        log.info("TaskManager starting with workerThreads={}, retention={}",
                settings.workerThreads(), settings.retention());

        if (workerPool == null) {
            workerPool = Executors.newFixedThreadPool(settings.workerThreads(), r -> {
                Thread t = new Thread(r);
                t.setName("lapse.worker");
                t.setDaemon(true);
                return t;
            });
        }
        log.info("TaskManager started successfully.");
    }

    /**
     * Request cancellation of every active task and wait for the pool to drain. Should be idempotent.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("TaskManager stopping...");

        Instant now = now();
        for (TaskRecord record : tasks.values()) {
            record.requestCancel(now);
        }

        ExecutorService pool = workerPool;
        if (pool != null) {
            pool.shutdown();
            try {
                if (!pool.awaitTermination(settings.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    pool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pool.shutdownNow();
            } finally {
                workerPool = null;
            }
        }
        log.info("TaskManager stopped successfully.");
    }

    @Override
    public String submit(JobKind kind, String name, JobBody body) {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(body, "body must not be null");
        requireStarted();

        TaskRecord record = newRecord(kind, name, null);
        tasks.put(record.id(), record);
        dispatch(record, body, null);
        return record.id();
    }

    @Override
    public SubmitResult submitForSubject(JobKind kind, String subjectId, String name, JobBody body) {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(subjectId, "subjectId must not be null");
        Objects.requireNonNull(body, "body must not be null");
        requireStarted();

        String key = subjectKey(subjectId, kind);
        AtomicReference<TaskRecord> created = new AtomicReference<>();
        String activeId = activeBySubject.compute(key, (k, existingId) -> {
            if (existingId != null) {
                TaskRecord existing = tasks.get(existingId);
                if (existing != null && !existing.status().isTerminal()) {
                    return existingId;
                }
            }
            TaskRecord record = newRecord(kind, name, subjectId);
            tasks.put(record.id(), record);
            created.set(record);
            return record.id();
        });

        TaskRecord record = created.get();
        if (record == null) {
            log.info("lapse task skipped, subject already active subject={} kind={} activeId={}",
                    subjectId, kind, activeId);
            return SubmitResult.skipped(activeId);
        }
        dispatch(record, body, key);
        return SubmitResult.submittedResult(record.id());
    }

    @Override
    public CancelResult cancel(String taskId) {
        if (taskId == null) {
            return CancelResult.notFound();
        }
        TaskRecord record = tasks.get(taskId);
        if (record == null) {
            return CancelResult.notFound();
        }
        if (!record.requestCancel(now())) {
            return CancelResult.alreadyFinished();
        }
        log.info("lapse task cancel requested kind={} id={} status={}", record.kind(), taskId, record.status());
        return CancelResult.acceptedResult();
    }

    @Override
    public Optional<TaskSnapshot> get(String taskId) {
        if (taskId == null) {
            return Optional.empty();
        }
        TaskRecord record = tasks.get(taskId);
        return record == null ? Optional.empty() : Optional.of(record.snapshot(now()));
    }

    @Override
    public List<TaskSnapshot> listActive() {
        Instant now = now();
        return ordered()
                .map(r -> r.snapshot(now))
                .filter(s -> !s.isTerminal())
                .collect(Collectors.toList());
    }

    @Override
    public List<TaskSnapshot> listAll() {
        Instant now = now();
        return ordered()
                .map(r -> r.snapshot(now))
                .collect(Collectors.toList());
    }

    @Override
    public int gc() {
        Instant cutoff = now().minus(settings.retention());
        int evicted = 0;
        for (TaskRecord record : tasks.values()) {
            Instant finishedAt = record.finishedAt();
            if (finishedAt != null && !finishedAt.isAfter(cutoff) && tasks.remove(record.id(), record)) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.debug("lapse task gc evicted={} remaining={}", evicted, tasks.size());
        }
        return evicted;
    }

    /**
     * Result returned by a completed task's body, if the task is still retained.
     */
    public Optional<Object> result(String taskId) {
        TaskRecord record = tasks.get(taskId);
        if (record == null || record.status() != TaskStatus.COMPLETED) {
            return Optional.empty();
        }
        return Optional.ofNullable(record.result());
    }

    private Stream<TaskRecord> ordered() {
        return tasks.values().stream()
                .sorted(Comparator.comparingLong(TaskRecord::sequence));
    }

    private TaskRecord newRecord(JobKind kind, String name, String subjectId) {
        String id = UUID.randomUUID().toString().replace("-", "");
        return new TaskRecord(id, kind, name, subjectId, sequence.incrementAndGet(), now());
    }

    private void dispatch(TaskRecord record, JobBody body, String subjectKey) {
        ExecutorService pool = workerPool;
        try {
            if (pool == null) {
                throw new RejectedExecutionException("worker pool is not running");
            }
            pool.execute(() -> execute(record, body, subjectKey));
        } catch (RejectedExecutionException e) {
            log.error("lapse task rejected kind={} id={} msg={}", record.kind(), record.id(), e.getMessage(), e);
            record.failed(e.toString(), now());
            release(record, subjectKey);
        }
    }

    private void execute(TaskRecord record, JobBody body, String subjectKey) {
        try {
            Instant startedAt = now();
            if (!record.markRunning(startedAt)) {
                log.debug("lapse task not started status={} kind={} id={}", record.status(), record.kind(), record.id());
                return;
            }
            log.debug("lapse task started kind={} id={} subject={} queued={}",
                    record.kind(), record.id(), record.subjectId(), Duration.between(record.createdAt(), startedAt));

            RecordContext context = new RecordContext(record);
            Object value;
            try {
                value = body.run(context);
            } catch (TaskCancelledException e) {
                record.cancelled(now());
                log.info("lapse task cancelled kind={} id={}", record.kind(), record.id());
                return;
            } catch (Exception e) {
                record.failed(e.toString(), now());
                log.error("lapse task failed kind={} id={} msg={}", record.kind(), record.id(), e.getMessage(), e);
                return;
            } catch (Error e) {
                record.failed(e.toString(), now());
                log.error("lapse task failed with error kind={} id={} msg={}", record.kind(), record.id(), e.getMessage(), e);
                throw e;
            }

            if (context.observedCancel) {
                record.cancelled(now());
                log.info("lapse task cancelled kind={} id={}", record.kind(), record.id());
            } else {
                record.completed(value, now());
                log.debug("lapse task completed kind={} id={}", record.kind(), record.id());
            }
        } finally {
            release(record, subjectKey);
        }
    }

    private void release(TaskRecord record, String subjectKey) {
        if (subjectKey != null) {
            activeBySubject.remove(subjectKey, record.id());
        }
    }

    private void requireStarted() {
        if (!started.get()) {
            throw new IllegalStateException("TaskManager is not started");
        }
    }

    private Instant now() {
        return Instant.now(clock);
    }

    private static String subjectKey(String subjectId, JobKind kind) {
        return subjectId + ":" + kind;
    }

    private final class RecordContext implements TaskContext {
        private final TaskRecord record;
        private volatile boolean observedCancel;

        private RecordContext(TaskRecord record) {
            this.record = record;
        }

        @Override
        public String taskId() {
            return record.id();
        }

        @Override
        public void report(long current, long total, String message) {
            record.report(current, total, message);
        }

        @Override
        public void message(String message) {
            record.message(message);
        }

        @Override
        public boolean isCancelled() {
            boolean cancelled = record.isCancelRequested();
            if (cancelled) {
                observedCancel = true;
            }
            return cancelled;
        }
    }
}
