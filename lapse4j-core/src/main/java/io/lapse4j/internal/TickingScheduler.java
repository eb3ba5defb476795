package io.lapse4j.internal;

import io.lapse4j.Scheduler;
import io.lapse4j.TaskManager;
import io.lapse4j.config.SchedulerSettings;
import io.lapse4j.core.JobFactoryRegistry;
import io.lapse4j.core.ScheduledJobInfo;
import io.lapse4j.core.SchedulerConfig;
import io.lapse4j.core.Subject;
import io.lapse4j.core.SubmitResult;
import io.lapse4j.schedule.Schedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Scheduler driven by a single ticker thread.
 *
 * <p>Each tick covers the window {@code (previous tick, now]}: a schedule matches when one of its fire
 * times falls inside it, so a tick that runs a little late does not lose fire times. Gaps longer than
 * two tick intervals (the process was suspended, the clock jumped) are not replayed; the tick then
 * only looks back one interval.
 */
public class TickingScheduler implements Scheduler {
    private static final Logger log = LoggerFactory.getLogger(TickingScheduler.class);

    private final SchedulerSettings settings;
    private final TaskManager taskManager;
    private final JobFactoryRegistry registry;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicReference<SchedulerConfig> config = new AtomicReference<>(SchedulerConfig.empty());

    private ScheduledExecutorService ticker;

    // guarded by this
    private Instant lastTickAt;

    public TickingScheduler(SchedulerSettings settings, TaskManager taskManager, JobFactoryRegistry registry, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.taskManager = Objects.requireNonNull(taskManager, "taskManager must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Start ticking. The task manager must already be started. Should be idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        log.info("Scheduler starting with tickInterval={}, zone={}, subjects={}",
                settings.tickInterval(), settings.zone(), config.get().subjects().size());

        synchronized (this) {
            lastTickAt = Instant.now(clock);
        }

        long periodMs = Math.max(1, settings.tickInterval().toMillis());
        ticker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("lapse.ticker");
            t.setDaemon(true);
            return t;
        });
        ticker.scheduleAtFixedRate(this::safeTick, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("Scheduler started successfully.");
    }

    /**
     * Stop ticking. Running tasks are left to the task manager. Should be idempotent.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("Scheduler stopping...");

        if (ticker != null) {
            ticker.shutdown();
            try {
                if (!ticker.awaitTermination(settings.tickInterval().toMillis() + 1000, TimeUnit.MILLISECONDS)) {
                    ticker.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                ticker.shutdownNow();
            } finally {
                ticker = null;
            }
        }
        log.info("Scheduler stopped successfully.");
    }

    private void safeTick() {
        try {
            tick(Instant.now(clock));
        } catch (Exception e) {
            log.error("lapse tick failed msg={}", e.getMessage(), e);
        }
    }

    @Override
    public synchronized void tick(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        if (lastTickAt != null && !now.isAfter(lastTickAt)) {
            log.debug("lapse tick skipped now={} lastTickAt={}", now, lastTickAt);
            return;
        }

        Instant windowStart = windowStart(now);
        lastTickAt = now;

        ZonedDateTime after = windowStart.atZone(settings.zone());
        ZonedDateTime until = now.atZone(settings.zone());

        SchedulerConfig snapshot = config.get();
        int submitted = 0;
        for (Subject subject : snapshot.subjects()) {
            if (!subject.enabled()) {
                continue;
            }
            try {
                Optional<Schedule> fired = firstFired(subject, after, until);
                if (fired.isEmpty()) {
                    continue;
                }
                log.debug("lapse schedule fired subject={} schedule={} at={}", subject.id(), fired.get().id(), now);
                if (submit(subject).submitted()) {
                    submitted++;
                }
            } catch (Exception e) {
                log.error("lapse subject tick failed subject={} msg={}", subject.id(), e.getMessage(), e);
            }
        }

        if (submitted > 0) {
            log.debug("lapse tick submitted={} window=({}, {}]", submitted, windowStart, now);
        }
        taskManager.gc();
    }

    private Instant windowStart(Instant now) {
        Duration interval = settings.tickInterval();
        Instant fallback = now.minus(interval);
        if (lastTickAt == null) {
            return fallback;
        }
        if (Duration.between(lastTickAt, now).compareTo(interval.multipliedBy(2)) > 0) {
            log.warn("lapse tick gap too large, missed fire times are not replayed lastTickAt={} now={}", lastTickAt, now);
            return fallback;
        }
        return lastTickAt;
    }

    private static Optional<Schedule> firstFired(Subject subject, ZonedDateTime after, ZonedDateTime until) {
        return subject.schedules().stream()
                .filter(Schedule::enabled)
                .filter(s -> s.expression().firesWithin(after, until))
                .findFirst();
    }

    private SubmitResult submit(Subject subject) {
        JobFactoryRegistry.PreparedJob job = registry.prepare(subject);
        SubmitResult result = taskManager.submitForSubject(job.kind(), subject.id(), job.name(), job.body());
        if (result.submitted()) {
            log.info("lapse job submitted subject={} kind={} id={}", subject.id(), job.kind(), result.taskId());
        } else {
            log.info("lapse job skipped, previous run still active subject={} kind={} activeId={}",
                    subject.id(), job.kind(), result.taskId());
        }
        return result;
    }

    /**
     * Swap in a new subject set. Every subject's settings must convert for its factory, otherwise the
     * current set is kept and the error is thrown.
     */
    @Override
    public void reload(SchedulerConfig newConfig) {
        Objects.requireNonNull(newConfig, "config must not be null");
        for (Subject subject : newConfig.subjects()) {
            try {
                registry.validate(subject);
            } catch (IllegalStateException e) {
                throw new IllegalArgumentException("Unsupported subject " + subject.id() + ": " + e.getMessage(), e);
            }
        }
        SchedulerConfig previous = config.getAndSet(newConfig);
        log.info("Scheduler reloaded subjects={} previous={}", newConfig.subjects().size(), previous.subjects().size());
    }

    @Override
    public SchedulerConfig config() {
        return config.get();
    }

    @Override
    public SubmitResult runNow(String subjectId) {
        Subject subject = config.get().find(subjectId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown subject: " + subjectId));
        log.info("lapse run now subject={}", subjectId);
        return submit(subject);
    }

    @Override
    public List<ScheduledJobInfo> listJobs(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        ZonedDateTime at = now.atZone(settings.zone());
        List<ScheduledJobInfo> jobs = new ArrayList<>();
        for (Subject subject : config.get().subjects()) {
            if (!subject.enabled()) {
                continue;
            }
            for (Schedule schedule : subject.schedules()) {
                if (!schedule.enabled()) {
                    continue;
                }
                Instant next = schedule.expression().nextFireAfter(at)
                        .map(ZonedDateTime::toInstant)
                        .orElse(null);
                jobs.add(new ScheduledJobInfo(
                        subject.id(),
                        subject.name(),
                        subject.kind(),
                        schedule.id(),
                        schedule.expression().toText(),
                        next
                ));
            }
        }
        return jobs;
    }
}
