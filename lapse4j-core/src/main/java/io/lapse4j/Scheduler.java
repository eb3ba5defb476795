package io.lapse4j;

import io.lapse4j.core.ScheduledJobInfo;
import io.lapse4j.core.SchedulerConfig;
import io.lapse4j.core.SubmitResult;

import java.time.Instant;
import java.util.List;

/**
 * Main scheduler API.
 *
 * <p>Evaluates every enabled schedule of every enabled subject on a fixed cadence and submits a job
 * to the {@link TaskManager} when one fires. At most one task per subject and job kind is active at
 * any time.
 */
public interface Scheduler {
    void start();

    void stop();

    /**
     * Evaluate all schedules for the tick ending at {@code now}.
     */
    void tick(Instant now);

    /**
     * Replace the whole subject set. Ticks started after this returns see the new set; running tasks
     * are not touched.
     */
    void reload(SchedulerConfig config);

    SchedulerConfig config();

    /**
     * Trigger a subject's job immediately, bypassing its schedules but not de-duplication.
     *
     * @throws IllegalArgumentException if no subject has this id
     */
    SubmitResult runNow(String subjectId);

    /**
     * Enabled schedules with their next fire time after {@code now}.
     */
    List<ScheduledJobInfo> listJobs(Instant now);
}
