package io.lapse4j.core;

import java.time.Instant;

/**
 * One enabled schedule as listed by the scheduler. {@code nextRunAt} is null when the schedule never
 * fires again.
 */
public record ScheduledJobInfo(
        String subjectId,
        String subjectName,
        SubjectKind subjectKind,
        String scheduleId,
        String expression,
        Instant nextRunAt
) {
}
