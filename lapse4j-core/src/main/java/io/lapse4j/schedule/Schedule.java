package io.lapse4j.schedule;

import java.util.Objects;

/**
 * A schedule attached to a subject: an expression plus its identity and enabled flag.
 * Disabled schedules are kept with the subject but never matched.
 */
public record Schedule(String id, ScheduleExpression expression, boolean enabled) {

    public Schedule {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(expression, "expression must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
    }

    public static Schedule enabled(String id, ScheduleExpression expression) {
        return new Schedule(id, expression, true);
    }
}
