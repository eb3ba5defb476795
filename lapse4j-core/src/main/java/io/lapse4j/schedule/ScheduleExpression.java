package io.lapse4j.schedule;

import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * A recurring trigger definition. Implementations are immutable and matching never mutates them.
 *
 * <ul>
 *   <li>{@link CronSchedule}: second/minute/hour sub-expressions aligned to the wall clock</li>
 *   <li>{@link IntervalSchedule}: fixed period anchored to a start instant</li>
 * </ul>
 */
public interface ScheduleExpression {

    ScheduleKind kind();

    /**
     * True if {@code at}, taken at whole-second precision, is a fire time.
     */
    boolean matches(ZonedDateTime at);

    /**
     * True if a fire time falls inside the window {@code (after, until]}.
     * <p>
     * This is how the scheduler evaluates a tick: a schedule matches "now" when it fired at some
     * point since the previous tick.
     */
    boolean firesWithin(ZonedDateTime after, ZonedDateTime until);

    /**
     * First fire time strictly after {@code after}, if any.
     */
    Optional<ZonedDateTime> nextFireAfter(ZonedDateTime after);

    /**
     * Persisted text form; {@code ScheduleParser.parse(toText())} yields an equal expression.
     */
    String toText();
}
