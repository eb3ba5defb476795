package io.lapse4j.schedule;

import io.lapse4j.utils.ScheduleParser;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Wall-clock schedule: fires on every second whose second, minute and hour each satisfy their field.
 */
public record CronSchedule(CronField second, CronField minute, CronField hour) implements ScheduleExpression {

    // Longest window firesWithin scans second by second; one day covers every combination.
    private static final Duration MAX_SCAN = Duration.ofDays(1);

    public CronSchedule {
        requireRange(second, FieldRange.SECOND);
        requireRange(minute, FieldRange.MINUTE);
        requireRange(hour, FieldRange.HOUR);
    }

    private static void requireRange(CronField field, FieldRange range) {
        Objects.requireNonNull(field, range.label() + " must not be null");
        if (field.lo() != range.lo() || field.hi() != range.hi()) {
            throw new InvalidExpressionException(range.label(), field.toString(),
                    "field range " + field.lo() + "-" + field.hi() + " does not match " + range.lo() + "-" + range.hi());
        }
    }

    public static CronSchedule of(String second, String minute, String hour) {
        return new CronSchedule(
                CronField.parse(second, FieldRange.SECOND),
                CronField.parse(minute, FieldRange.MINUTE),
                CronField.parse(hour, FieldRange.HOUR)
        );
    }

    @Override
    public ScheduleKind kind() {
        return ScheduleKind.CRON;
    }

    @Override
    public boolean matches(ZonedDateTime at) {
        return second.matches(at.getSecond())
                && minute.matches(at.getMinute())
                && hour.matches(at.getHour());
    }

    @Override
    public boolean firesWithin(ZonedDateTime after, ZonedDateTime until) {
        if (!until.isAfter(after)) {
            return false;
        }
        ZonedDateTime from = after;
        if (Duration.between(after, until).compareTo(MAX_SCAN) > 0) {
            from = until.minus(MAX_SCAN);
        }
        ZonedDateTime t = from.truncatedTo(ChronoUnit.SECONDS).plusSeconds(1);
        while (!t.isAfter(until)) {
            if (matches(t)) {
                return true;
            }
            t = t.plusSeconds(1);
        }
        return false;
    }

    @Override
    public Optional<ZonedDateTime> nextFireAfter(ZonedDateTime after) {
        return ScheduleParser.nextCronFireTime(this, after);
    }

    /**
     * Preview of the first fire times of a day: hours capped at five, at most {@code count} entries.
     */
    public List<LocalTime> sampleTimes(int count) {
        List<LocalTime> times = new ArrayList<>();
        List<Integer> seconds = second.expand(60);
        for (int h : hour.expand(5)) {
            for (int m : minute.expand(60)) {
                for (int s : seconds) {
                    if (times.size() >= count) {
                        return times;
                    }
                    times.add(LocalTime.of(h, m, s));
                }
            }
        }
        return times;
    }

    @Override
    public String toText() {
        return second + " " + minute + " " + hour;
    }
}
