package io.lapse4j.schedule;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Conversion between the simplified schedule editor ("every N units, from hour X to hour Y") and
 * cron fields.
 *
 * <p>The editor cannot represent every cron expression. {@link #read(CronSchedule)} returns an
 * advanced {@link Reading} carrying the original text whenever the fields do not come from
 * {@link #toCron(Fields)}, instead of approximating them.
 */
public final class ScheduleBuilder {
    private ScheduleBuilder() {
    }

    /**
     * Editor fields. {@code from == to == 0} means all day; {@code from > to} wraps past midnight.
     */
    public record Fields(int from, int to, int amount, IntervalUnit unit) {

        public Fields {
            Objects.requireNonNull(unit, "unit must not be null");
            checkHour(from, "from");
            checkHour(to, "to");
            if (amount < 1) {
                throw new InvalidExpressionException("interval", Integer.toString(amount), "amount must be at least 1");
            }
        }

        /**
         * Editor input as typed: the amount is rounded and raised to at least 1.
         */
        public static Fields of(int from, int to, double amount, IntervalUnit unit) {
            long rounded = Math.round(amount);
            return new Fields(from, to, (int) Math.max(1, Math.min(rounded, Integer.MAX_VALUE)), unit);
        }

        public boolean allDay() {
            return from == 0 && to == 0;
        }

        private static void checkHour(int h, String name) {
            if (h < FieldRange.HOUR.lo() || h > FieldRange.HOUR.hi()) {
                throw new InvalidExpressionException("hour", Integer.toString(h), name + " must be within 0-23");
            }
        }
    }

    /**
     * Result of reading cron fields back into the editor: either {@code fields} or the raw
     * {@code advancedText} for expressions the editor cannot show.
     */
    public record Reading(Fields fields, String advancedText) {

        public static Reading simple(Fields fields) {
            return new Reading(Objects.requireNonNull(fields, "fields must not be null"), null);
        }

        public static Reading advanced(String text) {
            return new Reading(null, Objects.requireNonNull(text, "text must not be null"));
        }

        public boolean isAdvanced() {
            return fields == null;
        }
    }

    /**
     * Hour field for an active window: {@code *} for 0/0, a single hour for from == to,
     * {@code from-to} for a plain window and {@code from-23,0-to} for one crossing midnight.
     */
    public static CronField hourWindow(int from, int to) {
        Fields.checkHour(from, "from");
        Fields.checkHour(to, "to");
        if (from == 0 && to == 0) {
            return CronField.every(FieldRange.HOUR);
        }
        if (from == to) {
            return CronField.at(FieldRange.HOUR, from);
        }
        if (from < to) {
            return CronField.parse(from + "-" + to, FieldRange.HOUR);
        }
        return CronField.parse(from + "-23,0-" + to, FieldRange.HOUR);
    }

    public static CronSchedule toCron(Fields f) {
        Objects.requireNonNull(f, "fields must not be null");
        CronField hour = hourWindow(f.from(), f.to());
        String second = "0";
        String minute;

        switch (f.unit()) {
            case SECONDS -> {
                minute = "*";
                second = f.amount() >= 60 ? "0" : "*/" + f.amount();
            }
            case MINUTES -> minute = f.amount() >= 60 ? "0" : "*/" + f.amount();
            case HOURS -> {
                minute = "0";
                if (f.amount() > 1) {
                    if (f.allDay()) {
                        hour = CronField.parse("*/" + f.amount(), FieldRange.HOUR);
                    } else if (f.from() < f.to()) {
                        hour = CronField.parse(f.from() + "-" + f.to() + "/" + f.amount(), FieldRange.HOUR);
                    }
                }
            }
            default -> throw new IllegalStateException("Unsupported unit: " + f.unit());
        }

        return new CronSchedule(
                CronField.parse(second, FieldRange.SECOND),
                CronField.parse(minute, FieldRange.MINUTE),
                hour
        );
    }

    public static IntervalSchedule toInterval(int amount, IntervalUnit unit, Instant anchor) {
        return new IntervalSchedule(amount, unit, anchor);
    }

    /**
     * Reverse of {@link #toCron(Fields)}.
     */
    public static Reading read(CronSchedule schedule) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        List<CronField.Segment> hours = schedule.hour().segments();
        String second = schedule.second().toString();
        String minute = schedule.minute().toString();

        int from;
        int to;
        int hourStep = 1;
        if (hours.size() == 1) {
            CronField.Segment h = hours.get(0);
            if (h.wildcard()) {
                from = 0;
                to = 0;
            } else {
                from = h.start();
                to = h.end();
            }
            hourStep = h.step();
        } else if (isWrap(hours)) {
            from = hours.get(0).start();
            to = hours.get(1).end();
        } else {
            return Reading.advanced(schedule.toText());
        }

        Integer secondStep = stepOf(schedule.second());
        Integer minuteStep = stepOf(schedule.minute());

        if (hourStep == 1 && "*".equals(minute) && secondStep != null && !"0".equals(second)) {
            return Reading.simple(new Fields(from, to, secondStep, IntervalUnit.SECONDS));
        }
        if (!"0".equals(second)) {
            return Reading.advanced(schedule.toText());
        }
        if (hourStep == 1 && minuteStep != null) {
            return Reading.simple(new Fields(from, to, minuteStep, IntervalUnit.MINUTES));
        }
        if ("0".equals(minute)) {
            return Reading.simple(new Fields(from, to, hourStep, IntervalUnit.HOURS));
        }
        return Reading.advanced(schedule.toText());
    }

    // "*" -> 1, "*/N" -> N, anything else -> null
    private static Integer stepOf(CronField field) {
        if (field.segments().size() != 1) {
            return null;
        }
        CronField.Segment s = field.segments().get(0);
        return s.wildcard() ? s.step() : null;
    }

    private static boolean isWrap(List<CronField.Segment> hours) {
        if (hours.size() != 2) {
            return false;
        }
        CronField.Segment a = hours.get(0);
        CronField.Segment b = hours.get(1);
        return !a.wildcard() && !b.wildcard()
                && a.step() == 1 && b.step() == 1
                && a.end() == FieldRange.HOUR.hi() && b.start() == FieldRange.HOUR.lo()
                && a.start() > b.end();
    }

    /**
     * "Every 15 minutes, 10 PM - 2 AM".
     */
    public static String summary(Fields f) {
        String range;
        if (f.allDay()) {
            range = "all day";
        } else if (f.from() == f.to()) {
            range = "at " + formatHour(f.from()) + " only";
        } else if (f.to() == 0) {
            range = "from " + formatHour(f.from());
        } else {
            range = formatHour(f.from()) + " - " + formatHour(f.to());
        }
        return "Every " + f.unit().format(f.amount()) + ", " + range;
    }

    public static String formatHour(int h) {
        if (h == 0) return "12 AM";
        if (h < 12) return h + " AM";
        if (h == 12) return "12 PM";
        return (h - 12) + " PM";
    }
}
