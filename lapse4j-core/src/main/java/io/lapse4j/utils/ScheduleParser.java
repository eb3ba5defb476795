package io.lapse4j.utils;

import io.lapse4j.schedule.CronSchedule;
import io.lapse4j.schedule.IntervalSchedule;
import io.lapse4j.schedule.IntervalUnit;
import io.lapse4j.schedule.InvalidExpressionException;
import io.lapse4j.schedule.ScheduleExpression;

import java.text.ParseException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.Locale;
import java.util.Optional;
import java.util.TimeZone;

import org.quartz.CronExpression;

/**
 * Parses and formats the persisted text form of schedules.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Cron: {@code "<second> <minute> <hour>"}, e.g. "0 *&#47;15 22-23,0-2"</li>
 *   <li>Interval: {@code "every <amount> <unit> from <ISO-8601 instant>"}, e.g.
 *       "every 15 minutes from 2026-01-01T00:00:00Z"</li>
 * </ul>
 * <p>
 * {@code parse(format(expr))} equals {@code expr} for every expression built by this package.
 */
public final class ScheduleParser {
    private ScheduleParser() {
    }

    private static final String EVERY = "every ";
    private static final String FROM = " from ";

    public static ScheduleExpression parse(String text) {
        return parse(text, ZoneId.systemDefault());
    }

    /**
     * Parse a schedule, reading an interval anchor without offset in {@code zone}.
     */
    public static ScheduleExpression parse(String text, ZoneId zone) {
        if (text == null) {
            throw new InvalidExpressionException("schedule", "null", "text must not be null");
        }
        String s = text.trim();
        if (s.isEmpty()) {
            throw new InvalidExpressionException("schedule", text, "text must not be empty");
        }

        if (s.toLowerCase(Locale.ROOT).startsWith(EVERY)) {
            return parseInterval(s, zone);
        }

        String[] parts = s.split("\\s+");
        if (parts.length != 3) {
            throw new InvalidExpressionException("schedule", text,
                    "expected '<second> <minute> <hour>' or 'every <amount> <unit> from <instant>'");
        }
        return CronSchedule.of(parts[0], parts[1], parts[2]);
    }

    public static String format(ScheduleExpression expression) {
        return expression.toText();
    }

    private static IntervalSchedule parseInterval(String s, ZoneId zone) {
        String body = s.substring(EVERY.length()).trim();
        int from = body.toLowerCase(Locale.ROOT).indexOf(FROM);
        if (from < 0) {
            throw new InvalidExpressionException("interval", s, "missing 'from <instant>' anchor");
        }
        String spec = body.substring(0, from).trim();
        Instant anchor = parseAnchor(body.substring(from + FROM.length()).trim(), zone);

        String[] parts = spec.split("\\s+");
        if (parts.length != 2) {
            throw new InvalidExpressionException("interval", s, "expected '<amount> <unit>'");
        }
        return new IntervalSchedule(parseAmount(parts[0], s), IntervalUnit.parse(parts[1]), anchor);
    }

    private static long parseAmount(String digits, String text) {
        if (!digits.matches("^\\d+$")) {
            throw new InvalidExpressionException("interval", text, "amount must be a positive integer: " + digits);
        }
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException ex) {
            throw new InvalidExpressionException("interval", text, "amount out of range: " + digits);
        }
    }

    /**
     * Parse an anchor timestamp. Accepts an instant ("2026-01-01T00:00:00Z"), an offset date-time,
     * or a local date-time interpreted in {@code zone}.
     */
    public static Instant parseAnchor(String text, ZoneId zone) {
        if (text == null || text.isBlank()) {
            throw new InvalidExpressionException("anchor", String.valueOf(text), "anchor must not be empty");
        }
        String s = text.trim();
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(s, ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime zdt) {
                return zdt.toInstant();
            }
            return ((LocalDateTime) parsed).atZone(zone).toInstant();
        } catch (DateTimeParseException ex) {
            throw new InvalidExpressionException("anchor", s, "expected an ISO-8601 date-time");
        }
    }

    /**
     * Quartz form of a cron schedule: every day, every month, any weekday.
     */
    public static String toQuartzCron(CronSchedule schedule) {
        return String.join(" ",
                schedule.second().toString(),
                schedule.minute().toString(),
                schedule.hour().toString(),
                "*", "*", "?");
    }

    /**
     * Returns true if the text parses as a schedule.
     */
    public static boolean isValid(String text) {
        try {
            parse(text);
            return true;
        } catch (InvalidExpressionException ignored) {
            return false;
        }
    }

    /**
     * Next cron occurrence strictly after {@code after}, computed by Quartz in {@code after}'s zone.
     */
    public static Optional<ZonedDateTime> nextCronFireTime(CronSchedule schedule, ZonedDateTime after) {
        String cron = toQuartzCron(schedule);
        CronExpression exp;
        try {
            exp = new CronExpression(cron);
        } catch (ParseException ex) {
            throw new IllegalStateException("Quartz rejected cron expression: " + cron, ex);
        }
        exp.setTimeZone(TimeZone.getTimeZone(after.getZone()));

        Date nextDate = exp.getNextValidTimeAfter(Date.from(after.toInstant()));
        if (nextDate == null) {
            return Optional.empty();
        }
        return Optional.of(ZonedDateTime.ofInstant(nextDate.toInstant(), after.getZone()));
    }
}
