package io.lapse4j.filter;

import io.lapse4j.schedule.InvalidExpressionException;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * The dates a time filter applies to.
 */
public final class DateSpan {

    public enum Kind {
        ALL,
        SINGLE,
        RANGE,
        SELECTED
    }

    private static final DateSpan ALL = new DateSpan(Kind.ALL, null, null, Set.of());

    private final Kind kind;
    private final LocalDate from;
    private final LocalDate to;
    private final Set<LocalDate> dates;

    private DateSpan(Kind kind, LocalDate from, LocalDate to, Set<LocalDate> dates) {
        this.kind = kind;
        this.from = from;
        this.to = to;
        this.dates = dates;
    }

    public static DateSpan all() {
        return ALL;
    }

    public static DateSpan on(LocalDate date) {
        Objects.requireNonNull(date, "date must not be null");
        return new DateSpan(Kind.SINGLE, date, date, Set.of(date));
    }

    /**
     * Inclusive range. Either end may be null for an open range ("from start", "to end").
     */
    public static DateSpan between(LocalDate from, LocalDate to) {
        if (from == null && to == null) {
            return ALL;
        }
        if (from != null && to != null && from.isAfter(to)) {
            throw new InvalidExpressionException("date range", from + ".." + to, "start date is after end date");
        }
        return new DateSpan(Kind.RANGE, from, to, Set.of());
    }

    public static DateSpan selected(Collection<LocalDate> dates) {
        Objects.requireNonNull(dates, "dates must not be null");
        if (dates.isEmpty()) {
            throw new InvalidExpressionException("selected dates", "[]", "at least one date is required");
        }
        return new DateSpan(Kind.SELECTED, null, null, Collections.unmodifiableSet(new TreeSet<>(dates)));
    }

    public boolean contains(LocalDate date) {
        return switch (kind) {
            case ALL -> true;
            case SINGLE, SELECTED -> dates.contains(date);
            case RANGE -> (from == null || !date.isBefore(from)) && (to == null || !date.isAfter(to));
        };
    }

    public Kind kind() {
        return kind;
    }

    public LocalDate from() {
        return from;
    }

    public LocalDate to() {
        return to;
    }

    public Set<LocalDate> dates() {
        return dates;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case ALL -> "all";
            case SINGLE -> from.toString();
            case RANGE -> (from == null ? "start" : from.toString()) + " to " + (to == null ? "end" : to.toString());
            case SELECTED -> dates.toString();
        };
    }
}
