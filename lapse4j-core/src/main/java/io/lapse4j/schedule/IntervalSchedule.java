package io.lapse4j.schedule;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Fires at {@code anchor + k * amount units} for every k &gt;= 0, independent of wall-clock alignment.
 */
public record IntervalSchedule(long amount, IntervalUnit unit, Instant anchor) implements ScheduleExpression {

    public IntervalSchedule {
        Objects.requireNonNull(unit, "unit must not be null");
        Objects.requireNonNull(anchor, "anchor must not be null");
        if (amount < 1) {
            throw new InvalidExpressionException("interval", Long.toString(amount), "amount must be a positive integer");
        }
        try {
            anchor.plus(unit.toDuration(amount));
        } catch (ArithmeticException | DateTimeException e) {
            throw new InvalidExpressionException("interval", unit.format(amount), "period is out of range");
        }
    }

    public Duration period() {
        return unit.toDuration(amount);
    }

    @Override
    public ScheduleKind kind() {
        return ScheduleKind.INTERVAL;
    }

    @Override
    public boolean matches(ZonedDateTime at) {
        Duration d = Duration.between(anchor, at.toInstant());
        if (d.isNegative() || d.getNano() != 0) {
            return false;
        }
        return d.getSeconds() % period().getSeconds() == 0;
    }

    @Override
    public boolean firesWithin(ZonedDateTime after, ZonedDateTime until) {
        Instant end = until.toInstant();
        if (end.isBefore(anchor) || !until.isAfter(after)) {
            return false;
        }
        Instant lastFire = sample(Duration.between(anchor, end).dividedBy(period()));
        return lastFire.isAfter(after.toInstant());
    }

    @Override
    public Optional<ZonedDateTime> nextFireAfter(ZonedDateTime after) {
        Instant from = after.toInstant();
        if (from.isBefore(anchor)) {
            return Optional.of(anchor.atZone(after.getZone()));
        }
        long k = Duration.between(anchor, from).dividedBy(period()) + 1;
        return Optional.of(sample(k).atZone(after.getZone()));
    }

    /**
     * The k-th fire time, {@code anchor + k * period}.
     */
    public Instant sample(long k) {
        if (k < 0) {
            throw new IllegalArgumentException("k must not be negative");
        }
        return anchor.plus(period().multipliedBy(k));
    }

    public List<Instant> samples(int count) {
        List<Instant> out = new ArrayList<>(count);
        for (int k = 0; k < count; k++) {
            out.add(sample(k));
        }
        return out;
    }

    @Override
    public String toText() {
        return "every " + unit.format(amount) + " from " + anchor;
    }
}
