package io.lapse4j.schedule;

import java.time.Duration;
import java.util.Locale;

public enum IntervalUnit {

    SECONDS("second", Duration.ofSeconds(1)),
    MINUTES("minute", Duration.ofMinutes(1)),
    HOURS("hour", Duration.ofHours(1));

    private final String singular;
    private final Duration unit;

    IntervalUnit(String singular, Duration unit) {
        this.singular = singular;
        this.unit = unit;
    }

    public Duration toDuration(long amount) {
        return unit.multipliedBy(amount);
    }

    /**
     * "1 minute", "15 minutes".
     */
    public String format(long amount) {
        return amount == 1 ? amount + " " + singular : amount + " " + singular + "s";
    }

    /**
     * Accepts "seconds"/"second"/"s", "minutes"/"minute"/"m", "hours"/"hour"/"h", case-insensitive.
     */
    public static IntervalUnit parse(String text) {
        if (text == null) {
            throw new InvalidExpressionException("interval unit", "null", "unit must not be null");
        }
        String s = text.trim().toLowerCase(Locale.ROOT);
        for (IntervalUnit u : values()) {
            if (s.equals(u.singular) || s.equals(u.singular + "s") || s.equals(u.singular.substring(0, 1))) {
                return u;
            }
        }
        throw new InvalidExpressionException("interval unit", text, "expected seconds, minutes or hours");
    }
}
