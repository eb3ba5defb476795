package io.lapse4j.filter;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A payload (usually an image path) with the local timestamp it was captured at.
 */
public record TimedItem<T>(LocalDateTime timestamp, T payload) {

    public TimedItem {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public static <T> TimedItem<T> of(LocalDateTime timestamp, T payload) {
        return new TimedItem<>(timestamp, payload);
    }
}
