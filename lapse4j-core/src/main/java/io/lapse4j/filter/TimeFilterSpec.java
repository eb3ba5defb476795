package io.lapse4j.filter;

import io.lapse4j.schedule.CronField;
import io.lapse4j.schedule.FieldRange;
import io.lapse4j.schedule.InvalidExpressionException;

import java.time.Duration;
import java.util.Objects;

/**
 * Which items of an image sequence a {@link TimeFilter} keeps.
 *
 * <p>All validation happens here, so a spec that exists is always safe to run.
 */
public record TimeFilterSpec(
        DateSpan span,
        CronField hours,
        CronField minutes,
        FilterMode mode,
        Duration searchWindow
) {

    public static final Duration DEFAULT_SEARCH_WINDOW = Duration.ofMinutes(5);

    public TimeFilterSpec {
        Objects.requireNonNull(span, "span must not be null");
        Objects.requireNonNull(hours, "hours must not be null");
        Objects.requireNonNull(minutes, "minutes must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(searchWindow, "searchWindow must not be null");
        requireRange(hours, FieldRange.HOUR);
        requireRange(minutes, FieldRange.MINUTE);
        if (searchWindow.isNegative()) {
            throw new InvalidExpressionException("search window", searchWindow.toString(), "must not be negative");
        }
    }

    private static void requireRange(CronField field, FieldRange range) {
        if (field.lo() != range.lo() || field.hi() != range.hi()) {
            throw new InvalidExpressionException(range.label(), field.toString(),
                    "mask must cover " + range.lo() + "-" + range.hi());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private DateSpan span = DateSpan.all();
        private CronField hours = CronField.every(FieldRange.HOUR);
        private CronField minutes = CronField.every(FieldRange.MINUTE);
        private FilterMode mode = FilterMode.EXACT;
        private Duration searchWindow = DEFAULT_SEARCH_WINDOW;

        public Builder span(DateSpan span) {
            this.span = span;
            return this;
        }

        /**
         * Hour mask, e.g. "6-20" or "22-23,0-2". Parsed immediately.
         */
        public Builder hours(String hours) {
            this.hours = CronField.parse(hours, FieldRange.HOUR);
            return this;
        }

        /**
         * Minute mask, e.g. "*&#47;10". Parsed immediately.
         */
        public Builder minutes(String minutes) {
            this.minutes = CronField.parse(minutes, FieldRange.MINUTE);
            return this;
        }

        public Builder exact() {
            this.mode = FilterMode.EXACT;
            return this;
        }

        public Builder nearest(Duration searchWindow) {
            this.mode = FilterMode.NEAREST;
            this.searchWindow = searchWindow;
            return this;
        }

        public Builder mode(FilterMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder searchWindow(Duration searchWindow) {
            this.searchWindow = searchWindow;
            return this;
        }

        public TimeFilterSpec build() {
            return new TimeFilterSpec(span, hours, minutes, mode, searchWindow);
        }
    }
}
