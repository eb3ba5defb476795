package io.lapse4j.schedule;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One cron-style sub-expression (second, minute or hour) over a bounded integer range.
 *
 * <p>Supported syntax, combinable with commas:
 * <ul>
 *   <li>{@code *} every value in range</li>
 *   <li>{@code *}{@code /N} every N-th value starting at the lower bound</li>
 *   <li>{@code A-B} inclusive range, A &lt;= B</li>
 *   <li>{@code A-B/N} stepped range</li>
 *   <li>{@code A} single value</li>
 * </ul>
 * A range crossing the top of the domain is written as two ranges, e.g. hours 22 through 2 as
 * {@code 22-23,0-2}.
 *
 * <p>Parsing normalizes redundant forms ({@code *}{@code /1} to {@code *}, {@code A-A} to
 * {@code A}) so {@code parse(field.toString())} always equals {@code field}.
 */
public record CronField(String label, int lo, int hi, List<Segment> segments) {

    /**
     * A single comma-separated element: the values {@code start, start+step, ...} up to {@code end}.
     */
    public record Segment(int start, int end, int step, boolean wildcard) {

        public boolean contains(int value) {
            return value >= start && value <= end && (value - start) % step == 0;
        }

        @Override
        public String toString() {
            if (wildcard) {
                return step == 1 ? "*" : "*/" + step;
            }
            if (start == end) {
                return Integer.toString(start);
            }
            return step == 1 ? start + "-" + end : start + "-" + end + "/" + step;
        }
    }

    public CronField {
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(segments, "segments must not be null");
        if (lo > hi) {
            throw new IllegalArgumentException("lo must not exceed hi");
        }
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("segments must not be empty");
        }
        segments = List.copyOf(segments);
    }

    public static CronField parse(String text, FieldRange range) {
        Objects.requireNonNull(range, "range must not be null");
        return parse(text, range.lo(), range.hi(), range.label());
    }

    /**
     * Parse {@code text} over {@code [lo, hi]}.
     *
     * @throws InvalidExpressionException on malformed syntax, out-of-range values or a step below 1
     */
    public static CronField parse(String text, int lo, int hi, String label) {
        if (text == null) {
            throw new InvalidExpressionException(label, "null", "expression must not be null");
        }
        String s = text.trim();
        if (s.isEmpty()) {
            throw new InvalidExpressionException(label, text, "expression must not be empty");
        }

        List<Segment> segments = new ArrayList<>();
        for (String part : s.split(",", -1)) {
            segments.add(parseSegment(part.trim(), text, lo, hi, label));
        }
        return new CronField(label, lo, hi, segments);
    }

    /**
     * Field matching every value in range ({@code *}).
     */
    public static CronField every(FieldRange range) {
        return new CronField(range.label(), range.lo(), range.hi(),
                List.of(new Segment(range.lo(), range.hi(), 1, true)));
    }

    /**
     * Field matching exactly one value.
     */
    public static CronField at(FieldRange range, int value) {
        return parse(Integer.toString(value), range);
    }

    private static Segment parseSegment(String part, String text, int lo, int hi, String label) {
        if (part.isEmpty()) {
            throw new InvalidExpressionException(label, text, "empty list element");
        }

        String base = part;
        int step = 1;
        int slash = part.indexOf('/');
        if (slash >= 0) {
            base = part.substring(0, slash);
            step = parseNumber(part.substring(slash + 1), text, label);
            if (step < 1) {
                throw new InvalidExpressionException(label, text, "step must be at least 1");
            }
        }

        if ("*".equals(base)) {
            return new Segment(lo, hi, step, true);
        }

        int dash = base.indexOf('-');
        if (dash < 0) {
            if (slash >= 0) {
                throw new InvalidExpressionException(label, text, "a step requires '*' or a range: " + part);
            }
            int value = checkRange(parseNumber(base, text, label), text, lo, hi, label);
            return new Segment(value, value, 1, false);
        }

        int start = checkRange(parseNumber(base.substring(0, dash), text, label), text, lo, hi, label);
        int end = checkRange(parseNumber(base.substring(dash + 1), text, label), text, lo, hi, label);
        if (start > end) {
            throw new InvalidExpressionException(label, text,
                    "range start " + start + " is after end " + end + "; split wrapping ranges as '" + start + "-" + hi + "," + lo + "-" + end + "'");
        }
        if (start == end) {
            step = 1;
        }
        return new Segment(start, end, step, false);
    }

    private static int parseNumber(String s, String text, String label) {
        if (s.isEmpty() || !s.chars().allMatch(Character::isDigit)) {
            throw new InvalidExpressionException(label, text, "not a number: '" + s + "'");
        }
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException ex) {
            throw new InvalidExpressionException(label, text, "number too large: " + s);
        }
    }

    private static int checkRange(int value, String text, int lo, int hi, String label) {
        if (value < lo || value > hi) {
            throw new InvalidExpressionException(label, text, "value " + value + " out of range " + lo + "-" + hi);
        }
        return value;
    }

    public boolean matches(int value) {
        for (Segment segment : segments) {
            if (segment.contains(value)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Enumerate matching values in ascending order, without duplicates, stopping after {@code maxItems}.
     */
    public List<Integer> expand(int maxItems) {
        List<Integer> values = new ArrayList<>();
        for (int v = lo; v <= hi && values.size() < maxItems; v++) {
            if (matches(v)) {
                values.add(v);
            }
        }
        return values;
    }

    public List<Integer> values() {
        return expand(Integer.MAX_VALUE);
    }

    /**
     * True for a bare {@code *}.
     */
    public boolean isWildcard() {
        return segments.size() == 1 && segments.get(0).wildcard() && segments.get(0).step() == 1;
    }

    @Override
    public String toString() {
        return segments.stream().map(Segment::toString).collect(Collectors.joining(","));
    }
}
