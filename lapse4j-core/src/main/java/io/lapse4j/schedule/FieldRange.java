package io.lapse4j.schedule;

public enum FieldRange {

    SECOND("second", 0, 59),
    MINUTE("minute", 0, 59),
    HOUR("hour", 0, 23);

    private final String label;
    private final int lo;
    private final int hi;

    FieldRange(String label, int lo, int hi) {
        this.label = label;
        this.lo = lo;
        this.hi = hi;
    }

    public String label() {
        return label;
    }

    public int lo() {
        return lo;
    }

    public int hi() {
        return hi;
    }
}
