package io.lapse4j.filter;

public enum FilterMode {
    /**
     * Keep items whose minute-truncated timestamp equals a slot.
     */
    EXACT,
    /**
     * Keep, per slot, the single closest item within the search window.
     */
    NEAREST
}
