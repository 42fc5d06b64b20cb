// file: src/main/java/io/leafsync/core/CausalOrder.java
package io.leafsync.core;

/**
 * Partial order between two document versions.
 * <p>
 * Interpretation for {@code a.compare(b)}:
 *  - EQUAL:      a and b summarize the same causal history.
 *  - BEFORE:     b has seen everything a has, and at least one change more.
 *  - AFTER:      a has seen everything b has, and at least one change more.
 *  - CONCURRENT: each side has changes the other has not seen.
 */
public enum CausalOrder {
    EQUAL, BEFORE, AFTER, CONCURRENT;

    /**
     * Return the "perspective" if we swap the left/right arguments.
     */
    public CausalOrder swap() {
        return switch (this) {
            case BEFORE -> AFTER;
            case AFTER -> BEFORE;
            default -> this;
        };
    }

    /** True when the right-hand side knows something the left-hand side does not. */
    public boolean rightHasNews() {
        return this == BEFORE || this == CONCURRENT;
    }
}
