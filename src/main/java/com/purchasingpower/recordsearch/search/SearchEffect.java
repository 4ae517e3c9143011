package com.purchasingpower.recordsearch.search;

import com.purchasingpower.recordsearch.index.BitVector;

/**
 * How the items matched by an operation affect the running selection.
 *
 * @since 1.0.0
 */
public enum SearchEffect {

    /**
     * Adds the matching items to the selection (set union).
     */
    ADD,

    /**
     * Removes the matching items from the selection (set difference).
     */
    REMOVE,

    /**
     * Keeps only selected items that also match (set intersection).
     */
    FILTER;

    /**
     * Combines a condition's match vector into the current selection.
     *
     * @param current The current selection
     * @param matched The positions matched by the condition
     * @return The new selection
     */
    public BitVector apply(BitVector current, BitVector matched) {
        switch (this) {
            case ADD:
                return BitVector.or(current, matched);

            case REMOVE:
                return BitVector.andNot(current, matched);

            case FILTER:
                return BitVector.and(current, matched);

            default:
                throw new IllegalStateException("Unknown search effect: " + this);
        }
    }
}
