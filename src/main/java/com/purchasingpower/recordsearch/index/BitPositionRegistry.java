package com.purchasingpower.recordsearch.index;

import com.google.common.base.Preconditions;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * A registry of owned bit positions within an unbounded {@link BitVector}.
 *
 * <p>Released positions are recycled most-recent-first before the high-water mark
 * is advanced, keeping vectors as narrow as possible.
 *
 * <p><b>Thread Safety:</b> Not thread safe. The owning {@link SearchIndex} is
 * mutated from a single thread.
 *
 * @since 1.0.0
 */
public class BitPositionRegistry {

    private final Deque<Integer> recycled = new ArrayDeque<>();
    private int next;
    private BitVector field = BitVector.EMPTY;

    /**
     * A vector of all currently claimed positions.
     */
    public BitVector getField() {
        return field;
    }

    /**
     * The number of bits needed to represent any vector from this registry.
     * This is a high-water mark: recycled positions still count until they are reclaimed.
     */
    public int size() {
        return next;
    }

    /**
     * Claims a position, preferring a recycled one.
     *
     * @return A position that was not claimed before this call
     */
    public int claim() {
        int claimed = recycled.isEmpty() ? next++ : recycled.pop();
        field = BitVector.or(field, BitVector.fromPosition(claimed));
        return claimed;
    }

    /**
     * Relinquishes a claimed position back to the registry.
     *
     * @param position The position to relinquish
     * @throws IllegalStateException if the position is not currently claimed
     */
    public void relinquish(int position) {
        Preconditions.checkState(field.get(position), "Bit position %s is not claimed", position);

        recycled.push(position);
        field = BitVector.andNot(field, BitVector.fromPosition(position));
    }
}
