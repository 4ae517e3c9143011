package com.purchasingpower.recordsearch.index;

import java.util.OptionalInt;

/**
 * Read-only view of an indexed property (a column).
 *
 * <p>Iteration yields every stored {@code (normalizedValue, position)} pair. Callers
 * must not depend on the iteration order for correctness.
 *
 * @since 1.0.0
 */
public interface IndexColumn extends Iterable<IndexColumn.Entry> {

    /**
     * Normalizes a raw value using this column's rules.
     */
    String normalize(String value);

    /**
     * Gets the position associated with a value.
     *
     * @param value The raw value, normalized before lookup
     * @return The position, or empty if the value is not in the column
     */
    OptionalInt get(String value);

    /**
     * The number of distinct normalized values in this column.
     */
    int size();

    /**
     * A stored value and its bit position.
     */
    record Entry(String value, int position) {}
}
