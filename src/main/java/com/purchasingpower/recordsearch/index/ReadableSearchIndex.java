package com.purchasingpower.recordsearch.index;

import java.util.Set;

/**
 * An immutable view of a {@link SearchIndex}.
 *
 * @since 1.0.0
 */
public interface ReadableSearchIndex {

    /**
     * A vector of every position claimed by any column.
     */
    BitVector getBitfield();

    /**
     * The number of bit positions needed to represent any vector of this index.
     */
    int size();

    /**
     * The declared column names, in declaration order.
     */
    Set<String> columnNames();

    /**
     * Gets a column from the index.
     *
     * @param name The column name
     * @return The column
     * @throws com.purchasingpower.recordsearch.exception.NoSuchColumnException if the column was not declared
     */
    IndexColumn column(String name);
}
