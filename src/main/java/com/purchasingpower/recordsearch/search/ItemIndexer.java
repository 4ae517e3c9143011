package com.purchasingpower.recordsearch.search;

import com.purchasingpower.recordsearch.index.BitVector;
import com.purchasingpower.recordsearch.index.SearchIndex;

/**
 * Adds an item's property values to an index.
 *
 * @param <T> The item type
 */
@FunctionalInterface
public interface ItemIndexer<T> {

    /**
     * @param item The item to index
     * @param index The index the item's values are added to
     * @return The item's combined vector: the OR of the positions of every value it contributes
     */
    BitVector index(T item, SearchIndex index);
}
