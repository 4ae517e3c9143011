package com.purchasingpower.recordsearch.search;

import com.purchasingpower.recordsearch.index.ReadableSearchIndex;

import java.util.List;

/**
 * A {@link Search} to which no more items can be added.
 *
 * @param <T> The item type
 * @since 1.0.0
 */
public interface SealedSearch<T> {

    /**
     * The search index.
     */
    ReadableSearchIndex getIndex();

    /**
     * Resets the selection and scores to their starting state.
     */
    void reset();

    /**
     * Runs a search operation with weight {@code 1}.
     *
     * @see #search(String, SearchCondition, String, SearchEffect, float)
     */
    void search(String column, SearchCondition condition, String text, SearchEffect effect);

    /**
     * Runs a search operation.
     *
     * @param column The indexed column to search against
     * @param condition The search condition
     * @param text The raw query text, normalized by the column
     * @param effect How matching items affect the selection
     * @param weight How heavily this operation's scores weigh on ordering
     */
    void search(String column, SearchCondition condition, String text, SearchEffect effect, float weight);

    /**
     * Gets the ordered results of all operations since the last {@link #reset()}.
     * Computed lazily and memoized until the next {@code reset} or {@code search}.
     */
    List<T> getResults();
}
