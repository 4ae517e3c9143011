package com.purchasingpower.recordsearch.search;

import com.purchasingpower.recordsearch.search.impl.SubsequenceFuzzyMatcher;
import lombok.Builder;
import lombok.Value;

import java.util.Comparator;

/**
 * Behaviour options for a {@link Search}.
 *
 * @param <T> The item type
 * @since 1.0.0
 */
@Value
@Builder
public class SearchOptions<T> {

    /**
     * If {@code true}, resetting selects every item, so the search behaves like a filter.
     */
    @Builder.Default
    boolean resetToAll = false;

    /**
     * If {@code false}, scores do not influence the order of results.
     */
    @Builder.Default
    boolean resultRanking = true;

    /**
     * Orders results with equal score. Without one, equally scored results keep index order.
     */
    Comparator<? super T> compareItem;

    /**
     * Matcher used by {@link SearchCondition#MATCHES}.
     */
    @Builder.Default
    FuzzyMatcher fuzzyMatcher = new SubsequenceFuzzyMatcher();

    public static <T> SearchOptions<T> defaults() {
        return SearchOptions.<T>builder().build();
    }
}
