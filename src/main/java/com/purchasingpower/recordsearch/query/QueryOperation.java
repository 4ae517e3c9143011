package com.purchasingpower.recordsearch.query;

import com.purchasingpower.recordsearch.search.SearchCondition;
import com.purchasingpower.recordsearch.search.SearchEffect;

/**
 * One clause of a parsed search query.
 *
 * <p>Any component may be {@code null}; the caller decides the defaults.
 *
 * @param effect The effect prefix ({@code -}, {@code +}, {@code &})
 * @param field The column to search
 * @param condition The condition operator
 * @param text The unescaped query text
 */
public record QueryOperation(SearchEffect effect, String field, SearchCondition condition, String text) {

    public static QueryOperation of(String text) {
        return new QueryOperation(null, null, null, text);
    }
}
