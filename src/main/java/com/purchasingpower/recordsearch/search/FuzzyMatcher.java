package com.purchasingpower.recordsearch.search;

import java.util.Optional;

/**
 * Fuzzy matching primitive consumed by {@link SearchCondition#MATCHES}.
 *
 * <p>The engine treats implementations as opaque: an empty result means "no match",
 * a present one means "match, higher score is better".
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface FuzzyMatcher {

    /**
     * Matches a query against a candidate value. Both are already normalized.
     *
     * @param query The query text
     * @param candidate The stored value
     * @return The match, or empty if the candidate does not match
     */
    Optional<FuzzyMatch> match(String query, String candidate);

    /**
     * Result of a successful fuzzy match.
     *
     * @param score Relevance of the match, higher is better
     */
    record FuzzyMatch(float score) {}
}
