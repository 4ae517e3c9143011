package com.purchasingpower.recordsearch.search.impl;

import com.purchasingpower.recordsearch.search.FuzzyMatcher;

import java.util.Optional;

/**
 * Default {@link FuzzyMatcher}: the query matches when its characters appear in the
 * candidate in order, not necessarily adjacent.
 *
 * <p>Scoring rewards compact matches over long candidates. For a query of length
 * {@code q} matched inside a span of length {@code s} of a candidate of length
 * {@code c}:
 * <pre>
 *   score = (q / s + q / c) / 2
 * </pre>
 * An exact match scores {@code 1.0}; an empty query matches everything with score {@code 0}.
 *
 * @since 1.0.0
 */
public class SubsequenceFuzzyMatcher implements FuzzyMatcher {

    @Override
    public Optional<FuzzyMatch> match(String query, String candidate) {
        if (query.isEmpty()) {
            return Optional.of(new FuzzyMatch(0f));
        }

        int first = -1;
        int from = 0;
        for (int i = 0; i < query.length(); i++) {
            int found = candidate.indexOf(query.charAt(i), from);
            if (found < 0) {
                return Optional.empty();
            }

            if (first < 0) {
                first = found;
            }
            from = found + 1;
        }

        float span = from - first;
        float length = query.length();
        return Optional.of(new FuzzyMatch((length / span + length / candidate.length()) / 2f));
    }
}
