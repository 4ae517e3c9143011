package com.purchasingpower.recordsearch.search;

import com.purchasingpower.recordsearch.index.BitVector;
import com.purchasingpower.recordsearch.index.IndexColumn;
import com.purchasingpower.recordsearch.search.impl.SubsequenceFuzzyMatcher;

import java.util.Optional;

/**
 * How a query is matched against the values stored in a column.
 *
 * <p>Evaluating a condition walks every {@code (value, position)} entry of the column.
 * For each value that matches, the position's bit is set in the returned vector and
 * the value's score is <em>added</em> to {@code scores[position]}. Conditions never
 * mutate the column.
 *
 * @since 1.0.0
 */
public enum SearchCondition {

    /**
     * The query fuzzily matches the value. Scored by the {@link FuzzyMatcher}.
     */
    MATCHES,

    /**
     * The query is a substring of the value. Scored {@code query.length / value.length}.
     */
    INCLUDES,

    /**
     * Same containment test and scoring as {@link #INCLUDES}.
     * Saved queries rely on this, so it is not an exact-equality test.
     */
    EQUALS,

    /**
     * The value starts with the query. Scored {@code query.length / value.length}.
     */
    STARTS_WITH;

    private static final FuzzyMatcher DEFAULT_MATCHER = new SubsequenceFuzzyMatcher();

    /**
     * Evaluates the condition using the default fuzzy matcher.
     *
     * @see #apply(IndexColumn, String, float[], FuzzyMatcher)
     */
    public BitVector apply(IndexColumn column, String normalizedQuery, float[] scores) {
        return apply(column, normalizedQuery, scores, DEFAULT_MATCHER);
    }

    /**
     * Evaluates the condition against a column.
     *
     * @param column The column to search
     * @param normalizedQuery The query, already normalized by the column
     * @param scores Score accumulator, at least as long as the highest position in the column
     * @param matcher Matcher used by {@link #MATCHES}
     * @return A vector of the positions whose values matched
     */
    public BitVector apply(IndexColumn column, String normalizedQuery, float[] scores, FuzzyMatcher matcher) {
        switch (this) {
            case MATCHES:
                return matches(column, normalizedQuery.strip(), scores, matcher);

            case INCLUDES:
            case EQUALS:
                return includes(column, normalizedQuery, scores);

            case STARTS_WITH:
                return startsWith(column, normalizedQuery, scores);

            default:
                throw new IllegalStateException("Unknown search condition: " + this);
        }
    }

    private static BitVector matches(IndexColumn column, String query, float[] scores, FuzzyMatcher matcher) {
        BitVector.Builder mask = BitVector.builder();

        for (IndexColumn.Entry entry : column) {
            Optional<FuzzyMatcher.FuzzyMatch> match = matcher.match(query, entry.value());
            if (match.isPresent()) {
                mask.set(entry.position());
                scores[entry.position()] += match.get().score();
            }
        }

        return mask.build();
    }

    private static BitVector includes(IndexColumn column, String query, float[] scores) {
        BitVector.Builder mask = BitVector.builder();

        for (IndexColumn.Entry entry : column) {
            if (entry.value().contains(query)) {
                mask.set(entry.position());
                scores[entry.position()] += lengthRatio(query, entry.value());
            }
        }

        return mask.build();
    }

    private static BitVector startsWith(IndexColumn column, String query, float[] scores) {
        BitVector.Builder mask = BitVector.builder();

        for (IndexColumn.Entry entry : column) {
            if (entry.value().startsWith(query)) {
                mask.set(entry.position());
                scores[entry.position()] += lengthRatio(query, entry.value());
            }
        }

        return mask.build();
    }

    // Empty stored values would divide by zero; they match but add nothing.
    private static float lengthRatio(String query, String value) {
        return value.isEmpty() ? 0f : (float) query.length() / value.length();
    }
}
