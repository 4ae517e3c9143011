package com.purchasingpower.recordsearch.normalize;

/**
 * A function that normalizes a property value through some arbitrary but consistent means.
 *
 * <p>Implementations must be pure, total and deterministic. The same normalizer is
 * applied to stored values when indexing and to query text before lookup, so a
 * normalized value is never compared against a raw one.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface Normalizer {

    String normalize(String text);

    /**
     * Returns a normalizer that applies this one, then {@code after}.
     */
    default Normalizer andThen(Normalizer after) {
        return text -> after.normalize(normalize(text));
    }
}
