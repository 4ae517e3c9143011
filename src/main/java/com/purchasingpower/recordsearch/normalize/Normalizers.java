package com.purchasingpower.recordsearch.normalize;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;

import java.text.Normalizer.Form;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Built-in {@link Normalizer normalizers} and the combinator that chains them.
 *
 * <p>The standard pipeline used for record search is:
 * <pre>
 * casefold -> NFC -> trim -> collapse runs of [space, -, _, .] into "-"
 * </pre>
 *
 * @since 1.0.0
 */
public final class Normalizers {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}");
    private static final Pattern SEPARATOR_RUNS = Pattern.compile("[ \\-_.]+");

    /**
     * Leaves the text unchanged.
     */
    public static final Normalizer IDENTITY = text -> text;

    /**
     * Locale-invariant lower-casing.
     */
    public static final Normalizer CASEFOLD = text -> text.toLowerCase(Locale.ROOT);

    /**
     * Unicode Normalization Form C (canonical composition).
     */
    public static final Normalizer UNICODE = text -> java.text.Normalizer.normalize(text, Form.NFC);

    /**
     * Strips leading and trailing Unicode whitespace, including no-break spaces.
     */
    public static final Normalizer TRIMMED = text -> CharMatcher.whitespace().trimFrom(text);

    /**
     * Strips accents and other combining marks (canonical decomposition, then drop {@code \p{M}}).
     */
    public static final Normalizer UNACCENTED = text ->
            COMBINING_MARKS.matcher(java.text.Normalizer.normalize(text, Form.NFD)).replaceAll("");

    /**
     * Collapses each run of spaces, hyphens, underscores and dots into a single hyphen.
     */
    public static final Normalizer HYPHENATE_SEPARATORS = text -> SEPARATOR_RUNS.matcher(text).replaceAll("-");

    private static final Normalizer STANDARD = combine(List.of(CASEFOLD, UNICODE, TRIMMED, HYPHENATE_SEPARATORS));

    private Normalizers() {
    }

    /**
     * Combines multiple normalizers into one that applies them left to right.
     *
     * @param normalizers The normalizers to combine
     * @return The combined normalizer
     */
    public static Normalizer combine(List<Normalizer> normalizers) {
        Preconditions.checkNotNull(normalizers, "Normalizers cannot be null");
        List<Normalizer> chain = List.copyOf(normalizers);

        return text -> {
            String result = text;
            for (Normalizer normalizer : chain) {
                result = normalizer.normalize(result);
            }
            return result;
        };
    }

    /**
     * The normalization used by record search columns.
     */
    public static Normalizer standard() {
        return STANDARD;
    }
}
