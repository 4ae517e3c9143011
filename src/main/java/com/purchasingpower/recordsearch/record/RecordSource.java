package com.purchasingpower.recordsearch.record;

import com.google.common.base.Preconditions;
import lombok.Value;

/**
 * Where a record was defined.
 *
 * <p>Built-in and custom sources are singular; theme and snippet sources are
 * named after the theme or snippet that defines the record.
 */
@Value
public class RecordSource {

    public enum Type {
        BUILTIN,
        THEME,
        SNIPPET,
        CUSTOM
    }

    Type type;

    /**
     * Theme or snippet name, {@code null} for built-in and custom sources.
     */
    String name;

    public static RecordSource builtin() {
        return new RecordSource(Type.BUILTIN, null);
    }

    public static RecordSource custom() {
        return new RecordSource(Type.CUSTOM, null);
    }

    public static RecordSource theme(String theme) {
        Preconditions.checkNotNull(theme, "Theme name cannot be null");
        return new RecordSource(Type.THEME, theme);
    }

    public static RecordSource snippet(String snippet) {
        Preconditions.checkNotNull(snippet, "Snippet name cannot be null");
        return new RecordSource(Type.SNIPPET, snippet);
    }
}
