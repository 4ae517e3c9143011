package com.purchasingpower.recordsearch.record;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A record exposed to the search engine.
 *
 * <p>Instances are immutable; the engine returns the same instances it was given.
 */
@Value
@Builder(toBuilder = true)
public class SearchableRecord {

    /**
     * Unique identifier, e.g. {@code warning}.
     */
    String id;

    /**
     * Icon name, e.g. {@code lucide-alert-triangle}.
     */
    String icon;

    /**
     * Display color as written by its source, e.g. {@code 255, 145, 0}. May be {@code null}.
     */
    String color;

    /**
     * Every source that defines this record.
     */
    @Singular
    List<RecordSource> sources;
}
