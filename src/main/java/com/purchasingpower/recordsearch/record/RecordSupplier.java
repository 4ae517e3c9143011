package com.purchasingpower.recordsearch.record;

import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Supplies the records that {@link RecordSearchService} searches.
 *
 * @since 1.0.0
 */
public interface RecordSupplier {

    /**
     * The current records, in their natural order.
     */
    List<SearchableRecord> get();

    /**
     * Returns a check that reports {@code true} once the supplied records differ from
     * what {@link #get()} returned when the check was created.
     *
     * <p>The default implementation never changes.
     */
    default BooleanSupplier hasChanged() {
        return () -> false;
    }
}
