package com.purchasingpower.recordsearch.index;

import com.purchasingpower.recordsearch.normalize.Normalizer;
import com.purchasingpower.recordsearch.normalize.Normalizers;

/**
 * Options for creating a {@link SearchIndexColumn}.
 *
 * @param normalizer How values are normalized before being stored or looked up
 */
public record ColumnDescription(Normalizer normalizer) {

    public ColumnDescription {
        if (normalizer == null) {
            normalizer = Normalizers.IDENTITY;
        }
    }

    public static ColumnDescription defaults() {
        return new ColumnDescription(Normalizers.IDENTITY);
    }

    public static ColumnDescription normalizedBy(Normalizer normalizer) {
        return new ColumnDescription(normalizer);
    }
}
