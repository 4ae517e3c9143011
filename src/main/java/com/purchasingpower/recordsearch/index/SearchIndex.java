package com.purchasingpower.recordsearch.index;

import com.google.common.base.Preconditions;
import com.purchasingpower.recordsearch.exception.NoSuchColumnException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * An optimized search index.
 *
 * <p>Collects the finite set of distinct normalized {@code (column, value)} pairs and
 * bijectively associates each one with a bit position. Matching against a column can
 * then be done once per distinct value to produce a {@link BitVector} of matching
 * positions, instead of once per record. Combining criteria becomes bitwise set
 * algebra on those vectors.
 *
 * <p>All columns share one {@link BitPositionRegistry}, owned by this index. Columns
 * are declared up front and cannot be added later.
 *
 * @since 1.0.0
 */
public class SearchIndex implements ReadableSearchIndex {

    private final BitPositionRegistry registry = new BitPositionRegistry();
    private final Map<String, SearchIndexColumn> columns;

    /**
     * @param columns Column names and their descriptions, in declaration order
     */
    public SearchIndex(Map<String, ColumnDescription> columns) {
        Preconditions.checkNotNull(columns, "Columns cannot be null");

        Map<String, SearchIndexColumn> built = new LinkedHashMap<>();
        columns.forEach((name, description) ->
                built.put(name, new SearchIndexColumn(name, registry, description)));
        this.columns = Collections.unmodifiableMap(built);
    }

    @Override
    public BitVector getBitfield() {
        return registry.getField();
    }

    @Override
    public int size() {
        return registry.size();
    }

    @Override
    public Set<String> columnNames() {
        return columns.keySet();
    }

    @Override
    public SearchIndexColumn column(String name) {
        SearchIndexColumn column = columns.get(name);
        if (column == null) {
            throw new NoSuchColumnException(name);
        }
        return column;
    }
}
