package com.purchasingpower.recordsearch.record;

import com.purchasingpower.recordsearch.exception.QuerySyntaxException;
import com.purchasingpower.recordsearch.query.QueryOperation;

import java.util.List;

/**
 * Searches the records provided by a {@link RecordSupplier} with the query language.
 *
 * <p>Searchable columns: {@code id}, {@code icon}, {@code source} and {@code snippet}.
 * An empty query returns every record.
 *
 * <p>Operations narrow or widen a selection of indexed values, not of records. A record
 * is returned when any of its values remains selected, so operations on different
 * columns do not intersect: {@code source:obsidian warn} selects nothing, since no value
 * is both a source alias and an id matching "warn". Likewise {@code -warning} only
 * deselects the id value, and the record is still returned through its icon and source
 * values. With inclusive defaults off the selection starts empty, and {@code +} unions
 * values across columns, e.g. {@code +source:custom +icon:star}.
 */
public interface RecordSearchService {

    /**
     * Runs a query.
     *
     * @param query The query string, e.g. {@code icon:star} or {@code source=user}
     * @return Matching records, best match first
     * @throws QuerySyntaxException if the query is malformed or names an unknown column
     */
    List<SearchableRecord> search(String query);

    /**
     * Parses a query without running it.
     *
     * @throws QuerySyntaxException if the query is malformed
     */
    List<QueryOperation> parse(String query);

    /**
     * Rebuilds the search from the supplier's current records.
     */
    void refresh();
}
