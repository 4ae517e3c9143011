/**
 * Record search facade and record catalog.
 *
 * <p>Key classes:
 * <ul>
 *   <li>{@code RecordSearchService} - Runs queries over the supplied records</li>
 *   <li>{@code RecordCatalog} - Tracks which sources define each record</li>
 *   <li>{@code RecordComparators} - Tie-break ordering for results</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.purchasingpower.recordsearch.record;
