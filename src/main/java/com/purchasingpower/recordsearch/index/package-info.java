/**
 * Search index: bit positions, bit vectors and indexed columns.
 *
 * <p>Every distinct normalized {@code (column, value)} pair owns one bit position.
 * An item is represented by the vector of positions of its values, and a condition
 * is evaluated once per distinct value rather than once per item.
 *
 * <p>Key classes:
 * <ul>
 *   <li>{@code BitVector} - Immutable unbounded bit set with set algebra</li>
 *   <li>{@code BitPositionRegistry} - Claims and recycles positions</li>
 *   <li>{@code SearchIndexColumn} - Value to position mapping for one column</li>
 *   <li>{@code SearchIndex} - Fixed set of columns sharing one registry</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.purchasingpower.recordsearch.index;
