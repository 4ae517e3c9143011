/**
 * Search sessions: conditions, effects, scoring and ranking.
 *
 * <p>A session folds a sequence of {@code (column, condition, text, effect)} operations
 * into a selection vector, accumulating per-position scores along the way:
 * <ul>
 *   <li>Conditions - matches, includes, equals, startsWith</li>
 *   <li>Effects - add (union), remove (difference), filter (intersection)</li>
 * </ul>
 *
 * <p>Key classes:
 * <ul>
 *   <li>{@code SearchFactory} - Declares columns and builds a session</li>
 *   <li>{@code Search} - The mutable session</li>
 *   <li>{@code SealedSearch} - Session view without item insertion</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.purchasingpower.recordsearch.search;
