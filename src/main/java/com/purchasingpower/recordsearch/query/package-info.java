/**
 * Query language parser.
 *
 * <p>Turns strings such as {@code -source:builtin +id^=warn "two words"} into
 * {@code QueryOperation}s. See {@code QueryParser} for the grammar.
 *
 * @since 1.0.0
 */
package com.purchasingpower.recordsearch.query;
