package com.purchasingpower.recordsearch.exception;

import lombok.Getter;

/**
 * Thrown when a search query cannot be parsed.
 *
 * <p>Callers are expected to show {@link #getMessage()} to the user and keep the
 * previous results on screen.
 */
@Getter
public class QuerySyntaxException extends RuntimeException {

    private final int offset;
    private final String stage;
    private final String reason;

    /**
     * @param offset Offset into the query where parsing failed
     * @param stage Breadcrumb of parser stages, e.g. {@code search term > text}
     * @param reason Short description of the problem
     */
    public QuerySyntaxException(int offset, String stage, String reason) {
        super("Error parsing " + stage + " at offset " + offset + ": " + reason);
        this.offset = offset;
        this.stage = stage;
        this.reason = reason;
    }
}
