package com.purchasingpower.recordsearch.exception;

import lombok.Getter;

/**
 * Thrown when a column is looked up that was not declared when the index was built.
 * This is a programming error in the caller, not a "not found" result.
 */
@Getter
public class NoSuchColumnException extends RuntimeException {

    private final String column;

    public NoSuchColumnException(String column) {
        super("No such column in index: " + column);
        this.column = column;
    }
}
