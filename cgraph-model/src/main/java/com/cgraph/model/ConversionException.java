package com.cgraph.model;

/**
 * Thrown when a graph cannot be represented in the target notation, e.g. an IR task with
 * dependencies or a terminal marker converted to Par. Conversion stops at the first such node
 * rather than dropping the data.
 */
public final class ConversionException extends RuntimeException {

    public ConversionException(String message) {
        super(message);
    }
}
