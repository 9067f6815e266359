package com.cgraph.model;

/**
 * Thrown by notation front-ends when surface text is malformed. Parsing failures are fatal
 * for the document; callers do not retry.
 * <p>
 * Tokenizers and parsers for the three notations live outside this project; they build the
 * graph types of this module directly and report malformed input with this exception, so that
 * callers of the conversion pipeline handle one parse failure type whatever the notation.
 */
public final class NotationParseException extends RuntimeException {

    private final int line;
    private final int column;

    public NotationParseException(String message, int line, int column) {
        super(String.format("Parse error at %d:%d: %s", line, column, message));
        this.line = line;
        this.column = column;
    }

    public NotationParseException(String message, Throwable cause) {
        super(message, cause);
        this.line = -1;
        this.column = -1;
    }

    /** 1-based line of the error, or -1 when unknown. */
    public int getLine() {
        return line;
    }

    /** 1-based column of the error, or -1 when unknown. */
    public int getColumn() {
        return column;
    }
}
