package com.cgraph.engine;

/** Thrown when a file name or extension maps to no known notation. */
public final class UnsupportedFormatException extends RuntimeException {

    private final String extension;

    public UnsupportedFormatException(String extension) {
        super("Unsupported notation extension: '" + extension + "' (expected .graph, .par or .fk)");
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }
}
