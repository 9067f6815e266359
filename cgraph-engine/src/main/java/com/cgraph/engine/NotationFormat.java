package com.cgraph.engine;

import java.util.Locale;

/** The three notations, keyed by file extension. */
public enum NotationFormat {
    IR("graph"),
    PAR("par"),
    FORK_JOIN("fk");

    private final String extension;

    NotationFormat(String extension) {
        this.extension = extension;
    }

    /** Extension without the dot. */
    public String getExtension() {
        return extension;
    }

    /**
     * Format for an extension, with or without leading dot, case-insensitive.
     *
     * @throws UnsupportedFormatException for any other extension
     */
    public static NotationFormat fromExtension(String extension) {
        if (extension == null) {
            throw new UnsupportedFormatException(null);
        }
        String normalized = extension.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        for (NotationFormat f : values()) {
            if (f.extension.equals(normalized)) return f;
        }
        throw new UnsupportedFormatException(extension);
    }

    /**
     * Format for a file name or path by its last extension, e.g. {@code flows/build.fk}.
     *
     * @throws UnsupportedFormatException when the name has no or an unknown extension
     */
    public static NotationFormat fromFileName(String fileName) {
        if (fileName == null) {
            throw new UnsupportedFormatException(null);
        }
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        String base = fileName.substring(slash + 1);
        int dot = base.lastIndexOf('.');
        if (dot <= 0 || dot == base.length() - 1) {
            throw new UnsupportedFormatException(base);
        }
        return fromExtension(base.substring(dot + 1));
    }
}
