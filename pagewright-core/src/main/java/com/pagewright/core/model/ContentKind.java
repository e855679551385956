package com.pagewright.core.model;

/**
 * Kind of content a representation holds or a filter consumes and produces.
 */
public enum ContentKind {
    /** In-memory text */
    TEXT,
    /** Content held in a file on disk */
    BINARY;

    /**
     * Maps a binary flag to its kind.
     *
     * @param binary whether the content is binary
     * @return {@link #BINARY} or {@link #TEXT}
     */
    public static ContentKind of(boolean binary) {
        return binary ? BINARY : TEXT;
    }

    public boolean isBinary() {
        return this == BINARY;
    }
}
