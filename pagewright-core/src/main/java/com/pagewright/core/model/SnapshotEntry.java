package com.pagewright.core.model;

import java.util.Objects;

/**
 * Entry in a representation's sealed-snapshot sequence.
 *
 * @param name snapshot name
 * @param isFinal whether the snapshot has been permanently sealed
 */
public record SnapshotEntry(
    SnapshotName name,
    boolean isFinal
) {
    /**
     * Compact constructor with validation.
     */
    public SnapshotEntry {
        Objects.requireNonNull(name, "name must not be null");
    }

    /**
     * Creates a final entry.
     *
     * @param name snapshot name
     * @return sealed entry
     */
    public static SnapshotEntry sealed(SnapshotName name) {
        return new SnapshotEntry(name, true);
    }
}
