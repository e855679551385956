package com.pagewright.core.writer;

import com.pagewright.core.model.SnapshotName;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Outcome of writing one snapshot to its output file.
 *
 * @param path output file
 * @param snapshot snapshot that was written
 * @param created whether the file did not exist before
 * @param modified whether the file content changed (always true when created)
 */
public record WriteResult(
    Path path,
    SnapshotName snapshot,
    boolean created,
    boolean modified
) {
    /**
     * Compact constructor with validation.
     */
    public WriteResult {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(snapshot, "snapshot must not be null");
    }

    public FileAction action() {
        return FileAction.of(created, modified);
    }
}
