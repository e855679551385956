package com.pagewright.core.model;

import java.util.Objects;

/**
 * Name of a representation snapshot.
 *
 * <p>{@link #PRE}, {@link #POST} and {@link #LAST} are <em>moving</em> snapshots: the
 * compiler keeps overwriting them while a representation is compiled. Every other name
 * is <em>fixed</em> and only becomes readable once it has been sealed.
 *
 * @param value snapshot name without a leading colon
 */
public record SnapshotName(String value) {

    /** Content right before the first layout is applied */
    public static final SnapshotName PRE = new SnapshotName("pre");

    /** Content right after the most recent layout */
    public static final SnapshotName POST = new SnapshotName("post");

    /** Most recently produced content */
    public static final SnapshotName LAST = new SnapshotName("last");

    /**
     * Compact constructor with validation.
     */
    public SnapshotName {
        Objects.requireNonNull(value, "value must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Snapshot name must not be blank");
        }
    }

    /**
     * Parses a snapshot name, accepting both {@code pre} and {@code :pre} spellings.
     *
     * @param name snapshot name
     * @return snapshot name
     */
    public static SnapshotName of(String name) {
        Objects.requireNonNull(name, "name must not be null");
        String trimmed = name.startsWith(":") ? name.substring(1) : name;
        return new SnapshotName(trimmed);
    }

    /**
     * Returns true for {@code pre}, {@code post} and {@code last}.
     *
     * @return true if this snapshot keeps moving until compilation completes
     */
    public boolean isMoving() {
        return equals(PRE) || equals(POST) || equals(LAST);
    }

    @Override
    public String toString() {
        return ":" + value;
    }
}
