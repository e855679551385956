package com.pagewright.core.model;

/**
 * Something a compiling representation can depend on: an {@link Item} or a {@link Layout}.
 *
 * <p>Dependency trackers receive sources through visit notifications.
 */
public interface Source {

    /**
     * Returns the identifier of this source (e.g., {@code /about/}).
     *
     * @return source identifier
     */
    String identifier();
}
