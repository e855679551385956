package com.pagewright.core.filter;

import java.util.Optional;

/**
 * Resolves filter names to filters.
 */
public interface FilterRegistry {

    /**
     * Looks up a filter by identifier.
     *
     * @param name filter identifier
     * @return the filter, or empty if no filter has that identifier
     */
    Optional<Filter> resolve(String name);
}
