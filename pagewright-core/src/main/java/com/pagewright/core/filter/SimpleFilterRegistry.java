package com.pagewright.core.filter;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Registry backed by an explicit list of filters.
 */
public class SimpleFilterRegistry implements FilterRegistry {

    private final Map<String, Filter> filters;

    /**
     * Creates a registry from the given filters.
     *
     * @param filters filters to register
     * @throws IllegalArgumentException if two filters share an identifier
     */
    public SimpleFilterRegistry(Collection<? extends Filter> filters) {
        Map<String, Filter> byId = new LinkedHashMap<>();
        for (Filter filter : filters) {
            Objects.requireNonNull(filter.getId(), "filter id must not be null");
            Filter previous = byId.putIfAbsent(filter.getId(), filter);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate filter id: " + filter.getId());
            }
        }
        this.filters = Map.copyOf(byId);
    }

    public static SimpleFilterRegistry of(Filter... filters) {
        return new SimpleFilterRegistry(List.of(filters));
    }

    @Override
    public Optional<Filter> resolve(String name) {
        return Optional.ofNullable(filters.get(name));
    }
}
