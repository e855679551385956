package com.pagewright.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * A layout that wraps compiled item content. Layouts are always textual.
 *
 * @param identifier layout identifier (e.g., {@code /default/})
 * @param rawContent layout template source
 * @param attributes layout attributes
 */
public record Layout(
    String identifier,
    String rawContent,
    Map<String, Object> attributes
) implements Source {
    /**
     * Compact constructor with validation.
     */
    public Layout {
        Objects.requireNonNull(identifier, "identifier must not be null");
        Objects.requireNonNull(rawContent, "rawContent must not be null");
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    /**
     * Creates a layout without attributes.
     *
     * @param identifier layout identifier
     * @param rawContent layout template source
     * @return layout
     */
    public static Layout of(String identifier, String rawContent) {
        return new Layout(identifier, rawContent, Map.of());
    }
}
