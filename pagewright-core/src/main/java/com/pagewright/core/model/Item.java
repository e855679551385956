package com.pagewright.core.model;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * A content item as loaded from the site's sources.
 *
 * <p>Textual items carry their content in memory; binary items only carry the path to
 * the file holding their data. Items are never mutated during compilation.
 *
 * @param identifier item identifier (e.g., {@code /blog/first-post/})
 * @param rawContent raw textual content, {@code null} for binary items
 * @param rawFilename path to the raw binary data, {@code null} for textual items
 * @param binary whether the item is binary
 * @param attributes item attributes (title, tags, etc.)
 */
public record Item(
    String identifier,
    String rawContent,
    Path rawFilename,
    boolean binary,
    Map<String, Object> attributes
) implements Source {
    /**
     * Compact constructor with validation.
     */
    public Item {
        Objects.requireNonNull(identifier, "identifier must not be null");
        if (binary) {
            Objects.requireNonNull(rawFilename, "rawFilename must not be null for binary items");
        } else {
            Objects.requireNonNull(rawContent, "rawContent must not be null for textual items");
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    /**
     * Creates a textual item without attributes.
     *
     * @param identifier item identifier
     * @param rawContent raw content
     * @return textual item
     */
    public static Item textual(String identifier, String rawContent) {
        return new Item(identifier, rawContent, null, false, Map.of());
    }

    /**
     * Creates a binary item without attributes.
     *
     * @param identifier item identifier
     * @param rawFilename path to the binary data
     * @return binary item
     */
    public static Item binary(String identifier, Path rawFilename) {
        return new Item(identifier, null, rawFilename, true, Map.of());
    }

    /**
     * Returns the kind of content this item starts out with.
     *
     * @return content kind
     */
    public ContentKind kind() {
        return ContentKind.of(binary);
    }
}
