package com.pagewright.core.filter;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Context provided to filters during execution.
 *
 * @param assigns values exposed by the compilation driver (item, layout, etc.)
 * @param arguments filter-specific arguments supplied by the compilation rule
 * @param outputFile file a binary-output filter must write to
 */
public record FilterContext(
    Map<String, Object> assigns,
    Map<String, Object> arguments,
    Path outputFile
) {
    /**
     * Compact constructor with validation.
     */
    public FilterContext {
        Objects.requireNonNull(outputFile, "outputFile must not be null");
        assigns = assigns == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(assigns));
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    /**
     * Gets an assign value.
     *
     * @param key assign name
     * @param <T> expected type
     * @return assign value or null
     */
    @SuppressWarnings("unchecked")
    public <T> T getAssign(String key) {
        return (T) assigns.get(key);
    }

    /**
     * Gets an argument with a default.
     *
     * @param key argument name
     * @param defaultValue default value
     * @param <T> expected type
     * @return argument value or default
     */
    @SuppressWarnings("unchecked")
    public <T> T getArgumentOrDefault(String key, T defaultValue) {
        T value = (T) arguments.get(key);
        return value != null ? value : defaultValue;
    }
}
