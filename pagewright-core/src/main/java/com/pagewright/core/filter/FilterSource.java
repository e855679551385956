package com.pagewright.core.filter;

import com.pagewright.core.model.ContentKind;

import java.nio.file.Path;

/**
 * Input handed to a {@link Filter}: either text or the path of a binary file.
 *
 * @param text textual content, {@code null} for binary sources
 * @param file path to binary content, {@code null} for textual sources
 */
public record FilterSource(
    String text,
    Path file
) {
    /**
     * Compact constructor with validation.
     */
    public FilterSource {
        if ((text == null) == (file == null)) {
            throw new IllegalArgumentException("Exactly one of text or file must be set");
        }
    }

    public static FilterSource ofText(String text) {
        return new FilterSource(text, null);
    }

    public static FilterSource ofFile(Path file) {
        return new FilterSource(null, file);
    }

    public ContentKind kind() {
        return ContentKind.of(file != null);
    }

    /**
     * Returns the textual content.
     *
     * @return text
     * @throws IllegalStateException if this source is binary
     */
    @Override
    public String text() {
        if (text == null) {
            throw new IllegalStateException("Binary source has no text; read " + file + " instead");
        }
        return text;
    }

    /**
     * Returns the binary file.
     *
     * @return path to the content
     * @throws IllegalStateException if this source is textual
     */
    @Override
    public Path file() {
        if (file == null) {
            throw new IllegalStateException("Textual source has no file");
        }
        return file;
    }
}
