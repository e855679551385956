package com.pagewright.core.filter;

import com.pagewright.core.model.ContentKind;

import java.io.IOException;

/**
 * Interface for filters that transform a representation's content.
 *
 * <p>A filter declares the kind of content it consumes and the kind it produces. Textual
 * filters receive text and return text. Filters producing binary output must write
 * their result to {@link FilterContext#outputFile()}; their return value is ignored.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class UpcaseFilter implements Filter {
 *     @Override
 *     public String getId() {
 *         return "upcase";
 *     }
 *
 *     @Override
 *     public String run(FilterSource source, FilterContext context) {
 *         return source.text().toUpperCase(Locale.ROOT);
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.pagewright.core.filter.Filter}
 *
 * @see FilterRegistry
 * @see FilterContext
 */
public interface Filter {

    /**
     * Returns unique identifier for this filter.
     *
     * <p>Used by compilation rules to reference the filter (e.g., "erb", "markdown").
     *
     * @return unique filter identifier
     */
    String getId();

    /**
     * Returns the kind of content this filter consumes.
     *
     * @return input kind, {@link ContentKind#TEXT} by default
     */
    default ContentKind getInputKind() {
        return ContentKind.TEXT;
    }

    /**
     * Returns the kind of content this filter produces.
     *
     * @return output kind, {@link ContentKind#TEXT} by default
     */
    default ContentKind getOutputKind() {
        return ContentKind.TEXT;
    }

    /**
     * Runs the filter.
     *
     * @param source content to filter, textual or a file depending on {@link #getInputKind()}
     * @param context assigns, arguments and the output file for binary results
     * @return filtered text, or {@code null} when the output is binary
     * @throws IOException if reading or writing files fails
     */
    String run(FilterSource source, FilterContext context) throws IOException;
}
