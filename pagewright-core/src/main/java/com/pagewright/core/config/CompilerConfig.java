package com.pagewright.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.charset.Charset;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Configuration of the compilation core.
 *
 * <p>Loaded from {@code pagewright.yaml}. Every section and value is optional; missing
 * values fall back to {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * temp:
 *   directory: "./tmp/pagewright"
 *   cleanup: true
 *
 * writer:
 *   reportIdentical: true
 *   encoding: "UTF-8"
 * }</pre>
 *
 * @param temp temporary file settings for binary filter output
 * @param writer output writer settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CompilerConfig(
    @JsonProperty("temp") TempConfig temp,
    @JsonProperty("writer") WriterConfig writer
) {
    /** Default directory for binary filter output */
    public static final String DEFAULT_TEMP_DIRECTORY = "./tmp/pagewright";

    /** Default charset for textual output */
    public static final String DEFAULT_ENCODING = "UTF-8";

    /**
     * Compact constructor filling in missing sections.
     */
    public CompilerConfig {
        if (temp == null) {
            temp = new TempConfig(null, null);
        }
        if (writer == null) {
            writer = new WriterConfig(null, null);
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static CompilerConfig defaults() {
        return new CompilerConfig(
            new TempConfig(DEFAULT_TEMP_DIRECTORY, true),
            new WriterConfig(true, DEFAULT_ENCODING)
        );
    }

    /**
     * Temporary file settings.
     *
     * @param directory directory binary filters write their output to
     * @param cleanup whether the directory is deleted when compilation finishes
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TempConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("cleanup") Boolean cleanup
    ) {
        public Path directoryPath() {
            return Paths.get(directory != null ? directory : DEFAULT_TEMP_DIRECTORY);
        }

        public boolean isCleanup() {
            return cleanup == null || cleanup;
        }
    }

    /**
     * Output writer settings.
     *
     * @param reportIdentical whether a write that left the file untouched is still reported
     * @param encoding charset used to encode textual content
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record WriterConfig(
        @JsonProperty("reportIdentical") Boolean reportIdentical,
        @JsonProperty("encoding") String encoding
    ) {
        public boolean isReportIdentical() {
            return reportIdentical == null || reportIdentical;
        }

        /**
         * Resolves the configured charset.
         *
         * @return charset, UTF-8 when unset
         * @throws IllegalArgumentException if the charset is unknown
         */
        public Charset charset() {
            return Charset.forName(encoding != null ? encoding : DEFAULT_ENCODING);
        }
    }
}
