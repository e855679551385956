package com.pagewright.core.error;

import java.nio.file.Path;

/**
 * Raised when a compiled representation cannot be written to its output file.
 */
public class OutputWriteException extends CompilationException {

    public OutputWriteException(Path outputPath, Throwable cause) {
        super("Failed to write output file: " + outputPath, cause);
    }
}
