package com.pagewright.core.error;

/**
 * Base class for every error raised while compiling a representation.
 *
 * <p>All compilation errors are fatal to the current compilation attempt except
 * {@link UnmetDependencyException}, which signals that the attempt should be retried
 * once another representation has made progress.
 */
public class CompilationException extends RuntimeException {

    public CompilationException(String message) {
        super(message);
    }

    public CompilationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns whether the driver may retry the compilation later.
     *
     * @return true if this error is recoverable
     */
    public boolean isRecoverable() {
        return false;
    }
}
