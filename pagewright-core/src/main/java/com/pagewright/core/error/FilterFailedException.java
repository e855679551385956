package com.pagewright.core.error;

/**
 * Raised when a filter fails with an I/O error.
 */
public class FilterFailedException extends CompilationException {

    public FilterFailedException(String filterName, Throwable cause) {
        super("The \"" + filterName + "\" filter failed: " + cause.getMessage(), cause);
    }
}
