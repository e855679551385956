package com.pagewright.core.error;

/**
 * Raised when a filter name does not resolve to a registered filter.
 */
public class UnknownFilterException extends CompilationException {

    private final String filterName;

    public UnknownFilterException(String filterName) {
        super("The requested filter, \"" + filterName + "\", does not exist.");
        this.filterName = filterName;
    }

    public String getFilterName() {
        return filterName;
    }
}
