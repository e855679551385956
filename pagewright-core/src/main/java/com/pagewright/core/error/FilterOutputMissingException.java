package com.pagewright.core.error;

import java.nio.file.Path;

/**
 * Raised when a filter with binary output did not write its output file.
 */
public class FilterOutputMissingException extends CompilationException {

    private final String filterName;

    public FilterOutputMissingException(String filterName, Path outputFile) {
        super("The \"" + filterName + "\" filter did not write anything to the required output file, "
            + outputFile + ".");
        this.filterName = filterName;
    }

    public String getFilterName() {
        return filterName;
    }
}
