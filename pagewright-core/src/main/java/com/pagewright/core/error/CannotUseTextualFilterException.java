package com.pagewright.core.error;

import com.pagewright.core.rep.Representation;

/**
 * Raised when a filter that expects textual input is applied to binary content.
 */
public class CannotUseTextualFilterException extends CompilationException {

    public CannotUseTextualFilterException(Representation rep, String filterName) {
        super("The \"" + filterName + "\" filter cannot be used to filter the "
            + rep.reference() + " representation, because textual filters cannot be used on binary content.");
    }
}
