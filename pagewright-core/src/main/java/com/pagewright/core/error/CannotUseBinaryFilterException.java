package com.pagewright.core.error;

import com.pagewright.core.rep.Representation;

/**
 * Raised when a filter that expects binary input is applied to textual content.
 */
public class CannotUseBinaryFilterException extends CompilationException {

    public CannotUseBinaryFilterException(Representation rep, String filterName) {
        super("The \"" + filterName + "\" filter cannot be used to filter the "
            + rep.reference() + " representation, because binary filters cannot be used on textual content.");
    }
}
