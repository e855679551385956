package com.pagewright.core.error;

import com.pagewright.core.rep.Representation;

/**
 * Raised when a layout is applied to a representation holding binary content.
 */
public class CannotLayoutBinaryItemException extends CompilationException {

    public CannotLayoutBinaryItemException(Representation rep) {
        super("The " + rep.reference() + " representation cannot be laid out because it is binary.");
    }
}
