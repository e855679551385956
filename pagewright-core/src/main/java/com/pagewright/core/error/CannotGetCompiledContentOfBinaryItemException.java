package com.pagewright.core.error;

import com.pagewright.core.rep.Representation;

/**
 * Raised when compiled content is requested from a representation holding binary content.
 */
public class CannotGetCompiledContentOfBinaryItemException extends CompilationException {

    public CannotGetCompiledContentOfBinaryItemException(Representation rep) {
        super("You cannot access the compiled content of the binary " + rep.reference() + " representation.");
    }
}
