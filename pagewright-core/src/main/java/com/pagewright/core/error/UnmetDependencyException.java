package com.pagewright.core.error;

import com.pagewright.core.rep.Representation;

/**
 * Raised when content is requested from a representation that has not produced it yet.
 *
 * <p>This is the only recoverable compilation error. A driver catching it should call
 * {@link Representation#forgetProgress()} on the stalled representation and retry it
 * after {@link #getRepresentation()} has been compiled further.
 */
public class UnmetDependencyException extends CompilationException {

    private final transient Representation representation;

    public UnmetDependencyException(Representation representation) {
        super("The " + representation.reference() + " representation has not been compiled yet.");
        this.representation = representation;
    }

    /**
     * Returns the representation whose content is not available yet.
     *
     * @return blocking representation
     */
    public Representation getRepresentation() {
        return representation;
    }

    @Override
    public boolean isRecoverable() {
        return true;
    }
}
