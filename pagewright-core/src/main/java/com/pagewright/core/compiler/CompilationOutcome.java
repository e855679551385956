package com.pagewright.core.compiler;

import com.pagewright.core.error.CompilationException;
import com.pagewright.core.error.UnmetDependencyException;
import com.pagewright.core.rep.Representation;

import java.util.Objects;

/**
 * Result of one attempt to compile a representation.
 *
 * @param representation representation the attempt was made for
 * @param status how the attempt ended
 * @param unmetDependency the stall, for {@link Status#SUSPENDED} outcomes
 * @param failure the error, for {@link Status#FAILED} outcomes
 */
public record CompilationOutcome(
    Representation representation,
    Status status,
    UnmetDependencyException unmetDependency,
    CompilationException failure
) {
    /**
     * How a compilation attempt ended.
     */
    public enum Status {
        /** The rule ran to completion and the representation is compiled */
        COMPILED,
        /** Another representation's content was not available yet; retry later */
        SUSPENDED,
        /** The rule failed; retrying will not help */
        FAILED
    }

    /**
     * Compact constructor with validation.
     */
    public CompilationOutcome {
        Objects.requireNonNull(representation, "representation must not be null");
        Objects.requireNonNull(status, "status must not be null");
        if (status == Status.SUSPENDED && unmetDependency == null) {
            throw new IllegalArgumentException("Suspended outcome requires the unmet dependency");
        }
        if (status == Status.FAILED && failure == null) {
            throw new IllegalArgumentException("Failed outcome requires the failure");
        }
    }

    public static CompilationOutcome compiled(Representation rep) {
        return new CompilationOutcome(rep, Status.COMPILED, null, null);
    }

    public static CompilationOutcome suspended(Representation rep, UnmetDependencyException cause) {
        return new CompilationOutcome(rep, Status.SUSPENDED, cause, null);
    }

    public static CompilationOutcome failed(Representation rep, CompilationException cause) {
        return new CompilationOutcome(rep, Status.FAILED, null, cause);
    }

    public boolean isCompiled() {
        return status == Status.COMPILED;
    }

    /**
     * Returns whether the attempt should be retried once the dependency made progress.
     *
     * @return true for suspended outcomes
     */
    public boolean isRetryable() {
        return status == Status.SUSPENDED;
    }

    /**
     * Returns the representation this attempt waited for.
     *
     * @return blocking representation, or null unless suspended
     */
    public Representation blockedOn() {
        return unmetDependency != null ? unmetDependency.getRepresentation() : null;
    }
}
