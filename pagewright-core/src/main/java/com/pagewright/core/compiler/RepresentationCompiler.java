package com.pagewright.core.compiler;

import com.pagewright.core.error.CompilationException;
import com.pagewright.core.error.UnmetDependencyException;
import com.pagewright.core.event.CompilationListener;
import com.pagewright.core.model.SnapshotName;
import com.pagewright.core.rep.Representation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Compiles single representations and reports the result as a {@link CompilationOutcome}.
 *
 * <p>An unmet dependency does not escape as an exception: the representation's progress
 * is reset and a {@link CompilationOutcome.Status#SUSPENDED} outcome names the
 * representation it waited for. Deciding when to retry is left to the caller.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * RepresentationCompiler compiler = new RepresentationCompiler(bus);
 * CompilationOutcome outcome = compiler.compile(rep, rule);
 * if (outcome.isRetryable()) {
 *     queue.addAfter(outcome.blockedOn(), rep);
 * }
 * }</pre>
 */
public class RepresentationCompiler {

    private static final Logger log = LoggerFactory.getLogger(RepresentationCompiler.class);

    private final CompilationListener listener;

    public RepresentationCompiler(CompilationListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
    }

    /**
     * Applies a rule to a representation, then seals and writes its {@code last} snapshot.
     * Representations compiled earlier in this run are not compiled again.
     *
     * @param rep representation to compile
     * @param rule compilation rule
     * @return outcome of the attempt
     * @throws RuntimeException any unexpected failure, after {@code compilationFailed} was sent
     */
    public CompilationOutcome compile(Representation rep, CompilationRule rule) {
        if (rep.isCompiled()) {
            log.debug("Skipping {}: already compiled", rep);
            return CompilationOutcome.compiled(rep);
        }

        listener.compilationStarted(rep);
        try {
            rule.apply(rep);
            rep.snapshot(SnapshotName.LAST);
            rep.setCompiled(true);
        } catch (UnmetDependencyException e) {
            rep.forgetProgress();
            listener.compilationSuspended(rep, e);
            return CompilationOutcome.suspended(rep, e);
        } catch (CompilationException e) {
            listener.compilationFailed(rep, e);
            return CompilationOutcome.failed(rep, e);
        } catch (RuntimeException e) {
            // Not a rule error: report it so listeners see the attempt end, then let it escape.
            listener.compilationFailed(rep,
                new CompilationException("Compilation of " + rep.reference() + " crashed: " + e.getMessage(), e));
            throw e;
        }
        listener.compilationEnded(rep);
        return CompilationOutcome.compiled(rep);
    }
}
