package com.pagewright.core.event;

import com.pagewright.core.error.CompilationException;
import com.pagewright.core.error.UnmetDependencyException;
import com.pagewright.core.model.Layout;
import com.pagewright.core.model.SnapshotName;
import com.pagewright.core.model.Source;
import com.pagewright.core.rep.Representation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Logs compilation events for debugging.
 *
 * <p>Per-step events go to DEBUG, suspensions to INFO and failures to WARN.
 */
public class LoggingCompilationListener implements CompilationListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingCompilationListener.class);

    @Override
    public void compilationStarted(Representation rep) {
        log.debug("Started compilation of {}", rep);
    }

    @Override
    public void compilationEnded(Representation rep) {
        log.debug("Ended compilation of {}", rep);
    }

    @Override
    public void compilationSuspended(Representation rep, UnmetDependencyException cause) {
        log.info("Suspended compilation of {}: {}", rep, cause.getMessage());
    }

    @Override
    public void compilationFailed(Representation rep, CompilationException cause) {
        log.warn("Compilation of {} failed: {}", rep, cause.getMessage());
    }

    @Override
    public void filteringStarted(Representation rep, String filterName) {
        log.debug("Started filtering {} with {}", rep, filterName);
    }

    @Override
    public void filteringEnded(Representation rep, String filterName) {
        log.debug("Ended filtering {} with {}", rep, filterName);
    }

    @Override
    public void processingStarted(Layout layout) {
        log.debug("Started processing layout {}", layout.identifier());
    }

    @Override
    public void processingEnded(Layout layout) {
        log.debug("Ended processing layout {}", layout.identifier());
    }

    @Override
    public void visitStarted(Source source) {
        log.debug("Started visiting {}", source.identifier());
    }

    @Override
    public void visitEnded(Source source) {
        log.debug("Ended visiting {}", source.identifier());
    }

    @Override
    public void willWriteRep(Representation rep, SnapshotName snapshot) {
        log.debug("Writing snapshot {} of {}", snapshot, rep);
    }

    @Override
    public void repWritten(Representation rep, Path path, boolean created, boolean modified) {
        log.debug("Wrote {} to {} (created={}, modified={})", rep, path, created, modified);
    }
}
