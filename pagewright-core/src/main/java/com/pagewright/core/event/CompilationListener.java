package com.pagewright.core.event;

import com.pagewright.core.error.CompilationException;
import com.pagewright.core.error.UnmetDependencyException;
import com.pagewright.core.model.Layout;
import com.pagewright.core.model.SnapshotName;
import com.pagewright.core.model.Source;
import com.pagewright.core.rep.Representation;

import java.nio.file.Path;

/**
 * Receives notifications about compilation progress.
 *
 * <p>Every method has an empty default implementation so listeners only override the
 * events they care about. Notifications are delivered synchronously on the compiling
 * thread, in the order they happen. Start/end pairs around filters and layouts are
 * always matched, also when the filter fails.
 *
 * @see CompilationEventBus
 */
public interface CompilationListener {

    /**
     * A filter starts running on a representation.
     *
     * @param rep representation being filtered
     * @param filterName filter identifier
     */
    default void filteringStarted(Representation rep, String filterName) {
    }

    /**
     * A filter stopped running on a representation, successfully or not.
     *
     * @param rep representation being filtered
     * @param filterName filter identifier
     */
    default void filteringEnded(Representation rep, String filterName) {
    }

    default void processingStarted(Layout layout) {
    }

    default void processingEnded(Layout layout) {
    }

    /**
     * The compiling representation reads from an item or layout. Dependency trackers use
     * visit pairs to record an edge from the currently compiling item to {@code source}.
     *
     * @param source visited item or layout
     */
    default void visitStarted(Source source) {
    }

    default void visitEnded(Source source) {
    }

    /**
     * A snapshot is about to be written to its output file.
     *
     * @param rep representation being written
     * @param snapshot snapshot being written
     */
    default void willWriteRep(Representation rep, SnapshotName snapshot) {
    }

    /**
     * A snapshot was flushed to its output file.
     *
     * @param rep representation that was written
     * @param path output file
     * @param created whether the file did not exist before
     * @param modified whether the file content changed
     */
    default void repWritten(Representation rep, Path path, boolean created, boolean modified) {
    }

    default void compilationStarted(Representation rep) {
    }

    default void compilationEnded(Representation rep) {
    }

    /**
     * Compilation stopped because another representation's content was not available.
     *
     * @param rep suspended representation
     * @param cause unmet dependency
     */
    default void compilationSuspended(Representation rep, UnmetDependencyException cause) {
    }

    default void compilationFailed(Representation rep, CompilationException cause) {
    }
}
