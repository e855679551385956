package com.pagewright.core.rep;

import com.pagewright.core.config.CompilerConfig;
import com.pagewright.core.event.CompilationListener;
import com.pagewright.core.filter.FilterRegistry;
import com.pagewright.core.util.TempFilenameFactory;
import com.pagewright.core.writer.RepresentationWriter;

import java.util.Objects;

/**
 * Collaborators shared by the representations of one compilation session.
 *
 * @param filters resolves filter names used by {@code filter} and {@code layout}
 * @param listener receives compilation notifications
 * @param writer writes final snapshots to disk
 * @param tempFilenames hands out output files for binary filters
 */
public record CompilationContext(
    FilterRegistry filters,
    CompilationListener listener,
    RepresentationWriter writer,
    TempFilenameFactory tempFilenames
) {
    /**
     * Compact constructor with validation.
     */
    public CompilationContext {
        Objects.requireNonNull(filters, "filters must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
        Objects.requireNonNull(writer, "writer must not be null");
        Objects.requireNonNull(tempFilenames, "tempFilenames must not be null");
    }

    /**
     * Wires a context from configuration.
     *
     * @param config compiler configuration
     * @param filters filter registry
     * @param listener event listener, usually a {@link com.pagewright.core.event.CompilationEventBus}
     * @return compilation context
     */
    public static CompilationContext fromConfig(CompilerConfig config, FilterRegistry filters,
                                                CompilationListener listener) {
        return new CompilationContext(
            filters,
            listener,
            RepresentationWriter.fromConfig(config, listener),
            new TempFilenameFactory(config.temp().directoryPath())
        );
    }
}
