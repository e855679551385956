package com.pagewright.core.rep;

import com.pagewright.core.error.CannotLayoutBinaryItemException;
import com.pagewright.core.error.CannotUseBinaryFilterException;
import com.pagewright.core.error.CannotUseTextualFilterException;
import com.pagewright.core.error.CompilationException;
import com.pagewright.core.error.FilterFailedException;
import com.pagewright.core.error.FilterOutputMissingException;
import com.pagewright.core.error.UnknownFilterException;
import com.pagewright.core.event.CompilationListener;
import com.pagewright.core.filter.Filter;
import com.pagewright.core.filter.FilterContext;
import com.pagewright.core.filter.FilterSource;
import com.pagewright.core.model.Layout;
import com.pagewright.core.model.SnapshotName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs filters and layouts against a representation's content.
 *
 * <p>Every run is bracketed by {@code filteringStarted}/{@code filteringEnded}
 * notifications (and {@code processingStarted}/{@code processingEnded} for layouts);
 * the end notifications are sent from {@code finally} blocks.
 */
class FilterExecutor {

    private static final Logger log = LoggerFactory.getLogger(FilterExecutor.class);

    /** Assign under which a layout filter sees the layout being applied */
    static final String LAYOUT_ASSIGN = "layout";

    private final Representation rep;
    private final ContentStore store;
    private final CompilationContext context;

    FilterExecutor(Representation rep, ContentStore store, CompilationContext context) {
        this.rep = rep;
        this.store = store;
        this.context = context;
    }

    /**
     * Runs the representation's latest content through a filter.
     *
     * @param filterName filter identifier
     * @param arguments filter arguments
     */
    void filter(String filterName, Map<String, Object> arguments) {
        Filter filter = resolve(filterName);

        if (filter.getInputKind().isBinary() && !store.isBinary()) {
            throw new CannotUseBinaryFilterException(rep, filterName);
        } else if (!filter.getInputKind().isBinary() && store.isBinary()) {
            throw new CannotUseTextualFilterException(rep, filterName);
        }

        CompilationListener listener = context.listener();
        listener.filteringStarted(rep, filterName);
        try {
            FilterSource source = store.isBinary()
                ? FilterSource.ofFile(store.getLastFile())
                : FilterSource.ofText(store.getLast());
            Path outputFile = context.tempFilenames().create(rep.reference());
            FilterContext filterContext = new FilterContext(rep.getAssigns(), arguments, outputFile);

            log.debug("Running filter {} ({} -> {}) on {}",
                filterName, filter.getInputKind(), filter.getOutputKind(), rep);
            String result = run(filter, filterName, source, filterContext);

            // Validate output before switching modes; a failed filter leaves the content untouched.
            if (filter.getOutputKind().isBinary()) {
                if (!Files.isRegularFile(outputFile)) {
                    throw new FilterOutputMissingException(filterName, outputFile);
                }
                store.switchMode(true);
                store.setLastFile(outputFile);
            } else {
                String text = requireText(filterName, result);
                store.switchMode(false);
                store.setLast(text);
                rep.snapshot(store.has(SnapshotName.POST) ? SnapshotName.POST : SnapshotName.PRE, false);
            }
        } finally {
            listener.filteringEnded(rep, filterName);
        }
    }

    /**
     * Lays out the representation's content.
     *
     * @param layout layout to apply
     * @param filterName filter that evaluates the layout
     * @param arguments filter arguments
     */
    void layout(Layout layout, String filterName, Map<String, Object> arguments) {
        if (store.isBinary()) {
            throw new CannotLayoutBinaryItemException(rep);
        }

        if (!store.has(SnapshotName.POST)) {
            rep.snapshot(SnapshotName.PRE, true);
        }

        Filter filter = resolve(filterName);
        if (filter.getInputKind().isBinary()) {
            throw new CannotUseBinaryFilterException(rep, filterName);
        }
        Map<String, Object> assigns = new LinkedHashMap<>(rep.getAssigns());
        assigns.put(LAYOUT_ASSIGN, layout);

        CompilationListener listener = context.listener();
        listener.visitStarted(layout);
        listener.visitEnded(layout);

        listener.processingStarted(layout);
        try {
            listener.filteringStarted(rep, filterName);
            try {
                Path outputFile = context.tempFilenames().create(rep.reference());
                FilterContext filterContext = new FilterContext(assigns, arguments, outputFile);

                log.debug("Laying out {} with {} using filter {}", rep, layout.identifier(), filterName);
                String result = run(filter, filterName, FilterSource.ofText(layout.rawContent()), filterContext);

                store.setLast(requireText(filterName, result));
                rep.snapshot(SnapshotName.POST, false);
            } finally {
                listener.filteringEnded(rep, filterName);
            }
        } finally {
            listener.processingEnded(layout);
        }
    }

    private Filter resolve(String filterName) {
        return context.filters().resolve(filterName)
            .orElseThrow(() -> new UnknownFilterException(filterName));
    }

    private static String run(Filter filter, String filterName, FilterSource source, FilterContext filterContext) {
        try {
            return filter.run(source, filterContext);
        } catch (IOException e) {
            throw new FilterFailedException(filterName, e);
        }
    }

    private static String requireText(String filterName, String result) {
        if (result == null) {
            throw new CompilationException("The \"" + filterName + "\" filter did not return any content.");
        }
        return result;
    }
}
