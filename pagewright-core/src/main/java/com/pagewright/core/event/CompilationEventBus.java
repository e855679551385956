package com.pagewright.core.event;

import com.pagewright.core.error.CompilationException;
import com.pagewright.core.error.UnmetDependencyException;
import com.pagewright.core.model.Layout;
import com.pagewright.core.model.SnapshotName;
import com.pagewright.core.model.Source;
import com.pagewright.core.rep.Representation;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Listener that forwards every notification to the registered listeners, in
 * registration order.
 *
 * <p>A bus is created per compilation session and passed to the components that
 * publish events; there is no process-wide instance. Listeners may be added or removed
 * while events are being published from other threads.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * CompilationEventBus bus = new CompilationEventBus();
 * bus.addListener(new LoggingCompilationListener());
 * FileActionRecorder recorder = bus.addListener(new FileActionRecorder());
 *
 * CompilationContext context = new CompilationContext(registry, bus, writer, tempFiles);
 * }</pre>
 */
public class CompilationEventBus implements CompilationListener {

    private final List<CompilationListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * Registers a listener.
     *
     * @param listener listener to add
     * @param <L> listener type
     * @return the listener, for chaining
     */
    public <L extends CompilationListener> L addListener(L listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        listeners.add(listener);
        return listener;
    }

    /**
     * Unregisters a listener.
     *
     * @param listener listener to remove
     * @return true if the listener was registered
     */
    public boolean removeListener(CompilationListener listener) {
        return listeners.remove(listener);
    }

    public List<CompilationListener> getListeners() {
        return List.copyOf(listeners);
    }

    private void publish(Consumer<CompilationListener> event) {
        for (CompilationListener listener : listeners) {
            event.accept(listener);
        }
    }

    @Override
    public void filteringStarted(Representation rep, String filterName) {
        publish(l -> l.filteringStarted(rep, filterName));
    }

    @Override
    public void filteringEnded(Representation rep, String filterName) {
        publish(l -> l.filteringEnded(rep, filterName));
    }

    @Override
    public void processingStarted(Layout layout) {
        publish(l -> l.processingStarted(layout));
    }

    @Override
    public void processingEnded(Layout layout) {
        publish(l -> l.processingEnded(layout));
    }

    @Override
    public void visitStarted(Source source) {
        publish(l -> l.visitStarted(source));
    }

    @Override
    public void visitEnded(Source source) {
        publish(l -> l.visitEnded(source));
    }

    @Override
    public void willWriteRep(Representation rep, SnapshotName snapshot) {
        publish(l -> l.willWriteRep(rep, snapshot));
    }

    @Override
    public void repWritten(Representation rep, Path path, boolean created, boolean modified) {
        publish(l -> l.repWritten(rep, path, created, modified));
    }

    @Override
    public void compilationStarted(Representation rep) {
        publish(l -> l.compilationStarted(rep));
    }

    @Override
    public void compilationEnded(Representation rep) {
        publish(l -> l.compilationEnded(rep));
    }

    @Override
    public void compilationSuspended(Representation rep, UnmetDependencyException cause) {
        publish(l -> l.compilationSuspended(rep, cause));
    }

    @Override
    public void compilationFailed(Representation rep, CompilationException cause) {
        publish(l -> l.compilationFailed(rep, cause));
    }
}
