package com.pagewright.core.rep;

import com.pagewright.core.error.CannotGetCompiledContentOfBinaryItemException;
import com.pagewright.core.error.NoSuchSnapshotException;
import com.pagewright.core.error.UnmetDependencyException;
import com.pagewright.core.model.Item;
import com.pagewright.core.model.Layout;
import com.pagewright.core.model.SnapshotEntry;
import com.pagewright.core.model.SnapshotName;
import com.pagewright.core.model.Source;
import com.pagewright.core.writer.WriteResult;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One compiled variant of an {@link Item}, with its own output file.
 *
 * <p>A compilation rule drives a representation through {@link #filter(String, Map)},
 * {@link #layout(Layout, String, Map)} and {@link #snapshot(SnapshotName, boolean)} calls.
 * Each step replaces the {@link SnapshotName#LAST} content; snapshots keep the content
 * as it was when they were taken, and final snapshots are written to disk.
 *
 * <p>Other representations read the result through {@link #compiledContent(SnapshotName)}.
 * When that content is not available yet, the read fails with
 * {@link UnmetDependencyException}; the reader's compilation is then abandoned with
 * {@link #forgetProgress()} and retried later.
 *
 * <p>A representation is not thread-safe. Different representations may be compiled in
 * parallel.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * Representation rep = new Representation(item, "default", context);
 * rep.setRawPath(SnapshotName.LAST, Paths.get("output/about/index.html"));
 *
 * rep.filter("markdown");
 * rep.layout(defaultLayout, "erb", Map.of());
 * rep.snapshot(SnapshotName.LAST);   // writes output/about/index.html
 * }</pre>
 */
public class Representation {

    private final Item item;
    private final String name;
    private final CompilationContext context;

    private final ContentStore store;
    private final SnapshotManager snapshots;
    private final FilterExecutor executor;

    private final Map<SnapshotName, Path> rawPaths = new LinkedHashMap<>();
    private final Map<SnapshotName, String> paths = new LinkedHashMap<>();
    private Map<String, Object> assigns = Map.of();
    private boolean compiled;

    /**
     * Creates a representation in the item's native mode, holding the item's raw content.
     *
     * @param item item this representation belongs to
     * @param name name, unique among the item's representations
     * @param context collaborators of the compilation session
     */
    public Representation(Item item, String name, CompilationContext context) {
        this.item = Objects.requireNonNull(item, "item must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.store = new ContentStore(item);
        this.snapshots = new SnapshotManager(store);
        this.executor = new FilterExecutor(this, store, context);
    }

    public Item getItem() {
        return item;
    }

    public String getName() {
        return name;
    }

    public boolean isBinary() {
        return store.isBinary();
    }

    /**
     * Returns whether this representation finished a full compilation pass in this run.
     *
     * @return true once compiled
     */
    public boolean isCompiled() {
        return compiled;
    }

    public void setCompiled(boolean compiled) {
        this.compiled = compiled;
    }

    /**
     * Returns the values exposed to the next filter or layout.
     *
     * @return read-only assigns
     */
    public Map<String, Object> getAssigns() {
        return assigns;
    }

    /**
     * Replaces the assigns exposed to the next filter or layout.
     *
     * @param assigns new assigns
     */
    public void setAssigns(Map<String, Object> assigns) {
        this.assigns = assigns == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(assigns));
    }

    /**
     * Returns the textual content per snapshot. Empty while the representation is binary.
     *
     * @return read-only map; mutating it throws {@link UnsupportedOperationException}
     */
    public Map<SnapshotName, String> getContent() {
        return store.getContent();
    }

    /**
     * Returns the binary content files per snapshot. Empty while the representation is textual.
     *
     * @return read-only map
     */
    public Map<SnapshotName, Path> getTemporaryFilenames() {
        return store.getTemporaryFilenames();
    }

    /**
     * Returns the output files per snapshot without recording a dependency.
     *
     * @return read-only map
     */
    public Map<SnapshotName, Path> getRawPaths() {
        return Collections.unmodifiableMap(rawPaths);
    }

    public void setRawPath(SnapshotName snapshot, Path rawPath) {
        rawPaths.put(Objects.requireNonNull(snapshot, "snapshot must not be null"), rawPath);
    }

    public Map<SnapshotName, String> getPaths() {
        return Collections.unmodifiableMap(paths);
    }

    public void setPath(SnapshotName snapshot, String path) {
        paths.put(Objects.requireNonNull(snapshot, "snapshot must not be null"), path);
    }

    /**
     * Returns the sealed-snapshot sequence.
     *
     * @return snapshot entries in the order they were added
     */
    public List<SnapshotEntry> getSnapshots() {
        return snapshots.getEntries();
    }

    /**
     * Replaces the sealed-snapshot sequence, e.g. with the snapshots a rule declares.
     *
     * @param entries snapshot entries
     */
    public void setSnapshots(List<SnapshotEntry> entries) {
        snapshots.setEntries(entries);
    }

    /**
     * Declares a snapshot the compilation rule is going to create, so that other
     * representations may wait for it.
     *
     * @param snapshot snapshot name
     * @param isFinal whether the snapshot will be sealed
     */
    public void declareSnapshot(SnapshotName snapshot, boolean isFinal) {
        snapshots.declare(new SnapshotEntry(snapshot, isFinal));
    }

    /**
     * Runs the latest content through a filter without arguments.
     *
     * @param filterName filter identifier
     * @see #filter(String, Map)
     */
    public void filter(String filterName) {
        filter(filterName, Map.of());
    }

    /**
     * Runs the latest content through a filter, replacing the {@link SnapshotName#LAST}
     * content. Textual results are also kept in the moving {@code pre} snapshot (or
     * {@code post}, once a layout has been applied).
     *
     * @param filterName filter identifier
     * @param arguments filter arguments
     * @throws com.pagewright.core.error.UnknownFilterException if no filter has that name
     * @throws com.pagewright.core.error.CannotUseBinaryFilterException if a binary filter is used on text
     * @throws com.pagewright.core.error.CannotUseTextualFilterException if a textual filter is used on binary content
     * @throws com.pagewright.core.error.FilterOutputMissingException if a binary filter wrote no output
     */
    public void filter(String filterName, Map<String, Object> arguments) {
        executor.filter(filterName, arguments);
    }

    /**
     * Lays out the latest content. The content before the first layout is sealed as the
     * {@code pre} snapshot; the laid-out content becomes {@code post} and {@code last}.
     *
     * @param layout layout to apply
     * @param filterName filter that evaluates the layout
     * @param arguments filter arguments
     * @throws com.pagewright.core.error.CannotLayoutBinaryItemException if the representation is binary
     */
    public void layout(Layout layout, String filterName, Map<String, Object> arguments) {
        executor.layout(layout, filterName, arguments);
    }

    /**
     * Takes a final snapshot.
     *
     * @param snapshot snapshot name
     */
    public void snapshot(SnapshotName snapshot) {
        snapshot(snapshot, true);
    }

    /**
     * Copies the latest content into a snapshot. Final snapshots are written to their raw
     * path, if one is set; non-final ones never are.
     *
     * @param snapshot snapshot name
     * @param isFinal whether this is the last time the snapshot is updated
     */
    public void snapshot(SnapshotName snapshot, boolean isFinal) {
        snapshots.take(snapshot, isFinal);
        if (isFinal) {
            write(snapshot);
        }
    }

    /**
     * Returns the compiled content of the default snapshot: {@code pre} if it exists,
     * {@code last} otherwise.
     *
     * @return compiled content
     * @see #compiledContent(SnapshotName)
     */
    public String compiledContent() {
        return compiledContent(null);
    }

    /**
     * Returns the compiled content at a snapshot and records a dependency on this
     * representation's item.
     *
     * @param snapshot snapshot name, or {@code null} for the default snapshot
     * @return compiled content
     * @throws CannotGetCompiledContentOfBinaryItemException if the representation is binary
     * @throws NoSuchSnapshotException if a fixed snapshot was never declared final
     * @throws UnmetDependencyException if the content is not available yet
     */
    public String compiledContent(SnapshotName snapshot) {
        if (store.isBinary()) {
            throw new CannotGetCompiledContentOfBinaryItemException(this);
        }

        visit(item);

        SnapshotName snapshotName = snapshot != null ? snapshot : snapshots.defaultSnapshot();
        return snapshots.resolve(this, snapshotName, compiled);
    }

    /**
     * Returns whether textual content exists at a snapshot.
     *
     * @param snapshot snapshot name
     * @return true if the snapshot has content
     */
    public boolean hasSnapshot(SnapshotName snapshot) {
        return store.getContent().get(snapshot) != null;
    }

    public Optional<Path> rawPath() {
        return rawPath(SnapshotName.LAST);
    }

    /**
     * Returns the output file of a snapshot and records a dependency on this
     * representation's item, also when no path is set.
     *
     * @param snapshot snapshot name
     * @return output file, or empty if none is set
     */
    public Optional<Path> rawPath(SnapshotName snapshot) {
        visit(item);
        return Optional.ofNullable(rawPaths.get(snapshot));
    }

    public Optional<String> path() {
        return path(SnapshotName.LAST);
    }

    /**
     * Returns the public path of a snapshot and records a dependency on this
     * representation's item, also when no path is set.
     *
     * @param snapshot snapshot name
     * @return path as linked to (e.g. {@code /about/}), or empty if none is set
     */
    public Optional<String> path(SnapshotName snapshot) {
        visit(item);
        return Optional.ofNullable(paths.get(snapshot));
    }

    public Optional<WriteResult> write() {
        return write(SnapshotName.LAST);
    }

    /**
     * Writes a snapshot to its raw path.
     *
     * @param snapshot snapshot name
     * @return write outcome, or empty if no raw path is set for the snapshot
     */
    public Optional<WriteResult> write(SnapshotName snapshot) {
        return context.writer().write(this, snapshot);
    }

    /**
     * Resets the content to the item's raw content and native mode. Raw paths, paths and
     * the sealed-snapshot sequence are kept.
     */
    public void forgetProgress() {
        store.initialize();
    }

    /**
     * Returns a readable reference to this representation, e.g. {@code /about/ (default)}.
     *
     * @return reference
     */
    public String reference() {
        return item.identifier() + " (" + name + ")";
    }

    ContentStore contentStore() {
        return store;
    }

    private void visit(Source source) {
        context.listener().visitStarted(source);
        context.listener().visitEnded(source);
    }

    @Override
    public String toString() {
        return "Representation[item=" + item.identifier() + ", name=" + name
            + ", binary=" + store.isBinary() + ", rawPath=" + rawPaths.get(SnapshotName.LAST) + "]";
    }
}
