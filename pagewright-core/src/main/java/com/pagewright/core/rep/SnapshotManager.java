package com.pagewright.core.rep;

import com.pagewright.core.error.NoSuchSnapshotException;
import com.pagewright.core.error.UnmetDependencyException;
import com.pagewright.core.model.SnapshotEntry;
import com.pagewright.core.model.SnapshotName;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Tracks which snapshots have been sealed and decides whether snapshot content can be
 * handed out yet.
 *
 * <p>Moving snapshots ({@code pre}, {@code post}, {@code last}) keep changing until the
 * representation is compiled. Reading one too early raises {@link UnmetDependencyException},
 * except for {@code pre} once it has been sealed, which happens right before the first
 * layout is applied.
 */
public class SnapshotManager {

    private final ContentStore store;
    private final List<SnapshotEntry> entries = new ArrayList<>();

    public SnapshotManager(ContentStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    /**
     * Copies the current content into a snapshot and seals {@code pre} when final.
     * Writing final snapshots is up to the caller.
     *
     * @param name snapshot name
     * @param isFinal whether the snapshot is sealed
     */
    public void take(SnapshotName name, boolean isFinal) {
        store.copyLastTo(name);
        if (SnapshotName.PRE.equals(name) && isFinal) {
            entries.add(SnapshotEntry.sealed(SnapshotName.PRE));
        }
    }

    /**
     * Declares a snapshot ahead of compilation, as the compilation rules do for snapshots
     * they are going to create.
     *
     * @param entry snapshot entry
     */
    public void declare(SnapshotEntry entry) {
        entries.add(Objects.requireNonNull(entry, "entry must not be null"));
    }

    public List<SnapshotEntry> getEntries() {
        return List.copyOf(entries);
    }

    public void setEntries(List<SnapshotEntry> newEntries) {
        entries.clear();
        entries.addAll(newEntries);
    }

    /**
     * Returns whether a final entry exists for the snapshot.
     *
     * @param name snapshot name
     * @return true if sealed
     */
    public boolean isSealed(SnapshotName name) {
        return entries.stream().anyMatch(e -> e.name().equals(name) && e.isFinal());
    }

    /**
     * Returns the snapshot read when none is requested: {@code pre} if it has content,
     * {@code last} otherwise.
     *
     * @return default snapshot name
     */
    public SnapshotName defaultSnapshot() {
        return store.has(SnapshotName.PRE) ? SnapshotName.PRE : SnapshotName.LAST;
    }

    /**
     * Returns whether the content of a snapshot may still change before compilation ends.
     *
     * @param name snapshot name
     * @return true for {@code post} and {@code last}, and for {@code pre} until sealed
     */
    public boolean isStillMoving(SnapshotName name) {
        if (SnapshotName.POST.equals(name) || SnapshotName.LAST.equals(name)) {
            return true;
        }
        if (SnapshotName.PRE.equals(name)) {
            return !isSealed(SnapshotName.PRE);
        }
        return false;
    }

    /**
     * Returns the textual content of a snapshot if it can be read.
     *
     * @param rep representation owning this manager
     * @param name snapshot name
     * @param compiled whether the representation finished compiling
     * @return snapshot content
     * @throws NoSuchSnapshotException if a fixed snapshot was never declared final
     * @throws UnmetDependencyException if the content is missing or still moving
     */
    String resolve(Representation rep, SnapshotName name, boolean compiled) {
        if (!name.isMoving() && !isSealed(name)) {
            throw new NoSuchSnapshotException(rep, name);
        }

        String content = store.getContent().get(name);
        boolean usable = content != null && (compiled || !isStillMoving(name));
        if (!usable) {
            throw new UnmetDependencyException(rep);
        }
        return content;
    }
}
