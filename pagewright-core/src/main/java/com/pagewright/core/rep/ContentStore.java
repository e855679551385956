package com.pagewright.core.rep;

import com.pagewright.core.model.Item;
import com.pagewright.core.model.SnapshotName;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Holds the current and snapshotted content of one representation.
 *
 * <p>Textual content lives in memory; binary content is tracked as files. Text values
 * are immutable strings and the maps handed out are read-only, so cached snapshot
 * content can only change through this store.
 */
public class ContentStore {

    private final Item item;
    private ContentState state;

    /**
     * Creates a store initialised from the item's raw content.
     *
     * @param item item the representation belongs to
     */
    public ContentStore(Item item) {
        this.item = Objects.requireNonNull(item, "item must not be null");
        initialize();
    }

    /**
     * Resets the store to the item's raw content and native mode, dropping every snapshot.
     */
    public void initialize() {
        if (item.binary()) {
            ContentState.Binary binary = new ContentState.Binary();
            binary.put(SnapshotName.LAST, item.rawFilename());
            state = binary;
        } else {
            ContentState.Textual textual = new ContentState.Textual();
            textual.put(SnapshotName.LAST, item.rawContent());
            state = textual;
        }
    }

    public ContentState getState() {
        return state;
    }

    public boolean isBinary() {
        return state instanceof ContentState.Binary;
    }

    /**
     * Switches between textual and binary mode. The content of the previous mode is
     * discarded. Switching to the current mode does nothing.
     *
     * @param toBinary whether the store should become binary
     */
    public void switchMode(boolean toBinary) {
        if (toBinary == isBinary()) {
            return;
        }
        state = toBinary ? new ContentState.Binary() : new ContentState.Textual();
    }

    /**
     * Returns the most recent textual content.
     *
     * @return content of {@link SnapshotName#LAST}
     * @throws IllegalStateException if the store is binary
     */
    public String getLast() {
        return textual().get(SnapshotName.LAST);
    }

    /**
     * Replaces the most recent textual content.
     *
     * @param content new content
     * @throws IllegalStateException if the store is binary
     */
    public void setLast(String content) {
        Objects.requireNonNull(content, "content must not be null");
        textual().put(SnapshotName.LAST, content);
    }

    /**
     * Returns the file holding the most recent binary content.
     *
     * @return file of {@link SnapshotName#LAST}
     * @throws IllegalStateException if the store is textual
     */
    public Path getLastFile() {
        return binary().get(SnapshotName.LAST);
    }

    /**
     * Replaces the file holding the most recent binary content.
     *
     * @param file new file
     * @throws IllegalStateException if the store is textual
     */
    public void setLastFile(Path file) {
        Objects.requireNonNull(file, "file must not be null");
        binary().put(SnapshotName.LAST, file);
    }

    public void copyLastTo(SnapshotName name) {
        state.copyLastTo(name);
    }

    public boolean has(SnapshotName name) {
        return state.has(name);
    }

    /**
     * Returns textual content per snapshot; empty while binary.
     *
     * @return read-only map
     */
    public Map<SnapshotName, String> getContent() {
        return state instanceof ContentState.Textual textual ? textual.asMap() : Map.of();
    }

    /**
     * Returns binary files per snapshot; empty while textual.
     *
     * @return read-only map
     */
    public Map<SnapshotName, Path> getTemporaryFilenames() {
        return state instanceof ContentState.Binary binary ? binary.asMap() : Map.of();
    }

    /**
     * Sets textual content of an arbitrary snapshot without running a filter.
     *
     * @param name snapshot name
     * @param content content
     * @throws IllegalStateException if the store is binary
     */
    void putContent(SnapshotName name, String content) {
        textual().put(name, Objects.requireNonNull(content, "content must not be null"));
    }

    private ContentState.Textual textual() {
        if (state instanceof ContentState.Textual textual) {
            return textual;
        }
        throw new IllegalStateException("Content of " + item.identifier() + " is binary, not textual");
    }

    private ContentState.Binary binary() {
        if (state instanceof ContentState.Binary binary) {
            return binary;
        }
        throw new IllegalStateException("Content of " + item.identifier() + " is textual, not binary");
    }
}
