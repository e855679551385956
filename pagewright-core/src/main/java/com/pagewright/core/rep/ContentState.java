package com.pagewright.core.rep;

import com.pagewright.core.model.ContentKind;
import com.pagewright.core.model.SnapshotName;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot content of a representation: either text per snapshot or a file per snapshot.
 *
 * <p>Only one variant is active at a time. Switching the mode replaces the state, so
 * text cached before a conversion to binary (or the other way around) is discarded.
 */
public sealed interface ContentState permits ContentState.Textual, ContentState.Binary {

    ContentKind kind();

    /**
     * Returns whether content exists for the snapshot.
     *
     * @param name snapshot name
     * @return true if the snapshot has content
     */
    boolean has(SnapshotName name);

    /**
     * Copies the content of {@link SnapshotName#LAST} to another snapshot.
     *
     * @param name target snapshot
     */
    void copyLastTo(SnapshotName name);

    /**
     * Textual content, keyed by snapshot name.
     */
    final class Textual implements ContentState {

        private final Map<SnapshotName, String> content = new LinkedHashMap<>();
        private final Map<SnapshotName, String> view = Collections.unmodifiableMap(content);

        Textual() {
        }

        @Override
        public ContentKind kind() {
            return ContentKind.TEXT;
        }

        @Override
        public boolean has(SnapshotName name) {
            return content.get(name) != null;
        }

        @Override
        public void copyLastTo(SnapshotName name) {
            put(name, content.get(SnapshotName.LAST));
        }

        public String get(SnapshotName name) {
            return content.get(name);
        }

        void put(SnapshotName name, String value) {
            content.put(Objects.requireNonNull(name, "name must not be null"), value);
        }

        /**
         * Returns a read-only view; writes through it throw {@link UnsupportedOperationException}.
         *
         * @return unmodifiable content map
         */
        public Map<SnapshotName, String> asMap() {
            return view;
        }
    }

    /**
     * Binary content, as files keyed by snapshot name.
     */
    final class Binary implements ContentState {

        private final Map<SnapshotName, Path> files = new LinkedHashMap<>();
        private final Map<SnapshotName, Path> view = Collections.unmodifiableMap(files);

        Binary() {
        }

        @Override
        public ContentKind kind() {
            return ContentKind.BINARY;
        }

        @Override
        public boolean has(SnapshotName name) {
            return files.get(name) != null;
        }

        @Override
        public void copyLastTo(SnapshotName name) {
            put(name, files.get(SnapshotName.LAST));
        }

        public Path get(SnapshotName name) {
            return files.get(name);
        }

        void put(SnapshotName name, Path file) {
            files.put(Objects.requireNonNull(name, "name must not be null"), file);
        }

        public Map<SnapshotName, Path> asMap() {
            return view;
        }
    }
}
