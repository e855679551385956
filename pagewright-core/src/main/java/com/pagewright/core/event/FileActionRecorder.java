package com.pagewright.core.event;

import com.pagewright.core.rep.Representation;
import com.pagewright.core.writer.FileAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Records what happened to every output file: created, updated, identical or skipped.
 *
 * <p>Written files are recorded as {@code repWritten} notifications arrive. Files of
 * representations that were never recompiled are added by {@link #recordSkipped(Collection)}
 * once compilation has finished.
 */
public class FileActionRecorder implements CompilationListener {

    private static final Logger log = LoggerFactory.getLogger(FileActionRecorder.class);

    private final Map<Path, FileAction> actions = new LinkedHashMap<>();

    @Override
    public synchronized void repWritten(Representation rep, Path path, boolean created, boolean modified) {
        FileAction action = FileAction.of(created, modified);
        actions.put(path, action);
        log.info("{} {}", String.format("%9s", action.label()), path);
    }

    /**
     * Records the output files of representations that were not compiled as skipped.
     *
     * @param reps all representations of the site
     */
    public synchronized void recordSkipped(Collection<Representation> reps) {
        for (Representation rep : reps) {
            if (rep.isCompiled()) {
                continue;
            }
            for (Path path : rep.getRawPaths().values()) {
                if (actions.putIfAbsent(path, FileAction.SKIP) == null) {
                    log.info("{} {}", String.format("%9s", FileAction.SKIP.label()), path);
                }
            }
        }
    }

    /**
     * Returns recorded actions in the order they happened.
     *
     * @return unmodifiable map from output file to action
     */
    public synchronized Map<Path, FileAction> getActions() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(actions));
    }

    public synchronized FileAction getAction(Path path) {
        return actions.get(path);
    }
}
