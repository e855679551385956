package com.pagewright.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands out unique file names for filter output.
 *
 * <p>Names are unique per factory, so representations compiled in parallel never write
 * to the same file. Files themselves are created by the filters.
 */
public class TempFilenameFactory {

    private static final Logger log = LoggerFactory.getLogger(TempFilenameFactory.class);

    private final Path root;
    private final AtomicLong counter = new AtomicLong();

    /**
     * Creates a factory placing files below {@code root}.
     *
     * @param root directory for temporary files, created on first use
     */
    public TempFilenameFactory(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path getRoot() {
        return root;
    }

    /**
     * Returns a fresh, unused file name.
     *
     * @param prefix readable prefix, e.g. the item identifier
     * @return path below the root directory that does not exist yet
     * @throws IllegalStateException if the root directory cannot be created
     */
    public Path create(String prefix) {
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create temporary directory: " + root, e);
        }
        String sanitized = prefix.replaceAll("[^A-Za-z0-9._-]+", "_").replaceAll("^_+|_+$", "");
        if (sanitized.isEmpty()) {
            sanitized = "rep";
        }
        return root.resolve(sanitized + "-" + counter.incrementAndGet());
    }

    /**
     * Deletes the root directory and everything in it.
     *
     * @throws IllegalStateException if deletion fails
     */
    public void cleanup() {
        try {
            FileUtils.deleteRecursively(root);
            log.debug("Removed temporary directory: {}", root);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to remove temporary directory: " + root, e);
        }
    }
}
