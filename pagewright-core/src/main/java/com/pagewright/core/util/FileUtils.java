package com.pagewright.core.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Checks whether a file holds exactly the given bytes.
     *
     * @param path file to compare
     * @param bytes expected content
     * @return true if the file exists and its content equals {@code bytes}
     * @throws IOException if reading fails
     */
    public static boolean hasSameContent(Path path, byte[] bytes) throws IOException {
        if (!Files.isRegularFile(path) || Files.size(path) != bytes.length) {
            return false;
        }
        return Arrays.equals(Files.readAllBytes(path), bytes);
    }

    /**
     * Checks whether two files hold the same bytes.
     *
     * @param path file to compare
     * @param other other file
     * @return true if both files exist and are byte-identical
     * @throws IOException if reading fails
     */
    public static boolean hasSameContent(Path path, Path other) throws IOException {
        if (!Files.isRegularFile(path) || !Files.isRegularFile(other)) {
            return false;
        }
        return Files.mismatch(path, other) == -1L;
    }

    /**
     * Creates the parent directories of a file if they don't exist.
     *
     * @param path file whose parents should exist
     * @throws IOException if a directory cannot be created
     */
    public static void createParentDirectories(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    /**
     * Deletes a file or a directory tree. Missing paths are ignored.
     *
     * @param path file or directory to delete
     * @throws IOException if deletion fails
     */
    public static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(path)) {
            paths = walk.sorted(Comparator.reverseOrder()).toList();
        }
        for (Path p : paths) {
            Files.deleteIfExists(p);
        }
    }
}
