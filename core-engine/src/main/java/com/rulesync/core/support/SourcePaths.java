package com.rulesync.core.support;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * File enumeration shared by the hasher and the loaders.
 *
 * <p>
 * Hidden entries (name starting with {@code .}) are skipped at any depth, so
 * a subpath of {@code "."} never picks up the mirror's {@code .git}
 * metadata. Results are sorted by their {@code /}-separated relative path
 * using case-sensitive string order.
 * </p>
 *
 * @since 1.0.0
 */
public final class SourcePaths {

    private SourcePaths() {
        // utility class, not instantiable
    }

    /**
     * Resolve a subpath against a root, refusing paths that escape the root.
     *
     * <p>
     * A subpath that exists is returned as its real path, so a symlinked
     * subpath is walked through its target. The target must still lie under
     * the real root.
     * </p>
     *
     * @param root    mirror root
     * @param subpath relative subpath; blank means the root itself
     * @return absolute directory path, real when the directory exists
     * @throws ContentReadException if the subpath is malformed or escapes
     *                              the root
     */
    public static Path resolve(Path root, String subpath) {
        Objects.requireNonNull(root, "root must not be null");
        Path base = root.toAbsolutePath().normalize();
        if (subpath == null || subpath.isBlank()) {
            return base;
        }
        Path dir;
        try {
            dir = base.resolve(subpath.trim()).normalize();
        } catch (InvalidPathException e) {
            throw new ContentReadException("Invalid subpath " + printable(subpath) + ": " + e.getReason(), e);
        }
        if (!dir.startsWith(base)) {
            throw new ContentReadException("Subpath escapes the source root: " + subpath);
        }
        if (!Files.exists(dir)) {
            return dir;
        }
        try {
            Path real = dir.toRealPath();
            if (!real.startsWith(base.toRealPath())) {
                throw new ContentReadException("Subpath resolves outside the source root: " + subpath);
            }
            return real;
        } catch (IOException e) {
            throw new ContentReadException("Cannot resolve " + dir + ": " + e.getMessage(), e);
        }
    }

    /**
     * List regular files under {@code dir} whose file name passes the filter.
     *
     * @param dir        directory to walk
     * @param nameFilter file-name filter
     * @return sorted relative paths ({@code /}-separated); empty if
     *         {@code dir} does not exist
     * @throws ContentReadException if {@code dir} is not a directory or
     *                              cannot be walked
     */
    public static List<String> listFiles(Path dir, Predicate<String> nameFilter) {
        if (Files.notExists(dir)) {
            return List.of();
        }
        if (!Files.isDirectory(dir)) {
            throw new ContentReadException("Not a directory: " + dir);
        }
        List<String> result = new ArrayList<>();
        try {
            // Files.walk does not descend into a symlinked start directory
            Path start = dir.toRealPath();
            try (Stream<Path> walk = Files.walk(start)) {
                walk.filter(p -> !p.equals(start))
                        .filter(p -> !isHidden(start.relativize(p)))
                        .filter(Files::isRegularFile)
                        .filter(p -> nameFilter.test(p.getFileName().toString()))
                        .map(p -> toRelative(start, p))
                        .forEach(result::add);
            }
        } catch (IOException | UncheckedIOException e) {
            throw new ContentReadException("Cannot list files under " + dir + ": " + e.getMessage(), e);
        }
        Collections.sort(result);
        return result;
    }

    private static boolean isHidden(Path relative) {
        for (Path part : relative) {
            if (part.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }

    private static String toRelative(Path dir, Path file) {
        return dir.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
    }

    private static String printable(String value) {
        return "'" + value.replaceAll("\\p{Cntrl}", "?") + "'";
    }
}
