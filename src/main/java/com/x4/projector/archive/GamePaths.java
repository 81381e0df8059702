package com.x4.projector.archive;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Utility for logical game paths.
 *
 * Logical paths are lower case, use forward slashes, and have no leading,
 * trailing or doubled slashes.
 */
public final class GamePaths {

    private GamePaths() {
        // Utility class
    }

    /**
     * Normalizes a logical path so lookups tolerate inconsistent casing and
     * separators across layers.
     */
    public static String normalize(String path) {
        if (path == null) {
            return "";
        }
        return Arrays.stream(path.replace('\\', '/').split("/"))
                .map(String::trim)
                .filter(part -> !part.isEmpty())
                .map(part -> part.toLowerCase(Locale.ROOT))
                .collect(Collectors.joining("/"));
    }

    /**
     * Returns the parent directory of a normalized path, or "" for top level files.
     */
    public static String parent(String normalizedPath) {
        int slash = normalizedPath.lastIndexOf('/');
        return (slash < 0) ? "" : normalizedPath.substring(0, slash);
    }

    /**
     * Returns the last component of a normalized path.
     */
    public static String fileName(String normalizedPath) {
        int slash = normalizedPath.lastIndexOf('/');
        return (slash < 0) ? normalizedPath : normalizedPath.substring(slash + 1);
    }

    /**
     * Joins path parts and normalizes the result.
     */
    public static String join(String... parts) {
        return normalize(String.join("/", parts));
    }
}
