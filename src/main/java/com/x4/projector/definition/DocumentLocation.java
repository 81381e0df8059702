package com.x4.projector.definition;

import java.util.List;
import java.util.Locale;

import com.x4.projector.archive.GameFileSource;
import com.x4.projector.archive.GamePaths;

/**
 * Where definition documents of one export category live: either one fixed file
 * or every file of a directory whose name starts with one of the prefixes
 * (no prefixes means every file).
 */
public record DocumentLocation(String directory, List<String> fileNamePrefixes, String fileName) {

    public static DocumentLocation directory(String directory, String... fileNamePrefixes) {
        return new DocumentLocation(GamePaths.normalize(directory), List.of(fileNamePrefixes), null);
    }

    public static DocumentLocation file(String path) {
        String normalized = GamePaths.normalize(path);
        return new DocumentLocation(GamePaths.parent(normalized), List.of(), GamePaths.fileName(normalized));
    }

    /**
     * Logical paths of the matching documents below {@code rootPrefix} ("" for the
     * base game, {@code extensions/<name>} for an extension).
     */
    public List<String> find(GameFileSource files, String rootPrefix) {
        String dir = GamePaths.join(rootPrefix, directory);
        if (fileName != null) {
            String path = GamePaths.join(dir, fileName);
            return files.exists(path) ? List.of(path) : List.of();
        }
        return files.list(dir).stream()
                .filter(path -> path.endsWith(".xml"))
                .filter(path -> matchesPrefix(GamePaths.fileName(path)))
                .toList();
    }

    private boolean matchesPrefix(String name) {
        if (fileNamePrefixes.isEmpty()) {
            return true;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        return fileNamePrefixes.stream().anyMatch(prefix -> lower.startsWith(prefix.toLowerCase(Locale.ROOT)));
    }
}
