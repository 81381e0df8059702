package com.x4.projector.archive;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Game files that were already extracted to a directory tree, keeping the
 * game's folder hierarchy.
 *
 * The tree is scanned once so lookups are case-insensitive like archive lookups.
 */
public class DirectoryFileSource implements GameFileSource {
    private static final Logger log = LoggerFactory.getLogger(DirectoryFileSource.class);

    private final Path root;
    private final Map<String, Path> files = new HashMap<>();
    private final Map<String, TreeSet<String>> directories = new HashMap<>();

    public DirectoryFileSource(Path root) throws IOException {
        this.root = Objects.requireNonNull(root, "root");
        if (!Files.isDirectory(root)) {
            throw new NoSuchFileException(root.toString(), null, "not a directory");
        }

        try (Stream<Path> walk = Files.walk(root)) {
            walk.filter(Files::isRegularFile).forEach(file -> {
                String logical = GamePaths.normalize(root.relativize(file).toString());
                files.put(logical, file);
                directories.computeIfAbsent(GamePaths.parent(logical), k -> new TreeSet<>()).add(logical);
            });
        }
        log.info("Indexed {} extracted file(s) under {}", files.size(), root);
    }

    @Override
    public boolean exists(String path) {
        return files.containsKey(GamePaths.normalize(path));
    }

    @Override
    public byte[] read(String path) throws IOException {
        Path file = files.get(GamePaths.normalize(path));
        if (file == null) {
            throw new NoSuchFileException(path, null, "not found under " + root);
        }
        return Files.readAllBytes(file);
    }

    @Override
    public List<String> list(String directory) {
        TreeSet<String> entries = directories.get(GamePaths.normalize(directory));
        return (entries == null) ? List.of() : List.copyOf(entries);
    }

    @Override
    public List<String> extensionNames() {
        return directories.keySet().stream()
                .filter(dir -> dir.startsWith(MountedFileSource.EXTENSIONS_DIR + "/"))
                .map(dir -> dir.substring(MountedFileSource.EXTENSIONS_DIR.length() + 1))
                .map(rest -> rest.contains("/") ? rest.substring(0, rest.indexOf('/')) : rest)
                .distinct()
                .sorted()
                .toList();
    }

    @Override
    public void close() {
        // nothing held open
    }
}
