package com.x4.projector.archive;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.x4.projector.archive.exception.NoLayersFoundException;

/**
 * The base game overlay with each extension's own overlay mounted under
 * {@code extensions/<name>/}.
 *
 * Extensions use the same layering rule as the base game ({@code ext_01.cat},
 * {@code ext_02.cat}, ...) and never shadow base game paths.
 */
public class MountedFileSource implements GameFileSource {
    private static final Logger log = LoggerFactory.getLogger(MountedFileSource.class);

    public static final String EXTENSIONS_DIR = "extensions";
    static final String EXTENSION_ARCHIVE_PREFIX = "ext_";

    private final GameFileSource base;
    private final Map<String, GameFileSource> mounts;

    public MountedFileSource(GameFileSource base, Map<String, GameFileSource> mounts) {
        this.base = Objects.requireNonNull(base, "base");
        this.mounts = Collections.unmodifiableMap(new TreeMap<>(mounts));
    }

    /**
     * Discovers the base archives in {@code gameRoot} and every extension folder
     * under {@code gameRoot/extensions} that has at least its first archive pair.
     */
    public static MountedFileSource openArchives(Path gameRoot, int maxLayers) throws IOException {
        ArchiveOverlay base = ArchiveOverlay.discover(gameRoot, maxLayers);
        Map<String, GameFileSource> mounts = new TreeMap<>();

        Path extensionsDir = gameRoot.resolve(EXTENSIONS_DIR);
        if (Files.isDirectory(extensionsDir)) {
            List<Path> extensionDirs;
            try (Stream<Path> stream = Files.list(extensionsDir)) {
                extensionDirs = stream.filter(Files::isDirectory).sorted().toList();
            }

            for (Path extensionDir : extensionDirs) {
                String name = GamePaths.normalize(extensionDir.getFileName().toString());
                try {
                    mounts.put(name, ArchiveOverlay.discover(extensionDir, EXTENSION_ARCHIVE_PREFIX, maxLayers));
                    log.info("Mounted extension {}", name);
                } catch (NoLayersFoundException e) {
                    log.warn("Extension folder {} has no archives, skipping it", extensionDir);
                }
            }
        }

        return new MountedFileSource(base, mounts);
    }

    @Override
    public boolean exists(String path) {
        Route route = route(path);
        return route.source.exists(route.path);
    }

    @Override
    public byte[] read(String path) throws IOException {
        Route route = route(path);
        return route.source.read(route.path);
    }

    @Override
    public List<String> list(String directory) {
        String normalized = GamePaths.normalize(directory);
        Route route = route(normalized);
        if (route.source == base) {
            return base.list(normalized);
        }

        String prefix = normalized.substring(0, normalized.length() - route.path.length());
        List<String> listed = new ArrayList<>();
        for (String file : route.source.list(route.path)) {
            listed.add(GamePaths.join(prefix, file));
        }
        return listed;
    }

    @Override
    public List<String> extensionNames() {
        return List.copyOf(mounts.keySet());
    }

    @Override
    public void close() throws IOException {
        IOException failure = null;
        List<GameFileSource> all = new ArrayList<>(mounts.values());
        all.add(base);
        for (GameFileSource source : all) {
            try {
                source.close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private Route route(String path) {
        String normalized = GamePaths.normalize(path);
        String mountRoot = EXTENSIONS_DIR + "/";
        if (normalized.startsWith(mountRoot)) {
            String rest = normalized.substring(mountRoot.length());
            int slash = rest.indexOf('/');
            String name = (slash < 0) ? rest : rest.substring(0, slash);
            GameFileSource mount = mounts.get(name);
            if (mount != null) {
                return new Route(mount, (slash < 0) ? "" : rest.substring(slash + 1));
            }
        }
        return new Route(base, normalized);
    }

    private record Route(GameFileSource source, String path) {
    }
}
