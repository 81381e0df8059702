package com.x4.projector.archive;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * Read-only view of the game's logical file tree.
 *
 * All paths are logical game paths; implementations normalize them
 * (see {@link GamePaths#normalize(String)}).
 */
public interface GameFileSource extends Closeable {

    boolean exists(String path);

    /**
     * Reads a whole file.
     *
     * @throws java.nio.file.NoSuchFileException if no such file exists
     */
    byte[] read(String path) throws IOException;

    /**
     * Lists logical paths of the files directly inside a directory, sorted.
     * Returns an empty list when the directory is unknown.
     */
    List<String> list(String directory);

    /**
     * Names of the mounted extensions, sorted. Empty when the source has none.
     */
    default List<String> extensionNames() {
        return List.of();
    }
}
