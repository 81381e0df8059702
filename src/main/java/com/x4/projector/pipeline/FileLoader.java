package com.x4.projector.pipeline;

import java.io.IOException;
import java.nio.file.Path;

import com.x4.projector.archive.DirectoryFileSource;
import com.x4.projector.archive.GameFileSource;
import com.x4.projector.archive.MountedFileSource;

/**
 * How the game files are read: from the numbered archives, or from a tree the
 * archives were already extracted to.
 */
public enum FileLoader {
    CAT {
        @Override
        public GameFileSource open(Path gameRoot, int maxLayers) throws IOException {
            return MountedFileSource.openArchives(gameRoot, maxLayers);
        }
    },
    FS {
        @Override
        public GameFileSource open(Path gameRoot, int maxLayers) throws IOException {
            return new DirectoryFileSource(gameRoot);
        }
    };

    public abstract GameFileSource open(Path gameRoot, int maxLayers) throws IOException;
}
