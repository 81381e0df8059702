package com.x4.projector.archive.exception;

import java.nio.file.Path;

/**
 * Thrown when a game root holds no first archive pair (index + payload at rank 1).
 */
public class NoLayersFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final Path root;

    public NoLayersFoundException(Path root, String expectedIndex, String expectedPayload) {
        super("No archive layers found in " + root + ": expected " + expectedIndex + " and " + expectedPayload);
        this.root = root;
    }

    public Path getRoot() {
        return root;
    }
}
