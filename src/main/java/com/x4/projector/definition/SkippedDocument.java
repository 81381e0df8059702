package com.x4.projector.definition;

/**
 * A definition document left out of the session because it could not be read
 * or parsed.
 */
public record SkippedDocument(String path, Reason reason, String message) {

    public enum Reason {
        CORRUPT_PAYLOAD,
        MALFORMED_DEFINITION
    }
}
