package com.x4.projector.definition.exception;

/**
 * Thrown when a definition document is not well-formed or breaks the document
 * rules (missing identifiers, duplicate identifiers, unexpected root element).
 */
public class MalformedDefinitionException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final String sourcePath;

    public MalformedDefinitionException(String sourcePath, String reason) {
        super("Malformed definition document " + sourcePath + ": " + reason);
        this.sourcePath = sourcePath;
    }

    public MalformedDefinitionException(String sourcePath, String reason, Throwable cause) {
        super("Malformed definition document " + sourcePath + ": " + reason, cause);
        this.sourcePath = sourcePath;
    }

    public String getSourcePath() {
        return sourcePath;
    }
}
