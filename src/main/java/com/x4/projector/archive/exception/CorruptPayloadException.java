package com.x4.projector.archive.exception;

/**
 * Thrown when the bytes read for an archive entry do not match the checksum
 * recorded in its index, or when the payload file ends before the entry does.
 */
public class CorruptPayloadException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final String path;
    private final String payloadFile;

    public CorruptPayloadException(String path, String payloadFile, String reason) {
        super("Corrupt payload for " + path + " in " + payloadFile + ": " + reason);
        this.path = path;
        this.payloadFile = payloadFile;
    }

    public String getPath() {
        return path;
    }

    public String getPayloadFile() {
        return payloadFile;
    }
}
