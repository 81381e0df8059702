package com.x4.projector.archive.exception;

/**
 * Thrown when an archive index table cannot be trusted: truncated lines,
 * non-numeric sizes, duplicate paths or sizes running past the payload file.
 */
public class MalformedIndexException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final String indexFile;
    private final int line;

    public MalformedIndexException(String indexFile, int line, String reason) {
        super(line > 0
                ? "Malformed archive index " + indexFile + " line " + line + ": " + reason
                : "Malformed archive index " + indexFile + ": " + reason);
        this.indexFile = indexFile;
        this.line = line;
    }

    public String getIndexFile() {
        return indexFile;
    }

    /**
     * 1-based line number, or 0 when the problem concerns the whole table.
     */
    public int getLine() {
        return line;
    }
}
