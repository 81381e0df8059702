package com.x4.projector.export;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Output file helpers for the exporters.
 */
public final class ExportFiles {

    private ExportFiles() {
        // Utility class
    }

    /**
     * Writes content as UTF-8 through a sibling temporary file that replaces the
     * target, so an interrupted run never leaves a truncated export behind.
     * Parent directories are created as needed.
     */
    public static void writeUtf8(Path file, String content) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        Files.createDirectories(parent);

        Path partial = Files.createTempFile(parent, file.getFileName().toString(), ".part");
        try {
            Files.writeString(partial, content, StandardCharsets.UTF_8);
            Files.move(partial, file, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(partial);
        }
    }
}
