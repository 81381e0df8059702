package com.x4.projector.export;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for ExportFiles.
 */
class ExportFilesTest {

    @TempDir
    Path tempDir;

    @Test
    void testWritesUtf8AndCreatesParents() throws IOException {
        Path file = tempDir.resolve("a/b/ships.csv");

        ExportFiles.writeUtf8(file, "id,name\nship,Jäger\n");

        assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo("id,name\nship,Jäger\n");
        try (Stream<Path> entries = Files.list(file.getParent())) {
            assertThat(entries).containsExactly(file);
        }
    }

    @Test
    void testReplacesExistingFile() throws IOException {
        Path file = Files.writeString(tempDir.resolve("wares.csv"), "old content that is longer");

        ExportFiles.writeUtf8(file, "new");

        assertThat(Files.readString(file)).isEqualTo("new");
    }
}
