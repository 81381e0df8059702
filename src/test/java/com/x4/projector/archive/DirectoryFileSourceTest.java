package com.x4.projector.archive;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for reading an extracted game tree.
 */
class DirectoryFileSourceTest {

    @TempDir
    Path tempDir;

    @Test
    void testLookupsAreCaseInsensitive() throws IOException {
        write("Assets/Props/Engines/macros/Engine_A.xml", "engine");
        write("extensions/ego_dlc_boron/libraries/wares.xml", "wares");

        try (DirectoryFileSource files = new DirectoryFileSource(tempDir)) {
            assertThat(files.exists("assets/props/engines/macros/engine_a.xml")).isTrue();
            assertThat(new String(files.read("ASSETS\\props\\engines\\macros\\engine_a.xml"), StandardCharsets.UTF_8))
                    .isEqualTo("engine");
            assertThat(files.list("assets/props/engines/macros"))
                    .containsExactly("assets/props/engines/macros/engine_a.xml");
            assertThat(files.extensionNames()).containsExactly("ego_dlc_boron");
        }
    }

    @Test
    void testMissingFile() throws IOException {
        try (DirectoryFileSource files = new DirectoryFileSource(tempDir)) {
            assertThatThrownBy(() -> files.read("nothing.xml")).isInstanceOf(NoSuchFileException.class);
        }
    }

    @Test
    void testRootMustBeADirectory() {
        assertThatThrownBy(() -> new DirectoryFileSource(tempDir.resolve("missing")))
                .isInstanceOf(NoSuchFileException.class);
    }

    private void write(String path, String content) throws IOException {
        Path file = tempDir.resolve(path);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
