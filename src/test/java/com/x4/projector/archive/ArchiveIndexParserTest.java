package com.x4.projector.archive;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.x4.projector.archive.exception.MalformedIndexException;

/**
 * Unit tests for ArchiveIndexParser.
 */
class ArchiveIndexParserTest {

    @TempDir
    Path tempDir;

    private final ArchiveIndexParser parser = new ArchiveIndexParser();

    @Test
    void testOffsetsFollowTableOrder() {
        ArchiveIndex index = parser.parse(List.of(
                "libraries/wares.xml 120 1600000000 0123456789abcdef0123456789abcdef",
                "index/macros.xml 30 1600000001 fedcba9876543210fedcba9876543210",
                "t/0001-l044.xml 7 1600000002 00000000000000000000000000000000"), "01.cat", 1, 157);

        assertThat(index.size()).isEqualTo(3);
        assertThat(index.getPayloadLength()).isEqualTo(157);

        IndexEntry macros = index.find("index/macros.xml").orElseThrow();
        assertThat(macros.getOffset()).isEqualTo(120);
        assertThat(macros.getSize()).isEqualTo(30);
        assertThat(macros.getTimestamp()).isEqualTo(1600000001L);
        assertThat(macros.getLayerRank()).isEqualTo(1);
        assertThat(index.find("t/0001-l044.xml").orElseThrow().getOffset()).isEqualTo(150);
    }

    @Test
    void testPathWithSpacesAndMixedCase() {
        ArchiveIndex index = parser.parse(List.of(
                "Assets\\Props\\My  Engine.xml 10 1600000000 ABCDEF0123456789ABCDEF0123456789"), "01.cat", 1, 10);

        IndexEntry entry = index.find("assets/props/my  engine.xml").orElseThrow();
        assertThat(entry.getPath()).isEqualTo("assets/props/my  engine.xml");
        assertThat(entry.getChecksum()).contains("abcdef0123456789abcdef0123456789");
    }

    @Test
    void testEntryWithoutChecksum() {
        ArchiveIndex index = parser.parse(List.of("a/x.xml 4 1600000000"), "01.cat", 1, 4);

        assertThat(index.find("a/x.xml").orElseThrow().getChecksum()).isEmpty();
    }

    @Test
    void testBlankLinesAreIgnored() {
        ArchiveIndex index = parser.parse(List.of("", "a/x.xml 4 1600000000", "   "), "01.cat", 1, 4);

        assertThat(index.size()).isEqualTo(1);
    }

    @Test
    void testTooFewFieldsFailsWithLine() {
        assertThatThrownBy(() -> parser.parse(List.of("a/x.xml 4 1600000000", "broken 12"), "01.cat", 1, -1))
                .isInstanceOf(MalformedIndexException.class)
                .satisfies(e -> {
                    MalformedIndexException malformed = (MalformedIndexException) e;
                    assertThat(malformed.getIndexFile()).isEqualTo("01.cat");
                    assertThat(malformed.getLine()).isEqualTo(2);
                });
    }

    @Test
    void testNonNumericSizeFails() {
        assertThatThrownBy(() -> parser.parse(List.of("a/x.xml big 1600000000"), "01.cat", 1, -1))
                .isInstanceOf(MalformedIndexException.class)
                .hasMessageContaining("invalid size");
    }

    @Test
    void testDuplicatePathFails() {
        assertThatThrownBy(() -> parser.parse(List.of("a/x.xml 1 1", "A/X.xml 1 1"), "01.cat", 1, -1))
                .isInstanceOf(MalformedIndexException.class)
                .hasMessageContaining("duplicate path a/x.xml");
    }

    @Test
    void testEntriesBeyondPayloadFail() {
        assertThatThrownBy(() -> parser.parse(List.of("a/x.xml 10 1"), "01.cat", 1, 9))
                .isInstanceOf(MalformedIndexException.class)
                .hasMessageContaining("10 payload bytes");
    }

    @Test
    void testInvalidUtf8FailsWithLine() throws IOException {
        Path indexFile = tempDir.resolve("01.cat");
        Files.write(indexFile, new byte[] {
                'a', '.', 'x', 'm', 'l', ' ', '1', ' ', '0', '\n',
                'b', (byte) 0xE9, '.', 'x', 'm', 'l', ' ', '1', ' ', '0', '\n'});

        assertThatThrownBy(() -> parser.parse(indexFile, 1, 2))
                .isInstanceOf(MalformedIndexException.class)
                .hasMessageContaining("not valid UTF-8")
                .satisfies(e -> {
                    MalformedIndexException malformed = (MalformedIndexException) e;
                    assertThat(malformed.getIndexFile()).isEqualTo(indexFile.toString());
                    assertThat(malformed.getLine()).isEqualTo(2);
                });
    }

    @Test
    void testWindowsLineEndsAreAccepted() throws IOException {
        Path indexFile = tempDir.resolve("01.cat");
        Files.writeString(indexFile, "a/x.xml 1 0\r\nb/y.xml 2 0\r\n");

        ArchiveIndex index = parser.parse(indexFile, 1, 3);

        assertThat(index.find("b/y.xml").orElseThrow().getOffset()).isEqualTo(1);
    }
}
