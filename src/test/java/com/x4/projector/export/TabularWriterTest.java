package com.x4.projector.export;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.x4.projector.definition.ObjectKind;
import com.x4.projector.resolver.model.ResolvedRecord;

/**
 * Unit tests for TabularWriter.
 */
class TabularWriterTest {

    private final TabularWriter writer = new TabularWriter();

    @Test
    void testCsv() throws IOException {
        String csv = writer.render(ExportFormat.CSV, ObjectKind.WARES, wares());

        assertThat(csv).isEqualTo("""
                id,name,factoryname,group,tags,volume,price_min,price_max
                energycells,"Energy Cells, bulk",,energy,container economy,6,0,22
                water,"Water ""pure""\",,,,0,0,0
                """);
    }

    @Test
    void testCsvWithoutRecordsHasHeaderOnly() throws IOException {
        String csv = writer.render(ExportFormat.CSV, ObjectKind.WARES, List.of());

        assertThat(csv).isEqualTo("id,name,factoryname,group,tags,volume,price_min,price_max\n");
    }

    @Test
    void testMarkdown() throws IOException {
        ResolvedRecord piped = ResolvedRecord.builder()
                .id("energycells")
                .kind("ware")
                .attribute("name", "Energy | Cells")
                .build();

        String markdown = writer.render(ExportFormat.MARKDOWN, ObjectKind.WARES, List.of(piped));

        assertThat(markdown).startsWith("# wares\n");
        assertThat(markdown).contains("| id | name | factoryname | group | tags | volume | price_min | price_max |\n");
        assertThat(markdown).contains("| --- | --- | --- | --- | --- | --- | --- | --- |\n");
        assertThat(markdown).contains("| energycells | Energy \\| Cells |  |  |  | 0 | 0 | 0 |\n");
    }

    @Test
    void testStructuredFormatIsRejected() {
        assertThatThrownBy(() -> writer.render(ExportFormat.JSON, ObjectKind.WARES, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testCellEscaping() {
        assertThat(TabularWriter.csvCell("plain")).isEqualTo("plain");
        assertThat(TabularWriter.csvCell("two\nlines")).isEqualTo("\"two\nlines\"");
        assertThat(TabularWriter.markdownCell("two\nlines")).isEqualTo("two lines");
    }

    private static List<ResolvedRecord> wares() {
        return List.of(
                ResolvedRecord.builder()
                        .id("energycells")
                        .kind("ware")
                        .attribute("name", "Energy Cells, bulk")
                        .attribute("group", "energy")
                        .attribute("tags", List.of("container", "economy"))
                        .attribute("volume", 6)
                        .attribute("price_max", 22)
                        .build(),
                ResolvedRecord.builder()
                        .id("water")
                        .kind("ware")
                        .attribute("name", "Water \"pure\"")
                        .build());
    }
}
