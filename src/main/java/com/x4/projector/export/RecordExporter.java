package com.x4.projector.export;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.x4.projector.definition.ObjectKind;
import com.x4.projector.resolver.model.Diagnostic;
import com.x4.projector.resolver.model.ResolvedRecord;

/**
 * Writes resolved records, one file per category: {@code <dir>/<category>.<ext>}.
 */
public class RecordExporter {
    private static final Logger log = LoggerFactory.getLogger(RecordExporter.class);

    public static final String DIAGNOSTICS_FILE = "diagnostics.txt";

    private final TabularWriter tabular = new TabularWriter();
    private final StructuredWriter structured = new StructuredWriter();

    /**
     * @return the files written, in category order
     */
    public List<Path> write(Map<ObjectKind, List<ResolvedRecord>> records, Path destination, ExportFormat format)
            throws IOException {
        List<Path> written = new ArrayList<>();
        for (ObjectKind kind : ObjectKind.values()) {
            List<ResolvedRecord> kindRecords = records.get(kind);
            if (kindRecords == null) {
                continue;
            }
            Path file = destination.resolve(kind.getCliName() + "." + format.getFileExtension());
            ExportFiles.writeUtf8(file, render(format, kind, kindRecords));
            log.info("Wrote {} {} to {}", kindRecords.size(), kind.getCliName(), file);
            written.add(file);
        }
        return written;
    }

    /**
     * Writes {@value #DIAGNOSTICS_FILE} when there is anything to report.
     */
    public Optional<Path> writeDiagnostics(List<Diagnostic> diagnostics, Path destination) throws IOException {
        if (diagnostics.isEmpty()) {
            return Optional.empty();
        }
        Path file = destination.resolve(DIAGNOSTICS_FILE);
        String content = diagnostics.stream()
                .map(Diagnostic::format)
                .collect(Collectors.joining(StructuredWriter.LINE_END, "", StructuredWriter.LINE_END));
        ExportFiles.writeUtf8(file, content);
        log.info("Wrote {} diagnostic(s) to {}", diagnostics.size(), file);
        return Optional.of(file);
    }

    String render(ExportFormat format, ObjectKind kind, List<ResolvedRecord> records) throws IOException {
        return format.isTabular()
                ? tabular.render(format, kind, records)
                : structured.render(format, records);
    }
}
