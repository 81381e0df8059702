package com.x4.projector.cli.output;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.x4.projector.cli.model.GlobalOptions;
import com.x4.projector.cli.model.ValidatedExportOptions;
import com.x4.projector.pipeline.ExportResult;

/**
 * Responsible only for printing CLI output for the "export" command.
 */
public class ExportResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ExportResultsPrinter.class);

    public void printBanner(GlobalOptions o, ValidatedExportOptions v) {
        log.info("=================================================");
        log.info("X4 Projector");
        log.info("=================================================");
        log.info("Game Folder: {}", v.getGameRoot());
        log.info("File Loader: {}", o.getFileLoader());
        log.info("Language: {}", o.getLanguage());
        log.info("Categories: {}", v.getKinds());
        if (!v.getUnknownKinds().isEmpty()) {
            log.info("Unknown Categories: {}", v.getUnknownKinds());
        }
        log.info("Format: {}", v.getFormat().getCliName());
        log.info("Threads: {}", v.getThreads());
        log.info("Output Directory: {}", v.getOutputDir());
        log.info("=================================================");
    }

    public void printSuccess(ExportResult result) {
        log.info("");
        log.info("=================================================");
        log.info("EXPORT SUCCESSFUL");
        log.info("=================================================");
        log.info("Output Path: {}", result.getOutputDir());
        log.info("Definitions Loaded: {}", result.getDefinitionsLoaded());
        log.info("Records Exported: {}", result.getRecordsExported());
        result.getRecordCounts().forEach((kind, count) -> log.info("  {}: {}", kind.getCliName(), count));
        for (Path file : result.getFilesWritten()) {
            log.info("Wrote: {}", file);
        }

        if (result.getDiagnosticsFile() != null) {
            log.info("");
            log.info("Diagnostics Summary:");
            log.info("  Errors: {}", result.getErrorCount());
            log.info("  Warnings: {}", result.getWarningCount());
            if (result.getDocumentsSkipped() > 0) {
                log.info("  Documents Skipped: {}", result.getDocumentsSkipped());
            }
            if (result.getUnresolvedTexts() > 0) {
                log.info("  Unresolved Texts: {}", result.getUnresolvedTexts());
            }
            log.info("  Details: {}", result.getDiagnosticsFile());
        }
        log.info("=================================================");
    }

    public void printFailure(ExportResult result) {
        log.error("Export failed: {}", result.getErrorMessage());
    }
}
