package com.x4.projector.pipeline;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import com.x4.projector.definition.ObjectKind;

import lombok.Builder;
import lombok.Data;

/**
 * Result of an export run.
 */
@Data
@Builder
public class ExportResult {
    private boolean success;
    private String errorMessage;
    private Path outputDir;

    private int definitionsLoaded;
    private int documentsSkipped;
    private Map<ObjectKind, Integer> recordCounts;
    private List<Path> filesWritten;

    private int warningCount;
    private int errorCount;
    private Path diagnosticsFile;
    private int unresolvedTexts;

    public int getRecordsExported() {
        return (recordCounts == null) ? 0 : recordCounts.values().stream().mapToInt(Integer::intValue).sum();
    }

    public static ExportResult failure(String errorMessage) {
        return ExportResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
