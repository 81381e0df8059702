package com.x4.projector.cli.model;

import java.nio.file.Path;
import java.util.List;

import com.x4.projector.definition.ObjectKind;
import com.x4.projector.export.ExportFormat;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ValidatedExportOptions {
    private Path gameRoot;
    private Path outputDir;
    private ExportFormat format;
    private List<ObjectKind> kinds;
    private List<String> unknownKinds;
    private int threads;
}
