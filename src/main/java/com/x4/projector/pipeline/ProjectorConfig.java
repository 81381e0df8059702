package com.x4.projector.pipeline;

import java.nio.file.Path;
import java.util.List;

import com.x4.projector.archive.ArchiveOverlay;
import com.x4.projector.definition.ObjectKind;
import com.x4.projector.export.ExportFormat;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Configuration for one export run.
 */
@Data
@Builder(toBuilder = true)
public class ProjectorConfig {
    private Path gameRoot;
    @Builder.Default
    private FileLoader fileLoader = FileLoader.CAT;
    @Builder.Default
    private String language = "en";
    @Builder.Default
    private int maxLayers = ArchiveOverlay.DEFAULT_MAX_LAYERS;

    private Path outputDir;
    @Builder.Default
    private ExportFormat format = ExportFormat.CSV;
    @Singular
    private List<ObjectKind> kinds;
    // requested category names that match no category
    @Singular
    private List<String> unknownKinds;
    @Builder.Default
    private int threads = 1;
    private boolean skipBrokenFiles;
}
