package com.x4.projector.cli.model;

import java.nio.file.Path;

import com.x4.projector.archive.ArchiveOverlay;
import com.x4.projector.pipeline.FileLoader;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Options shared by every subcommand; given before the subcommand name.
 */
@Getter
public class GlobalOptions {

    @Option(names = { "--game-root", "-g" }, description = "Game installation folder (or extracted tree with --file-loader fs)")
    private Path gameRoot;

    @Option(names = { "--file-loader" }, defaultValue = "CAT",
            description = "How game files are read: cat (numbered archives) or fs (extracted tree). Default: ${DEFAULT-VALUE}")
    private FileLoader fileLoader;

    @Option(names = { "--lang", "-l" }, defaultValue = "en", description = "Language of resolved texts. Default: ${DEFAULT-VALUE}")
    private String language;

    @Option(names = { "--verbose", "-v" }, description = "Log debug output")
    private boolean verbose;

    @Option(names = { "--max-layers" }, defaultValue = "" + ArchiveOverlay.DEFAULT_MAX_LAYERS,
            description = "Highest archive number probed. Default: ${DEFAULT-VALUE}")
    private int maxLayers;
}
