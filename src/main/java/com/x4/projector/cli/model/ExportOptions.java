package com.x4.projector.cli.model;

import java.nio.file.Path;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Options of the "export" command, bound by picocli and validated separately.
 */
@Getter
public class ExportOptions {

    public static final String ALL_OBJECTS = "all";

    @Parameters(arity = "0..*", paramLabel = "OBJECT",
            description = "Categories to export: engines, shields, ships, weapons, missilelaunchers, wares or all (default)")
    private List<String> objects;

    @Option(names = { "--dir", "-d" }, defaultValue = ".", description = "Output directory. Default: ${DEFAULT-VALUE}")
    private Path outputDir;

    @Option(names = { "--format", "-f" }, defaultValue = "csv",
            description = "Output format: csv, markdown, json or yaml. Default: ${DEFAULT-VALUE}")
    private String format;

    @Option(names = { "--threads" }, description = "Worker threads for resolution (default: one per category, at most the processor count)")
    private Integer threads;

    @Option(names = { "--skip-broken-files" }, description = "Report unreadable definition files instead of failing")
    private boolean skipBrokenFiles;
}
