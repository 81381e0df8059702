package com.x4.projector.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.x4.projector.cli.exception.OptionsValidationException;
import com.x4.projector.cli.model.ExportOptions;
import com.x4.projector.cli.model.GlobalOptions;
import com.x4.projector.cli.model.ValidatedExportOptions;
import com.x4.projector.cli.output.ExportResultsPrinter;
import com.x4.projector.cli.validation.ProjectorOptionsValidator;
import com.x4.projector.pipeline.ExportPipeline;
import com.x4.projector.pipeline.ExportResult;
import com.x4.projector.pipeline.ProjectorConfig;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.ParentCommand;

/**
 * CLI command that exports resolved game objects to files.
 */
@Command(
        name = "export",
        mixinStandardHelpOptions = true,
        description = "Resolves the requested object categories and writes one file per category."
)
public class ExportCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExportCommand.class);

    @ParentCommand
    private ProjectorCommand parent;

    @Mixin
    private ExportOptions options;

    private final ProjectorOptionsValidator validator = new ProjectorOptionsValidator();
    private final ExportResultsPrinter printer = new ExportResultsPrinter();

    @Override
    public Integer call() {
        parent.applyLogging();
        GlobalOptions global = parent.getGlobalOptions();
        try {
            ValidatedExportOptions validated = validator.validate(global, options);

            ProjectorConfig config = ProjectorConfig.builder()
                    .gameRoot(validated.getGameRoot())
                    .fileLoader(global.getFileLoader())
                    .language(global.getLanguage())
                    .maxLayers(global.getMaxLayers())
                    .outputDir(validated.getOutputDir())
                    .format(validated.getFormat())
                    .kinds(validated.getKinds())
                    .unknownKinds(validated.getUnknownKinds())
                    .threads(validated.getThreads())
                    .skipBrokenFiles(options.isSkipBrokenFiles())
                    .build();

            printer.printBanner(global, validated);

            ExportResult result = new ExportPipeline(config).export();
            if (!result.isSuccess()) {
                printer.printFailure(result);
                return 1;
            }

            printer.printSuccess(result);
            return 0;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error("Invalid option: {}", error));
            return CommandLine.ExitCode.USAGE;
        } catch (Exception e) {
            log.error("Export failed with exception", e);
            return 1;
        }
    }
}
