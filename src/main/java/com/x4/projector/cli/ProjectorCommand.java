package com.x4.projector.cli;

import java.util.concurrent.Callable;

import com.x4.projector.cli.model.GlobalOptions;
import com.x4.projector.logging.LoggingConfigurator;

import lombok.Getter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/**
 * Top level command; the work is done by its subcommands.
 */
@Command(
        name = "x4-projector",
        mixinStandardHelpOptions = true,
        version = "x4-projector 1.0.0",
        description = "Extracts ship, equipment and ware data from an X4 game installation.",
        subcommands = { ExportCommand.class, ResolveStringCommand.class }
)
public class ProjectorCommand implements Callable<Integer> {

    @Getter
    @Mixin
    private GlobalOptions globalOptions;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        throw new ParameterException(spec.commandLine(), "Missing required subcommand (export or resolve-string)");
    }

    void applyLogging() {
        if (globalOptions.isVerbose()) {
            LoggingConfigurator.enableVerboseLogging();
        }
    }
}
