package com.x4.projector.cli;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.x4.projector.archive.GameFileSource;
import com.x4.projector.cli.exception.OptionsValidationException;
import com.x4.projector.cli.model.GlobalOptions;
import com.x4.projector.cli.model.ValidatedGlobalOptions;
import com.x4.projector.cli.validation.ProjectorOptionsValidator;
import com.x4.projector.lang.LanguageResolver;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that prints text templates with their {@code {page,text}}
 * placeholders resolved, one per line.
 */
@Command(
        name = "resolve-string",
        mixinStandardHelpOptions = true,
        description = "Resolves {page,text} placeholders in the given strings."
)
public class ResolveStringCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ResolveStringCommand.class);

    @ParentCommand
    private ProjectorCommand parent;

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "1..*", paramLabel = "STRING", description = "Text templates, e.g. '{20101,10101}'")
    private List<String> strings;

    private final ProjectorOptionsValidator validator = new ProjectorOptionsValidator();

    @Override
    public Integer call() {
        parent.applyLogging();
        GlobalOptions global = parent.getGlobalOptions();
        try {
            ValidatedGlobalOptions validated = validator.validate(global);

            try (GameFileSource files = global.getFileLoader().open(validated.getGameRoot(), global.getMaxLayers())) {
                LanguageResolver languages = new LanguageResolver(files, global.getLanguage());
                languages.preload(global.getLanguage());

                PrintWriter out = spec.commandLine().getOut();
                for (String template : strings) {
                    out.println(languages.resolve(template));
                }
                out.flush();
            }
            return 0;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error("Invalid option: {}", error));
            return CommandLine.ExitCode.USAGE;
        } catch (Exception e) {
            log.error("Resolving strings failed", e);
            return 1;
        }
    }
}
