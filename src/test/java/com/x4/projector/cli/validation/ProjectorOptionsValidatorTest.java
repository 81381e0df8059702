package com.x4.projector.cli.validation;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.x4.projector.cli.exception.OptionsValidationException;
import com.x4.projector.cli.model.ExportOptions;
import com.x4.projector.cli.model.GlobalOptions;
import com.x4.projector.cli.model.ValidatedExportOptions;
import com.x4.projector.cli.model.ValidatedGlobalOptions;
import com.x4.projector.definition.ObjectKind;
import com.x4.projector.export.ExportFormat;

import picocli.CommandLine;

/**
 * Unit tests for ProjectorOptionsValidator.
 */
class ProjectorOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private final ProjectorOptionsValidator validator = new ProjectorOptionsValidator();

    @Test
    void testValidGlobalOptions() {
        ValidatedGlobalOptions validated = validator.validate(global("-g", tempDir.toString()));

        assertThat(validated.getGameRoot()).isEqualTo(tempDir.toAbsolutePath().normalize());
    }

    @Test
    void testGameRootIsRequired() {
        assertThatThrownBy(() -> validator.validate(global()))
                .isInstanceOf(OptionsValidationException.class)
                .satisfies(e -> assertThat(((OptionsValidationException) e).getErrors())
                        .containsExactly("Game folder is required (--game-root / -g)."));
    }

    @Test
    void testAllGlobalErrorsAreReportedTogether() {
        GlobalOptions options = global("-g", tempDir.resolve("missing").toString(), "--max-layers", "0",
                "--lang", "klingon");

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOf(OptionsValidationException.class)
                .satisfies(e -> assertThat(((OptionsValidationException) e).getErrors())
                        .hasSize(3)
                        .anyMatch(error -> error.startsWith("Game folder does not exist"))
                        .anyMatch(error -> error.startsWith("Max layers must be in range 1-99"))
                        .anyMatch(error -> error.equals("Unknown language: klingon")));
    }

    @Test
    void testExportDefaults() {
        ValidatedExportOptions validated = validator.validate(global("-g", tempDir.toString()), export());

        assertThat(validated.getKinds()).containsExactlyElementsOf(EnumSet.allOf(ObjectKind.class));
        assertThat(validated.getUnknownKinds()).isEmpty();
        assertThat(validated.getFormat()).isEqualTo(ExportFormat.CSV);
        assertThat(validated.getOutputDir()).isEqualTo(Path.of(".").toAbsolutePath().normalize());
        assertThat(validated.getThreads()).isBetween(1, ObjectKind.values().length);
    }

    @Test
    void testUnknownCategoriesAreKeptNotRejected() {
        ValidatedExportOptions validated = validator.validate(global("-g", tempDir.toString()),
                export("Engines", "Stations", "wares", "engines", "--format", "MD", "--threads", "4"));

        assertThat(validated.getKinds()).containsExactly(ObjectKind.ENGINES, ObjectKind.WARES);
        assertThat(validated.getUnknownKinds()).containsExactly("stations");
        assertThat(validated.getFormat()).isEqualTo(ExportFormat.MARKDOWN);
        assertThat(validated.getThreads()).isEqualTo(4);
    }

    @Test
    void testSingleCategoryDefaultsToOneThread() {
        ValidatedExportOptions validated = validator.validate(global("-g", tempDir.toString()), export("ships"));

        assertThat(validated.getThreads()).isEqualTo(1);
    }

    @Test
    void testExportErrors() throws IOException {
        Path file = Files.writeString(tempDir.resolve("taken"), "not a directory");

        assertThatThrownBy(() -> validator.validate(global("-g", tempDir.toString()),
                export("--format", "xlsx", "--threads", "0", "--dir", file.toString())))
                .isInstanceOf(OptionsValidationException.class)
                .satisfies(e -> assertThat(((OptionsValidationException) e).getErrors())
                        .hasSize(3)
                        .anyMatch(error -> error.startsWith("Unknown format: xlsx"))
                        .anyMatch(error -> error.startsWith("Threads must be at least 1"))
                        .anyMatch(error -> error.startsWith("Output path exists and is not a directory")));
    }

    private static GlobalOptions global(String... args) {
        return CommandLine.populateCommand(new GlobalOptions(), args);
    }

    private static ExportOptions export(String... args) {
        return CommandLine.populateCommand(new ExportOptions(), args);
    }
}
