package com.x4.projector.cli;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.x4.projector.support.GameFixture;

import picocli.CommandLine;

/**
 * Command line tests running the full command tree the way the main method does.
 */
class ProjectorCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @Test
    void testResolveStringFromArchives() throws IOException {
        Path game = tempDir.resolve("game");
        GameFixture.writeArchives(game);

        int exitCode = execute("-g", game.toString(), "resolve-string", "{20101,1}", "{20107,1024}", "plain");

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).containsExactly("Fighter", "Allround Engine Mk1", "plain");
    }

    @Test
    void testResolveStringFromExtractedTree() throws IOException {
        Path game = tempDir.resolve("extracted");
        GameFixture.writeExtracted(game);

        int exitCode = execute("--game-root", game.toString(), "--file-loader", "fs", "resolve-string", "{20101,1}");

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).containsExactly("Fighter");
    }

    @Test
    void testResolveStringWithoutLanguageFileFails() throws IOException {
        Path game = Files.createDirectories(tempDir.resolve("empty"));

        int exitCode = execute("-g", game.toString(), "--file-loader", "FS", "resolve-string", "{20101,1}");

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testExportWritesFiles() throws IOException {
        Path game = tempDir.resolve("game");
        GameFixture.writeArchives(game);
        Path output = tempDir.resolve("out");

        int exitCode = execute("-g", game.toString(), "export", "engines", "wares", "--dir", output.toString(),
                "--format", "json");

        assertThat(exitCode).isZero();
        assertThat(output.resolve("engines.json")).exists();
        assertThat(output.resolve("wares.json")).exists();
        assertThat(output.resolve("ships.json")).doesNotExist();
    }

    @Test
    void testExportFailureExitCode() throws IOException {
        Path game = Files.createDirectories(tempDir.resolve("no-archives"));

        int exitCode = execute("-g", game.toString(), "export", "engines", "--dir", tempDir.resolve("out").toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void testInvalidOptionsExitCode() {
        assertThat(execute("-g", tempDir.toString(), "export", "--format", "xlsx")).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(execute("export", "engines")).isEqualTo(CommandLine.ExitCode.USAGE);
    }

    @Test
    void testMissingSubcommand() {
        int exitCode = execute("-g", tempDir.toString());

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("Missing required subcommand");
    }

    @Test
    void testUnknownOptionIsRejectedByParser() {
        int exitCode = execute("--no-such-option");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("--no-such-option");
    }

    @Test
    void testVersion() {
        int exitCode = execute("--version");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("x4-projector 1.0.0");
    }

    private int execute(String... args) {
        return new CommandLine(new ProjectorCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setOut(new PrintWriter(out))
                .setErr(new PrintWriter(err))
                .execute(args);
    }
}
