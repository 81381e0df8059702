package com.x4.projector;

import com.x4.projector.cli.ProjectorCommand;

import picocli.CommandLine;

/**
 * Main entry point for the X4 Projector.
 * Reads the game's layered archives, resolves macro definitions into flat
 * records and exports them as CSV, Markdown, JSON or YAML.
 */
public class ProjectorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ProjectorCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
