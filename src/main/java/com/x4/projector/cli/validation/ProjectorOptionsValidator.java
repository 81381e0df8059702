package com.x4.projector.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import com.x4.projector.archive.ArchiveOverlay;
import com.x4.projector.cli.exception.OptionsValidationException;
import com.x4.projector.cli.model.ExportOptions;
import com.x4.projector.cli.model.GlobalOptions;
import com.x4.projector.cli.model.ValidatedExportOptions;
import com.x4.projector.cli.model.ValidatedGlobalOptions;
import com.x4.projector.definition.ObjectKind;
import com.x4.projector.export.ExportFormat;
import com.x4.projector.lang.LanguageTable;

public class ProjectorOptionsValidator {

    public ValidatedGlobalOptions validate(GlobalOptions o) {
        List<String> errors = new ArrayList<>();
        Path gameRoot = validateGlobal(o, errors);

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }
        return new ValidatedGlobalOptions(gameRoot);
    }

    public ValidatedExportOptions validate(GlobalOptions o, ExportOptions e) {
        List<String> errors = new ArrayList<>();
        Path gameRoot = validateGlobal(o, errors);

        Optional<ExportFormat> format = ExportFormat.fromName(e.getFormat());
        if (format.isEmpty()) {
            errors.add("Unknown format: " + e.getFormat() + ". Expected csv, markdown, json or yaml.");
        }

        Path outputDir = (e.getOutputDir() == null ? Path.of(".") : e.getOutputDir()).toAbsolutePath().normalize();
        if (Files.exists(outputDir) && !Files.isDirectory(outputDir)) {
            errors.add("Output path exists and is not a directory: " + outputDir);
        }

        Set<ObjectKind> kinds = EnumSet.noneOf(ObjectKind.class);
        Set<String> unknownKinds = new LinkedHashSet<>();
        List<String> requested = (e.getObjects() == null || e.getObjects().isEmpty())
                ? List.of(ExportOptions.ALL_OBJECTS)
                : e.getObjects();
        for (String name : requested) {
            if (ExportOptions.ALL_OBJECTS.equalsIgnoreCase(name)) {
                kinds.addAll(EnumSet.allOf(ObjectKind.class));
            } else {
                ObjectKind.fromName(name).ifPresentOrElse(kinds::add,
                        () -> unknownKinds.add(name.toLowerCase(Locale.ROOT)));
            }
        }

        int threads;
        if (e.getThreads() == null) {
            threads = Math.max(1, Math.min(kinds.size(), Runtime.getRuntime().availableProcessors()));
        } else {
            threads = e.getThreads();
            if (threads < 1) {
                errors.add("Threads must be at least 1. Got: " + threads);
            }
        }

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }

        return new ValidatedExportOptions(gameRoot, outputDir, format.get(), List.copyOf(kinds),
                List.copyOf(unknownKinds), threads);
    }

    private static Path validateGlobal(GlobalOptions o, List<String> errors) {
        Path gameRoot = null;
        if (o.getGameRoot() == null) {
            errors.add("Game folder is required (--game-root / -g).");
        } else {
            gameRoot = o.getGameRoot().toAbsolutePath().normalize();
            if (!Files.isDirectory(gameRoot)) {
                errors.add("Game folder does not exist or is not a directory: " + gameRoot);
            }
        }

        if (o.getMaxLayers() < 1 || o.getMaxLayers() > ArchiveOverlay.DEFAULT_MAX_LAYERS) {
            errors.add("Max layers must be in range 1-" + ArchiveOverlay.DEFAULT_MAX_LAYERS + ". Got: "
                    + o.getMaxLayers());
        }

        if (!LanguageTable.isKnown(o.getLanguage())) {
            errors.add("Unknown language: " + o.getLanguage());
        }
        return gameRoot;
    }
}
