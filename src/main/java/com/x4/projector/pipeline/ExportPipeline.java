package com.x4.projector.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.x4.projector.archive.GameFileSource;
import com.x4.projector.definition.DefinitionLoader;
import com.x4.projector.definition.LoadedDefinitions;
import com.x4.projector.definition.ObjectKind;
import com.x4.projector.definition.model.NodeOrigin;
import com.x4.projector.export.RecordExporter;
import com.x4.projector.export.RecordLocalizer;
import com.x4.projector.lang.LanguageResolver;
import com.x4.projector.resolver.ResolutionDriver;
import com.x4.projector.resolver.model.Diagnostic;
import com.x4.projector.resolver.model.DiagnosticType;
import com.x4.projector.resolver.model.ResolutionResult;
import com.x4.projector.resolver.model.ResolvedRecord;
import com.x4.projector.resolver.model.Severity;

/**
 * Runs one export: opens the game files, loads the requested categories with
 * their dependencies, resolves them, localizes the records and writes them.
 */
public class ExportPipeline {
    private static final Logger log = LoggerFactory.getLogger(ExportPipeline.class);

    private final ProjectorConfig config;
    private final RecordExporter exporter = new RecordExporter();

    public ExportPipeline(ProjectorConfig config) {
        this.config = config;
    }

    public ExportResult export() {
        log.info("Starting export...");

        // Step 1: Open game files
        log.info("Step 1: Opening game files under {}...", config.getGameRoot());
        try (GameFileSource files = config.getFileLoader().open(config.getGameRoot(), config.getMaxLayers())) {
            LanguageResolver languages = new LanguageResolver(files, config.getLanguage());
            languages.preload(config.getLanguage());

            // Step 2: Load definitions
            log.info("Step 2: Loading definitions for {}...", config.getKinds());
            LoadedDefinitions loaded = DefinitionLoader.open(files, config.isSkipBrokenFiles())
                    .load(config.getKinds());

            // Step 3: Resolve
            log.info("Step 3: Resolving definitions on {} thread(s)...", config.getThreads());
            ResolutionResult resolved = new ResolutionDriver(loaded, config.getThreads())
                    .resolve(config.getKinds(), config.getUnknownKinds());

            // Step 4: Localize
            log.info("Step 4: Localizing texts ({})...", config.getLanguage());
            Map<ObjectKind, List<ResolvedRecord>> localized = localize(resolved, new RecordLocalizer(languages));

            // Step 5: Write
            log.info("Step 5: Writing {} files to {}...", config.getFormat().getCliName(), config.getOutputDir());
            Files.createDirectories(config.getOutputDir());
            List<Path> written = exporter.write(localized, config.getOutputDir(), config.getFormat());

            List<Diagnostic> diagnostics = new ArrayList<>(resolved.allDiagnostics());
            for (String text : languages.getUnresolved()) {
                diagnostics.add(Diagnostic.warning(DiagnosticType.UNRESOLVED_REFERENCE, text,
                        "no " + config.getLanguage() + " text for this placeholder"));
            }
            Optional<Path> diagnosticsFile = exporter.writeDiagnostics(diagnostics, config.getOutputDir());

            log.info("Export complete!");

            Map<ObjectKind, Integer> counts = new EnumMap<>(ObjectKind.class);
            localized.forEach((kind, records) -> counts.put(kind, records.size()));
            long errors = diagnostics.stream().filter(d -> d.getSeverity() == Severity.ERROR).count();

            return ExportResult.builder()
                    .success(true)
                    .outputDir(config.getOutputDir())
                    .definitionsLoaded(loaded.graph().size(NodeOrigin.MACRO) + loaded.graph().size(NodeOrigin.WARE))
                    .documentsSkipped(loaded.skipped().size())
                    .recordCounts(counts)
                    .filesWritten(written)
                    .errorCount((int) errors)
                    .warningCount(diagnostics.size() - (int) errors)
                    .diagnosticsFile(diagnosticsFile.orElse(null))
                    .unresolvedTexts(languages.getUnresolved().size())
                    .build();

        } catch (IOException | RuntimeException e) {
            log.error("Export failed", e);
            return ExportResult.failure(e.getMessage());
        }
    }

    private static Map<ObjectKind, List<ResolvedRecord>> localize(ResolutionResult resolved,
                                                                  RecordLocalizer localizer) {
        Map<ObjectKind, List<ResolvedRecord>> localized = new EnumMap<>(ObjectKind.class);
        resolved.getRecords().forEach((kind, records) ->
                localized.put(kind, records.stream().map(localizer::localize).toList()));
        return localized;
    }
}
