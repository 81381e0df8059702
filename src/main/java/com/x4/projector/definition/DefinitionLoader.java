package com.x4.projector.definition;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.x4.projector.archive.GameFileSource;
import com.x4.projector.archive.GamePaths;
import com.x4.projector.archive.MountedFileSource;
import com.x4.projector.archive.exception.CorruptPayloadException;
import com.x4.projector.definition.exception.MalformedDefinitionException;
import com.x4.projector.definition.model.ConnectionRef;
import com.x4.projector.definition.model.DefinitionGraph;
import com.x4.projector.definition.model.DefinitionNode;
import com.x4.projector.definition.model.NodeOrigin;

/**
 * Loads the definition documents an export run needs into one session graph.
 *
 * Seed documents come from the per-category location table, applied to the base
 * game and to every mounted extension. Identifiers the loaded nodes refer to but
 * that are not loaded yet are then looked up in the index documents and loaded,
 * until a round adds nothing new.
 */
public class DefinitionLoader {
    private static final Logger log = LoggerFactory.getLogger(DefinitionLoader.class);

    public static final String BULLET_CLASS_PROPERTY = "bullet.class";

    private final GameFileSource files;
    private final DefinitionIndex macroIndex;
    private final DefinitionIndex componentIndex;
    private final boolean skipBrokenFiles;
    private final DefinitionDocumentParser parser = new DefinitionDocumentParser();

    private final DefinitionGraph graph = new DefinitionGraph();
    private final Set<String> loadedPaths = new HashSet<>();
    private final List<SkippedDocument> skipped = new ArrayList<>();

    public DefinitionLoader(GameFileSource files, DefinitionIndex macroIndex, DefinitionIndex componentIndex,
                            boolean skipBrokenFiles) {
        this.files = Objects.requireNonNull(files, "files");
        this.macroIndex = Objects.requireNonNull(macroIndex, "macroIndex");
        this.componentIndex = Objects.requireNonNull(componentIndex, "componentIndex");
        this.skipBrokenFiles = skipBrokenFiles;
    }

    /**
     * Creates a loader over the base game index documents and those of every
     * mounted extension.
     */
    public static DefinitionLoader open(GameFileSource files, boolean skipBrokenFiles) throws IOException {
        DefinitionIndex macros = DefinitionIndex.load(files, DefinitionIndex.MACRO_INDEX_PATH);
        DefinitionIndex components = DefinitionIndex.load(files, DefinitionIndex.COMPONENT_INDEX_PATH);

        for (String extension : files.extensionNames()) {
            String prefix = extensionRoot(extension);
            mergeIfPresent(files, macros, GamePaths.join(prefix, DefinitionIndex.MACRO_INDEX_PATH));
            mergeIfPresent(files, components, GamePaths.join(prefix, DefinitionIndex.COMPONENT_INDEX_PATH));
        }

        // shipped index lacks this component
        components.put("cockpit_invisible_escapepod", "assets/units/size_s/cockpit_invisible_escapepod.xml");

        return new DefinitionLoader(files, macros, components, skipBrokenFiles);
    }

    /**
     * Loads the seed documents of the given categories and their dependency closure.
     *
     * @throws CorruptPayloadException when a document fails its checksum and broken
     *         files are not skipped
     * @throws MalformedDefinitionException when a document cannot be parsed and
     *         broken files are not skipped
     */
    public LoadedDefinitions load(Collection<ObjectKind> kinds) throws IOException {
        List<String> roots = new ArrayList<>();
        roots.add("");
        files.extensionNames().forEach(name -> roots.add(extensionRoot(name)));

        for (ObjectKind kind : kinds) {
            int before = loadedPaths.size();
            for (String root : roots) {
                for (DocumentLocation location : kind.getLocations()) {
                    for (String path : location.find(files, root)) {
                        loadDocument(path);
                    }
                }
            }
            log.info("Loaded {} seed document(s) for {}", loadedPaths.size() - before, kind.getCliName());
        }

        resolveDependencies();
        log.info("Definition graph holds {} macro(s), {} component(s), {} ware(s)",
                graph.size(NodeOrigin.MACRO), graph.size(NodeOrigin.COMPONENT), graph.size(NodeOrigin.WARE));
        return new LoadedDefinitions(graph, skipped);
    }

    private void resolveDependencies() throws IOException {
        Set<Reference> attempted = new HashSet<>();

        while (true) {
            Set<Reference> missing = missingReferences();
            missing.removeAll(attempted);
            if (missing.isEmpty()) {
                break;
            }

            for (Reference reference : missing) {
                attempted.add(reference);
                DefinitionIndex index = reference.origin() == NodeOrigin.COMPONENT ? componentIndex : macroIndex;
                Optional<String> path = index.pathOf(reference.id());
                if (path.isEmpty()) {
                    log.debug("{} {} is not in the index", reference.origin(), reference.id());
                    continue;
                }
                if (!files.exists(path.get())) {
                    log.warn("{} {} is indexed at {} but that file does not exist", reference.origin(),
                            reference.id(), path.get());
                    continue;
                }
                loadDocument(path.get());
            }
        }

        Set<Reference> unresolved = missingReferences();
        if (!unresolved.isEmpty()) {
            log.warn("{} referenced definition(s) could not be loaded", unresolved.size());
            log.debug("Unresolved references: {}", unresolved);
        }
    }

    private Set<Reference> missingReferences() {
        Set<Reference> missing = new LinkedHashSet<>();
        for (DefinitionNode node : graph.nodes(NodeOrigin.MACRO)) {
            node.getExtendsId().ifPresent(id -> addIfMissing(missing, NodeOrigin.MACRO, id));
            node.getComponentRef().ifPresent(id -> addIfMissing(missing, NodeOrigin.COMPONENT, id));
            node.property(BULLET_CLASS_PROPERTY).ifPresent(id -> addIfMissing(missing, NodeOrigin.MACRO, id));
            for (ConnectionRef connection : node.getConnections()) {
                connection.getTargetId().ifPresent(id -> addIfMissing(missing, NodeOrigin.MACRO, id));
            }
        }
        return missing;
    }

    private void addIfMissing(Set<Reference> missing, NodeOrigin origin, String id) {
        if (!graph.contains(origin, id)) {
            missing.add(new Reference(origin, id));
        }
    }

    private void loadDocument(String path) throws IOException {
        if (!loadedPaths.add(path)) {
            return;
        }
        try {
            graph.addAll(parser.parse(files.read(path), path));
        } catch (CorruptPayloadException e) {
            skipOrRethrow(path, SkippedDocument.Reason.CORRUPT_PAYLOAD, e);
        } catch (MalformedDefinitionException e) {
            skipOrRethrow(path, SkippedDocument.Reason.MALFORMED_DEFINITION, e);
        }
    }

    private void skipOrRethrow(String path, SkippedDocument.Reason reason, RuntimeException e) {
        if (!skipBrokenFiles) {
            throw e;
        }
        log.error("Skipping {}: {}", path, e.getMessage());
        skipped.add(new SkippedDocument(path, reason, e.getMessage()));
    }

    private static void mergeIfPresent(GameFileSource files, DefinitionIndex index, String path) throws IOException {
        if (files.exists(path)) {
            index.merge(files.read(path), path);
        }
    }

    private static String extensionRoot(String extension) {
        return GamePaths.join(MountedFileSource.EXTENSIONS_DIR, extension);
    }

    private record Reference(NodeOrigin origin, String id) {
    }
}
