package com.x4.projector.resolver;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.x4.projector.definition.LoadedDefinitions;
import com.x4.projector.definition.ObjectKind;
import com.x4.projector.definition.SkippedDocument;
import com.x4.projector.definition.model.DefinitionNode;
import com.x4.projector.resolver.exception.InheritanceCycleException;
import com.x4.projector.resolver.model.Diagnostic;
import com.x4.projector.resolver.model.DiagnosticType;
import com.x4.projector.resolver.model.ResolutionDiagnostics;
import com.x4.projector.resolver.model.ResolutionResult;
import com.x4.projector.resolver.model.ResolvedRecord;

/**
 * Resolves every requested category of a loaded session, one task per category
 * on a bounded pool, all sharing one {@link MacroResolver}. Results are merged
 * in category order after every task has finished, so the thread count never
 * changes the output.
 */
public class ResolutionDriver {
    private static final Logger log = LoggerFactory.getLogger(ResolutionDriver.class);

    private final LoadedDefinitions loaded;
    private final MacroResolver resolver;
    private final int threads;

    public ResolutionDriver(LoadedDefinitions loaded, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, got " + threads);
        }
        this.loaded = loaded;
        this.resolver = new MacroResolver(loaded.graph());
        this.threads = threads;
    }

    /**
     * @param kinds categories to resolve
     * @param unknownKinds requested category names that match no category; each
     *        becomes an {@code UNKNOWN_KIND} diagnostic
     */
    public ResolutionResult resolve(Collection<ObjectKind> kinds, Collection<String> unknownKinds) {
        ResolutionDiagnostics session = new ResolutionDiagnostics();
        for (SkippedDocument skipped : loaded.skipped()) {
            DiagnosticType type = (skipped.reason() == SkippedDocument.Reason.CORRUPT_PAYLOAD)
                    ? DiagnosticType.CORRUPT_PAYLOAD
                    : DiagnosticType.MALFORMED_DEFINITION;
            session.add(Diagnostic.error(type, skipped.path(), "document skipped: " + skipped.message()));
        }
        for (String unknown : unknownKinds) {
            log.warn("Unknown object category '{}' skipped", unknown);
            session.add(Diagnostic.warning(DiagnosticType.UNKNOWN_KIND, unknown, "unknown object category, skipped"));
        }

        Map<ObjectKind, List<ResolvedRecord>> records = new EnumMap<>(ObjectKind.class);
        int poolSize = Math.max(1, Math.min(threads, kinds.size()));
        ExecutorService pool = Executors.newFixedThreadPool(poolSize);
        try {
            Map<ObjectKind, Future<KindResolution>> pending = new TreeMap<>();
            for (ObjectKind kind : kinds) {
                pending.computeIfAbsent(kind, k -> pool.submit(() -> resolveKind(k)));
            }
            for (Map.Entry<ObjectKind, Future<KindResolution>> entry : pending.entrySet()) {
                KindResolution resolution = await(entry.getValue());
                records.put(entry.getKey(), resolution.records());
                session.addAll(resolution.failures());
            }
        } finally {
            pool.shutdownNow();
        }

        return ResolutionResult.builder()
                .records(records)
                .sessionDiagnostics(session.getDiagnostics())
                .build();
    }

    private KindResolution resolveKind(ObjectKind kind) {
        List<DefinitionNode> nodes = loaded.graph().nodesOfKinds(kind.getMacroClasses());
        List<ResolvedRecord> records = new ArrayList<>(nodes.size());
        List<Diagnostic> failures = new ArrayList<>();

        for (DefinitionNode node : nodes) {
            try {
                records.add(resolver.resolve(node));
            } catch (InheritanceCycleException e) {
                failures.add(Diagnostic.error(DiagnosticType.INHERITANCE_CYCLE, node.getId(), e.getMessage()));
            }
        }

        log.info("Resolved {} {}", records.size(), kind.getCliName());
        return new KindResolution(records, failures);
    }

    private static KindResolution await(Future<KindResolution> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while resolving definitions", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Resolution failed", e.getCause());
        }
    }

    /**
     * Records of one category, sorted by id, and the macros of it that failed entirely.
     */
    private record KindResolution(List<ResolvedRecord> records, List<Diagnostic> failures) {
    }
}
