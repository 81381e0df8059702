package com.x4.projector.resolver;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.x4.projector.definition.DefinitionLoader;
import com.x4.projector.definition.model.ConnectionRef;
import com.x4.projector.definition.model.DefinitionGraph;
import com.x4.projector.definition.model.DefinitionNode;
import com.x4.projector.definition.model.NodeOrigin;
import com.x4.projector.resolver.exception.InheritanceCycleException;
import com.x4.projector.resolver.model.Diagnostic;
import com.x4.projector.resolver.model.DiagnosticType;
import com.x4.projector.resolver.model.ResolvedRecord;
import com.x4.projector.resolver.model.SlotRecord;

/**
 * Resolves definition nodes of a loaded session graph into flat records.
 *
 * Per node:
 * 1. Applies the {@code extends} chain (child values win)
 * 2. Coerces raw properties through the class's attribute profile
 * 3. Adds component-derived attributes the chain does not declare
 * 4. Walks connections depth-first into slot summaries
 * 5. Applies the class's derivations
 *
 * Missing references become diagnostics on the record, never failures. Records,
 * overlays and slot summaries are memoized in concurrent maps, so kinds can be
 * resolved from several threads against the same instance and a node resolves
 * to the same record whichever path reaches it first.
 */
public class MacroResolver {
    private static final Logger log = LoggerFactory.getLogger(MacroResolver.class);

    private static final String BULLET_ROLE = "bullet";

    private final DefinitionGraph graph;
    private final InheritanceResolver inheritance;

    private final ConcurrentMap<String, ResolvedRecord> records = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, SlotSummary> summaries = new ConcurrentHashMap<>();

    public MacroResolver(DefinitionGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.inheritance = new InheritanceResolver(graph);
    }

    /**
     * Resolves the macro or ware with the given id.
     *
     * @throws IllegalArgumentException if no macro or ware has that id
     * @throws InheritanceCycleException if the macro's {@code extends} chain loops
     */
    public ResolvedRecord resolve(String id) {
        DefinitionNode node = graph.findMacro(id)
                .or(() -> graph.find(NodeOrigin.WARE, id))
                .orElseThrow(() -> new IllegalArgumentException("No macro or ware with id " + id));
        return resolve(node);
    }

    /**
     * @throws InheritanceCycleException if the macro's {@code extends} chain loops
     */
    public ResolvedRecord resolve(DefinitionNode node) {
        String key = node.getOrigin() + ":" + node.getId();
        ResolvedRecord cached = records.get(key);
        if (cached != null) {
            return cached;
        }

        ResolvedRecord record = (node.getOrigin() == NodeOrigin.WARE) ? resolveWare(node) : resolveMacro(node);
        ResolvedRecord raced = records.putIfAbsent(key, record);
        return (raced != null) ? raced : record;
    }

    private ResolvedRecord resolveMacro(DefinitionNode node) {
        OverlaidMacro overlay = inheritance.overlay(node);
        Set<Diagnostic> diagnostics = new LinkedHashSet<>(overlay.getDiagnostics());

        Map<String, Object> attributes = attributesOf(overlay, diagnostics);

        List<SlotRecord> slots = new ArrayList<>();
        Deque<String> path = new ArrayDeque<>();
        path.push(node.getId());
        traverse(node.getId(), overlay.getConnections(), "", path, slots, diagnostics);

        Optional.ofNullable(overlay.getProperties().get(DefinitionLoader.BULLET_CLASS_PROPERTY))
                .ifPresent(bulletId -> addSlot(node.getId(), BULLET_ROLE, bulletId, slots, diagnostics));

        Derivations.apply(overlay.getKind(), attributes, slots);

        log.debug("Resolved {} ({}) with {} slot(s)", node.getId(), overlay.getKind(), slots.size());
        return ResolvedRecord.builder()
                .id(node.getId())
                .kind(overlay.getKind())
                .attributes(attributes)
                .slots(slots)
                .diagnostics(diagnostics)
                .build();
    }

    private ResolvedRecord resolveWare(DefinitionNode node) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        AttributeProfile profile = AttributeProfiles.forKind(node.getKind()).orElseThrow();
        Map<String, Object> attributes = new LinkedHashMap<>(
                profile.apply(node.getProperties(), node.getId(), diagnostics));
        List<Map<String, Object>> productions =
                Derivations.applyWareEntries(node.getId(), attributes, node.getEntries(), diagnostics);

        ResolvedRecord.ResolvedRecordBuilder builder = ResolvedRecord.builder()
                .id(node.getId())
                .kind(node.getKind())
                .attributes(attributes)
                .diagnostics(diagnostics);
        if (!productions.isEmpty()) {
            builder.entry("production", productions);
        }
        return builder.build();
    }

    /**
     * Profile attributes of an overlaid macro plus its component-derived ones.
     * Declared values win over component-derived ones.
     */
    private Map<String, Object> attributesOf(OverlaidMacro overlay, Set<Diagnostic> diagnostics) {
        List<Diagnostic> found = new ArrayList<>();
        Map<String, Object> attributes;

        Optional<AttributeProfile> profile = AttributeProfiles.forKind(overlay.getKind());
        if (profile.isPresent()) {
            attributes = new LinkedHashMap<>(profile.get().apply(overlay.getProperties(), overlay.getId(), found));
        } else {
            attributes = new LinkedHashMap<>(overlay.getProperties());
            found.add(Diagnostic.warning(DiagnosticType.UNKNOWN_KIND, overlay.getId(),
                    "no attribute profile for class " + overlay.getKind() + ", raw properties passed through"));
        }

        overlay.getComponentId().ifPresent(componentId -> {
            Optional<DefinitionNode> component = graph.findComponent(componentId);
            if (component.isEmpty()) {
                found.add(Diagnostic.warning(DiagnosticType.UNRESOLVED_REFERENCE, overlay.getId(),
                        "component " + componentId + " not found"));
                return;
            }
            ComponentAttributes.derive(component.get()).forEach(attributes::putIfAbsent);
        });

        diagnostics.addAll(found);
        return attributes;
    }

    private void traverse(String rootId, List<ConnectionRef> connections, String prefix, Deque<String> path,
                          List<SlotRecord> slots, Set<Diagnostic> diagnostics) {
        for (ConnectionRef connection : connections) {
            Optional<String> targetId = connection.getTargetId();
            if (targetId.isEmpty()) {
                continue;
            }
            String rolePath = prefix.isEmpty() ? connection.getRole() : prefix + "/" + connection.getRole();

            Optional<SlotSummary> summary = addSlot(rootId, rolePath, targetId.get(), slots, diagnostics);
            if (summary.isEmpty()) {
                continue;
            }
            if (path.contains(targetId.get())) {
                diagnostics.add(Diagnostic.warning(DiagnosticType.CONNECTION_CYCLE, rootId,
                        "connection " + rolePath + " leads back to " + targetId.get()));
                continue;
            }

            path.push(targetId.get());
            traverse(rootId, summary.get().connections(), rolePath, path, slots, diagnostics);
            path.pop();
        }
    }

    /**
     * Adds the slot for one connection target, or a placeholder slot when the
     * target cannot be resolved.
     */
    private Optional<SlotSummary> addSlot(String rootId, String rolePath, String targetId,
                                          List<SlotRecord> slots, Set<Diagnostic> diagnostics) {
        Optional<DefinitionNode> target = graph.findMacro(targetId);
        if (target.isEmpty()) {
            diagnostics.add(Diagnostic.warning(DiagnosticType.UNRESOLVED_REFERENCE, rootId,
                    "connection " + rolePath + " references unknown macro " + targetId));
            slots.add(SlotRecord.placeholder(rolePath, targetId));
            return Optional.empty();
        }

        SlotSummary summary;
        try {
            summary = summarize(target.get());
        } catch (InheritanceCycleException e) {
            diagnostics.add(Diagnostic.error(DiagnosticType.INHERITANCE_CYCLE, rootId,
                    "connection " + rolePath + ": " + e.getMessage()));
            slots.add(SlotRecord.placeholder(rolePath, targetId));
            return Optional.empty();
        }

        diagnostics.addAll(summary.diagnostics());
        slots.add(SlotRecord.builder()
                .rolePath(rolePath)
                .targetId(targetId)
                .targetKind(summary.kind())
                .attributes(summary.attributes())
                .build());
        return Optional.of(summary);
    }

    private SlotSummary summarize(DefinitionNode node) {
        SlotSummary cached = summaries.get(node.getId());
        if (cached != null) {
            return cached;
        }

        OverlaidMacro overlay = inheritance.overlay(node);
        Set<Diagnostic> diagnostics = new LinkedHashSet<>(overlay.getDiagnostics());
        Map<String, Object> attributes = attributesOf(overlay, diagnostics);
        Derivations.apply(overlay.getKind(), attributes, List.of());

        SlotSummary summary = new SlotSummary(overlay.getKind(), Collections.unmodifiableMap(attributes),
                overlay.getConnections(), List.copyOf(diagnostics));
        SlotSummary raced = summaries.putIfAbsent(node.getId(), summary);
        return (raced != null) ? raced : summary;
    }

    private record SlotSummary(String kind, Map<String, Object> attributes, List<ConnectionRef> connections,
                               List<Diagnostic> diagnostics) {
    }
}
