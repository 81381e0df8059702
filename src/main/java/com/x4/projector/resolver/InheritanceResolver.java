package com.x4.projector.resolver;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.x4.projector.definition.model.ConnectionRef;
import com.x4.projector.definition.model.DefinitionGraph;
import com.x4.projector.definition.model.DefinitionNode;
import com.x4.projector.resolver.exception.InheritanceCycleException;
import com.x4.projector.resolver.model.Diagnostic;
import com.x4.projector.resolver.model.DiagnosticType;

/**
 * Applies {@code extends} chains.
 *
 * Chains are walked upwards with a loop, not recursion, so chain length never
 * matters. Every macro on a chain is overlaid once per session; the results and
 * the cycle failures are both memoized.
 */
class InheritanceResolver {
    private static final Logger log = LoggerFactory.getLogger(InheritanceResolver.class);

    private final DefinitionGraph graph;

    private final ConcurrentMap<String, OverlaidMacro> overlaid = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, InheritanceCycleException> cycles = new ConcurrentHashMap<>();

    InheritanceResolver(DefinitionGraph graph) {
        this.graph = graph;
    }

    /**
     * @throws InheritanceCycleException if the chain above {@code node} loops
     */
    OverlaidMacro overlay(DefinitionNode node) {
        OverlaidMacro cached = overlaid.get(node.getId());
        if (cached != null) {
            return cached;
        }
        InheritanceCycleException failed = cycles.get(node.getId());
        if (failed != null) {
            throw failed;
        }

        // child first; ancestors are popped back off top-down
        Deque<DefinitionNode> chain = new ArrayDeque<>();
        LinkedHashSet<String> onChain = new LinkedHashSet<>();
        OverlaidMacro base = null;
        String missingParentOf = null;

        DefinitionNode current = node;
        while (true) {
            if (!onChain.add(current.getId())) {
                throw cycleFailure(onChain, current.getId());
            }
            chain.push(current);

            Optional<String> parentId = current.getExtendsId();
            if (parentId.isEmpty()) {
                break;
            }
            OverlaidMacro parentDone = overlaid.get(parentId.get());
            if (parentDone != null) {
                base = parentDone;
                break;
            }
            InheritanceCycleException parentFailure = cycles.get(parentId.get());
            if (parentFailure != null) {
                onChain.forEach(id -> cycles.putIfAbsent(id, parentFailure));
                throw parentFailure;
            }
            Optional<DefinitionNode> parent = graph.findMacro(parentId.get());
            if (parent.isEmpty()) {
                missingParentOf = current.getId();
                break;
            }
            current = parent.get();
        }

        OverlaidMacro result = base;
        while (!chain.isEmpty()) {
            DefinitionNode next = chain.pop();
            OverlaidMacro applied = apply(result, next, next.getId().equals(missingParentOf));
            OverlaidMacro raced = overlaid.putIfAbsent(next.getId(), applied);
            result = (raced != null) ? raced : applied;
        }
        return result;
    }

    private InheritanceCycleException cycleFailure(LinkedHashSet<String> onChain, String repeated) {
        List<String> ids = new ArrayList<>(onChain);
        List<String> cycle = new ArrayList<>(ids.subList(ids.indexOf(repeated), ids.size()));
        // starts at the smallest id, so the report is the same from every entry point
        Collections.rotate(cycle, -cycle.indexOf(Collections.min(cycle)));
        cycle.add(cycle.get(0));

        InheritanceCycleException failure = new InheritanceCycleException(cycle);
        ids.forEach(id -> cycles.putIfAbsent(id, failure));
        log.warn(failure.getMessage());
        return failure;
    }

    private OverlaidMacro apply(OverlaidMacro parent, DefinitionNode node, boolean parentMissing) {
        Map<String, String> properties = new LinkedHashMap<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        Map<String, List<ConnectionRef>> connectionsByRole = new LinkedHashMap<>();
        String componentId = null;

        if (parent != null) {
            properties.putAll(parent.getProperties());
            diagnostics.addAll(parent.getDiagnostics());
            for (ConnectionRef connection : parent.getConnections()) {
                connectionsByRole.computeIfAbsent(connection.getRole(), role -> new ArrayList<>()).add(connection);
            }
            componentId = parent.getComponentId().orElse(null);
        }

        properties.putAll(node.getProperties());

        // a child connection replaces every inherited connection of the same role
        Map<String, List<ConnectionRef>> own = new LinkedHashMap<>();
        for (ConnectionRef connection : node.getConnections()) {
            own.computeIfAbsent(connection.getRole(), role -> new ArrayList<>()).add(connection);
        }
        connectionsByRole.putAll(own);

        if (node.getComponentRef().isPresent()) {
            componentId = node.getComponentRef().get();
        }

        if (parentMissing) {
            String parentId = node.getExtendsId().orElse("");
            diagnostics.add(Diagnostic.warning(DiagnosticType.UNRESOLVED_REFERENCE, node.getId(),
                    "extends unknown macro " + parentId));
        }

        return OverlaidMacro.builder()
                .id(node.getId())
                .kind(node.getKind())
                .properties(Collections.unmodifiableMap(properties))
                .connections(connectionsByRole.values().stream().flatMap(List::stream).toList())
                .componentId(componentId)
                .diagnostics(List.copyOf(diagnostics))
                .build();
    }
}
