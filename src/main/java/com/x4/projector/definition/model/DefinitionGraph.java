package com.x4.projector.definition.model;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Session-wide set of definition nodes, one namespace per {@link NodeOrigin}.
 *
 * Filled single-threaded while documents load; afterwards it is only read, so
 * resolver threads may share it without locking.
 */
public class DefinitionGraph {
    private static final Logger log = LoggerFactory.getLogger(DefinitionGraph.class);

    private final Map<NodeOrigin, Map<String, DefinitionNode>> nodes = new EnumMap<>(NodeOrigin.class);

    public DefinitionGraph() {
        for (NodeOrigin origin : NodeOrigin.values()) {
            nodes.put(origin, new LinkedHashMap<>());
        }
    }

    /**
     * Adds parsed nodes. A node whose id is already known replaces the earlier
     * one, so documents loaded later (extensions) override earlier ones.
     */
    public void addAll(Collection<DefinitionNode> parsed) {
        for (DefinitionNode node : parsed) {
            DefinitionNode previous = nodes.get(node.getOrigin()).put(node.getId(), node);
            if (previous != null) {
                log.debug("{} {} from {} replaces the one from {}", node.getOrigin(), node.getId(),
                        node.getSourcePath(), previous.getSourcePath());
            }
        }
    }

    public Optional<DefinitionNode> find(NodeOrigin origin, String id) {
        return Optional.ofNullable(nodes.get(origin).get(id));
    }

    public Optional<DefinitionNode> findMacro(String id) {
        return find(NodeOrigin.MACRO, id);
    }

    public Optional<DefinitionNode> findComponent(String id) {
        return find(NodeOrigin.COMPONENT, id);
    }

    /**
     * All nodes of one origin, in load order.
     */
    public Collection<DefinitionNode> nodes(NodeOrigin origin) {
        return Collections.unmodifiableCollection(nodes.get(origin).values());
    }

    public boolean contains(NodeOrigin origin, String id) {
        return nodes.get(origin).containsKey(id);
    }

    /**
     * Macro and ware nodes whose kind is one of {@code kinds}, sorted by id.
     */
    public List<DefinitionNode> nodesOfKinds(Set<String> kinds) {
        return nodes.entrySet().stream()
                .filter(e -> e.getKey() != NodeOrigin.COMPONENT)
                .flatMap(e -> e.getValue().values().stream())
                .filter(node -> kinds.contains(node.getKind()))
                .sorted(Comparator.comparing(DefinitionNode::getId))
                .toList();
    }

    public int size(NodeOrigin origin) {
        return nodes.get(origin).size();
    }

    public int size() {
        return nodes.values().stream().mapToInt(Map::size).sum();
    }
}
