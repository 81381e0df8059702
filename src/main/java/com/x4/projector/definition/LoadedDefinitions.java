package com.x4.projector.definition;

import java.util.List;

import com.x4.projector.definition.model.DefinitionGraph;

/**
 * Outcome of one loading pass: the session graph plus the documents that were
 * skipped on the way.
 */
public record LoadedDefinitions(DefinitionGraph graph, List<SkippedDocument> skipped) {

    public LoadedDefinitions {
        skipped = List.copyOf(skipped);
    }
}
