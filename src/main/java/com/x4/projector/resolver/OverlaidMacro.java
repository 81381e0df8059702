package com.x4.projector.resolver;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.x4.projector.definition.model.ConnectionRef;
import com.x4.projector.resolver.model.Diagnostic;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A macro with its whole {@code extends} chain applied: raw properties, the
 * effective component and the connections, child values winning.
 */
@Value
@Builder
class OverlaidMacro {

    @NonNull
    String id;

    @NonNull
    String kind;

    @NonNull
    Map<String, String> properties;

    @NonNull
    List<ConnectionRef> connections;

    String componentId;

    /**
     * Problems found along the chain, e.g. an ancestor that is not loaded.
     */
    @NonNull
    List<Diagnostic> diagnostics;

    Optional<String> getComponentId() {
        return Optional.ofNullable(componentId);
    }
}
