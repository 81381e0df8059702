package com.x4.projector.definition.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One parsed macro, component or ware definition.
 *
 * Property values are kept exactly as written in the document; typing happens in
 * the resolver. Cross-document references ({@code extendsId}, {@code componentRef},
 * connection targets) are kept as identifiers and never followed here.
 */
@Value
@Builder(toBuilder = true)
public class DefinitionNode {

    @NonNull
    String id;

    /** Macro class, e.g. engine, shieldgenerator, ship_xl, ware. */
    @NonNull
    String kind;

    @NonNull
    NodeOrigin origin;

    String extendsId;

    String componentRef;

    /** Raw property name (element path + attribute, dot separated) to raw value. */
    @Singular
    Map<String, String> properties;

    @Singular
    List<ConnectionRef> connections;

    /** Repeated child elements kept in document order, e.g. ware productions. */
    @Singular
    Map<String, List<Map<String, String>>> entries;

    String sourcePath;

    public Optional<String> getExtendsId() {
        return Optional.ofNullable(extendsId);
    }

    public Optional<String> getComponentRef() {
        return Optional.ofNullable(componentRef);
    }

    public Optional<String> property(String name) {
        return Optional.ofNullable(properties.get(name));
    }
}
