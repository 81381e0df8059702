package com.x4.projector.resolver.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Flattened attributes of one exportable object after inheritance, component and
 * connection resolution. Never changed once built.
 */
@Value
@Builder(toBuilder = true)
public class ResolvedRecord {

    @NonNull
    String id;

    /**
     * Macro class, or {@code ware}.
     */
    @NonNull
    String kind;

    /**
     * Typed attribute values (Integer, Double, String or List of String), in
     * profile order followed by passed-through raw keys.
     */
    @Singular
    Map<String, Object> attributes;

    @Singular
    List<SlotRecord> slots;

    /**
     * Ordered entries kept from the definition (ware productions, owners).
     */
    @Singular
    Map<String, List<Map<String, Object>>> entries;

    @Singular
    List<Diagnostic> diagnostics;

    public Optional<Object> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }
}
