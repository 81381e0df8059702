package com.x4.projector.resolver.model;

import java.util.Map;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Summary of one macro reachable through a record's connections.
 *
 * A slot whose target could not be resolved is kept as a placeholder: it has the
 * target id but no kind and no attributes.
 */
@Value
@Builder(toBuilder = true)
public class SlotRecord {

    /**
     * Connection roles from the record down to this slot, joined with '/'.
     */
    @NonNull
    String rolePath;

    String targetId;

    String targetKind;

    @Singular
    Map<String, Object> attributes;

    public static SlotRecord placeholder(String rolePath, String targetId) {
        return SlotRecord.builder().rolePath(rolePath).targetId(targetId).build();
    }

    public Optional<String> getTargetId() {
        return Optional.ofNullable(targetId);
    }

    public Optional<String> getTargetKind() {
        return Optional.ofNullable(targetKind);
    }

    public boolean isPlaceholder() {
        return targetKind == null;
    }

    /**
     * Depth below the record; direct connections are at depth 1.
     */
    public int depth() {
        return rolePath.split("/").length;
    }
}
