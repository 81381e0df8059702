package com.x4.projector.resolver;

import java.util.List;

/**
 * One documented attribute: its name, type, default and the raw property keys it
 * is read from, in fallback order.
 */
public record AttributeSpec(String name, AttributeType type, Object defaultValue, List<String> rawKeys) {

    public AttributeSpec {
        rawKeys = List.copyOf(rawKeys);
    }
}
