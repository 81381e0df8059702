package com.x4.projector.resolver;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.x4.projector.resolver.model.Diagnostic;
import com.x4.projector.resolver.model.DiagnosticType;

/**
 * Maps the raw properties of one macro class to documented, typed attributes.
 *
 * Only declared values become attributes; an attribute nothing in the
 * inheritance chain declares stays absent. Defaults fill values that fail to
 * coerce, and the tabular exporters use them for empty cells.
 */
public class AttributeProfile {

    private final String name;
    private final List<AttributeSpec> specs;

    private AttributeProfile(String name, List<AttributeSpec> specs) {
        this.name = name;
        this.specs = List.copyOf(specs);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public Optional<AttributeSpec> spec(String attributeName) {
        return specs.stream().filter(spec -> spec.name().equals(attributeName)).findFirst();
    }

    /**
     * Default for an attribute, null when the profile has none.
     */
    public Object defaultValue(String attributeName) {
        return spec(attributeName)
                .map(spec -> spec.type().defaultOrEmpty(spec.defaultValue()))
                .orElse(null);
    }

    /**
     * Typed attributes in profile order, then the raw keys no spec reads, unchanged.
     *
     * @param subject macro id used in diagnostics
     */
    public Map<String, Object> apply(Map<String, String> raw, String subject, List<Diagnostic> diagnostics) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        Set<String> consumed = new HashSet<>();

        for (AttributeSpec spec : specs) {
            String value = null;
            for (String key : spec.rawKeys()) {
                consumed.add(key);
                if (value == null && raw.get(key) != null) {
                    value = raw.get(key);
                }
            }
            if (value == null) {
                continue;
            }

            try {
                attributes.put(spec.name(), spec.type().coerce(value));
            } catch (NumberFormatException | ArithmeticException e) {
                diagnostics.add(Diagnostic.warning(DiagnosticType.INVALID_VALUE, subject,
                        "attribute " + spec.name() + ": '" + value + "' is not a valid "
                                + spec.type().name().toLowerCase(Locale.ROOT)
                                + (spec.defaultValue() == null ? ", dropped" : ", using " + spec.defaultValue())));
                if (spec.defaultValue() != null) {
                    attributes.put(spec.name(), spec.defaultValue());
                }
            }
        }

        raw.forEach((key, value) -> {
            if (!consumed.contains(key)) {
                attributes.putIfAbsent(key, value);
            }
        });
        return attributes;
    }

    public static final class Builder {
        private final String name;
        private final List<AttributeSpec> specs = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder integer(String attribute, Integer defaultValue, String... rawKeys) {
            specs.add(new AttributeSpec(attribute, AttributeType.INT, defaultValue, List.of(rawKeys)));
            return this;
        }

        public Builder decimal(String attribute, Double defaultValue, String... rawKeys) {
            specs.add(new AttributeSpec(attribute, AttributeType.FLOAT, defaultValue, List.of(rawKeys)));
            return this;
        }

        public Builder string(String attribute, String... rawKeys) {
            specs.add(new AttributeSpec(attribute, AttributeType.STRING, null, List.of(rawKeys)));
            return this;
        }

        public Builder list(String attribute, String... rawKeys) {
            specs.add(new AttributeSpec(attribute, AttributeType.LIST, null, List.of(rawKeys)));
            return this;
        }

        /**
         * Adds every spec of another profile, e.g. the shared identification block.
         */
        public Builder include(AttributeProfile other) {
            specs.addAll(other.specs);
            return this;
        }

        public AttributeProfile build() {
            return new AttributeProfile(name, specs);
        }
    }
}
