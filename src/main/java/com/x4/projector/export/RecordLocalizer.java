package com.x4.projector.export;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.x4.projector.lang.LanguageResolver;
import com.x4.projector.resolver.model.ResolvedRecord;
import com.x4.projector.resolver.model.SlotRecord;

/**
 * Replaces text placeholders in the human readable attributes of records, their
 * slots and their production entries. Records are copied, never changed.
 */
public class RecordLocalizer {

    static final Set<String> LOCALIZED_ATTRIBUTES = Set.of("name", "description", "factoryname");

    private final LanguageResolver languages;

    public RecordLocalizer(LanguageResolver languages) {
        this.languages = languages;
    }

    public ResolvedRecord localize(ResolvedRecord record) {
        List<SlotRecord> slots = record.getSlots().stream()
                .map(slot -> slot.toBuilder().clearAttributes().attributes(localize(slot.getAttributes())).build())
                .toList();

        Map<String, List<Map<String, Object>>> entries = new LinkedHashMap<>();
        record.getEntries().forEach((name, values) -> {
            List<Map<String, Object>> localized = new ArrayList<>();
            values.forEach(value -> localized.add(localize(value)));
            entries.put(name, localized);
        });

        return record.toBuilder()
                .clearAttributes()
                .attributes(localize(record.getAttributes()))
                .clearSlots()
                .slots(slots)
                .clearEntries()
                .entries(entries)
                .build();
    }

    private Map<String, Object> localize(Map<String, Object> attributes) {
        Map<String, Object> localized = new LinkedHashMap<>(attributes);
        for (String name : LOCALIZED_ATTRIBUTES) {
            if (localized.get(name) instanceof String template) {
                localized.put(name, languages.resolve(template));
            }
        }
        return localized;
    }
}
