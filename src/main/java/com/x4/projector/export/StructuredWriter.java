package com.x4.projector.export;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.x4.projector.resolver.model.Diagnostic;
import com.x4.projector.resolver.model.ResolvedRecord;
import com.x4.projector.resolver.model.SlotRecord;

/**
 * Writes whole records, slots included, as JSON or YAML. Keys are sorted so the
 * output does not depend on resolution order. Lines end with {@code \n} on every
 * platform.
 */
class StructuredWriter {

    static final String LINE_END = "\n";

    private final ObjectWriter json = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .writer(new DefaultPrettyPrinter().withObjectIndenter(new DefaultIndenter("  ", LINE_END)));

    private final Yaml yaml;

    StructuredWriter() {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(2);
        options.setPrettyFlow(true);
        options.setLineBreak(DumperOptions.LineBreak.UNIX);
        this.yaml = new Yaml(options);
    }

    String render(ExportFormat format, List<ResolvedRecord> records) throws JsonProcessingException {
        Map<String, Object> document = new LinkedHashMap<>();
        records.stream()
                .sorted((a, b) -> a.getId().compareTo(b.getId()))
                .forEach(record -> document.put(record.getId(), tree(record)));

        return switch (format) {
            case JSON -> json.writeValueAsString(document) + LINE_END;
            case YAML -> yaml.dump(document);
            default -> throw new IllegalArgumentException(format + " is not a structured format");
        };
    }

    /**
     * Plain map form of a record: maps, lists, strings and numbers only.
     */
    static Map<String, Object> tree(ResolvedRecord record) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("kind", record.getKind());
        tree.put("attributes", sorted(record.getAttributes()));

        if (!record.getSlots().isEmpty()) {
            List<Map<String, Object>> slots = new ArrayList<>();
            for (SlotRecord slot : record.getSlots()) {
                Map<String, Object> slotTree = new LinkedHashMap<>();
                slotTree.put("attributes", sorted(slot.getAttributes()));
                slotTree.put("kind", slot.getTargetKind().orElse(null));
                slotTree.put("role", slot.getRolePath());
                slotTree.put("target", slot.getTargetId().orElse(null));
                slots.add(slotTree);
            }
            tree.put("slots", slots);
        }

        if (!record.getEntries().isEmpty()) {
            Map<String, Object> entries = new LinkedHashMap<>();
            record.getEntries().entrySet().stream()
                    .sorted(Map.Entry.comparingByKey())
                    .forEach(e -> entries.put(e.getKey(), e.getValue().stream().map(StructuredWriter::sorted).toList()));
            tree.put("entries", entries);
        }

        if (!record.getDiagnostics().isEmpty()) {
            tree.put("diagnostics", record.getDiagnostics().stream().map(Diagnostic::format).toList());
        }
        return sortedKeys(tree);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> sorted(Map<String, ?> values) {
        Map<String, Object> copy = new LinkedHashMap<>();
        new TreeMap<>(values).forEach((key, value) -> copy.put(key,
                (value instanceof Map<?, ?> nested) ? sorted((Map<String, ?>) nested) : value));
        return copy;
    }

    private static Map<String, Object> sortedKeys(Map<String, Object> values) {
        Map<String, Object> copy = new LinkedHashMap<>();
        new TreeMap<>(values).forEach(copy::put);
        return copy;
    }
}
