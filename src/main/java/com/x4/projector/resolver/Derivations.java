package com.x4.projector.resolver;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.x4.projector.resolver.model.Diagnostic;
import com.x4.projector.resolver.model.DiagnosticType;
import com.x4.projector.resolver.model.SlotRecord;

/**
 * Kind-specific attributes computed once the raw overlay and the slots are
 * final, so derived values always agree with the values they come from.
 */
final class Derivations {

    private static final String SHIP_PREFIX = "ship_";

    private Derivations() {
        // Utility class
    }

    static void apply(String kind, Map<String, Object> attributes, List<SlotRecord> slots) {
        if (kind.startsWith(SHIP_PREFIX)) {
            attributes.put("class", kind.substring(SHIP_PREFIX.length()));
            aggregateShipSlots(attributes, slots);
        } else if ("engine".equals(kind)) {
            deriveAbsoluteThrust(attributes);
        }
    }

    /**
     * Engine travel and boost values are multipliers of the forward thrust.
     */
    private static void deriveAbsoluteThrust(Map<String, Object> attributes) {
        if (!(attributes.get("thrust_forward") instanceof Double forward)) {
            return;
        }
        if (attributes.get("travel_thrust") instanceof Double travel) {
            attributes.put("travel_thrust_absolute", forward * travel);
        }
        if (attributes.get("boost_thrust") instanceof Double boost) {
            attributes.put("boost_thrust_absolute", forward * boost);
        }
    }

    /**
     * Cargo, docking and launch tube capacity of a ship, summed over its
     * storage and docking bay slots at any depth.
     */
    private static void aggregateShipSlots(Map<String, Object> attributes, List<SlotRecord> slots) {
        int cargobay = 0;
        Set<String> storage = new LinkedHashSet<>();
        int droneStorage = 0;
        int shipStorageS = 0;
        int shipStorageM = 0;
        int sDocks = 0;
        int mDocks = 0;
        int launchTubesS = 0;
        int launchTubesM = 0;

        for (SlotRecord slot : slots) {
            if (slot.isPlaceholder()) {
                continue;
            }
            Map<String, Object> slotAttributes = slot.getAttributes();
            String targetId = slot.getTargetId().orElse("");

            switch (slot.getTargetKind().orElse("")) {
                case "storage" -> {
                    cargobay += intValue(slotAttributes.get("cargobay"), 0);
                    if (slotAttributes.get("storage_type") instanceof String tags) {
                        storage.addAll(tokens(tags));
                    }
                }
                case "dockingbay" -> {
                    List<String> docksize = slotAttributes.get("docksize") instanceof String tags
                            ? tokens(tags) : List.of();
                    int capacity = intValue(slotAttributes.get("dock_capacity"), 1);

                    if (intValue(slotAttributes.get("dock_storage"), 0) != 0) {
                        if (docksize.contains("dock_xs")) {
                            droneStorage += capacity;
                        }
                        if (docksize.contains("dock_s")) {
                            shipStorageS += capacity;
                        }
                        if (docksize.contains("dock_m")) {
                            shipStorageM += capacity;
                        }
                    }
                    if (targetId.startsWith("dockingbay")) {
                        if (docksize.contains("dock_s")) {
                            sDocks += capacity;
                        }
                        if (docksize.contains("dock_m")) {
                            mDocks += capacity;
                        }
                    }
                    if (targetId.startsWith("launchtube")) {
                        if (docksize.contains("dock_s")) {
                            launchTubesS += capacity;
                        }
                        if (docksize.contains("dock_m")) {
                            launchTubesM += capacity;
                        }
                    }
                }
                default -> {
                    // other equipment does not add to ship capacity
                }
            }
        }

        attributes.put("cargobay", cargobay);
        attributes.put("storage", List.copyOf(storage));
        attributes.put("drone_storage", droneStorage);
        attributes.put("shipstorage_s", shipStorageS);
        attributes.put("shipstorage_m", shipStorageM);
        attributes.put("s_docks", sDocks);
        attributes.put("m_docks", mDocks);
        attributes.put("launchtubes_s", launchTubesS);
        attributes.put("launchtubes_m", launchTubesM);
    }

    /**
     * Ware owners and licence from the kept entries, and typed production entries.
     *
     * @return typed production entries, in document order
     */
    static List<Map<String, Object>> applyWareEntries(String wareId, Map<String, Object> attributes,
                                                      Map<String, List<Map<String, String>>> entries,
                                                      List<Diagnostic> diagnostics) {
        List<String> owners = new ArrayList<>();
        for (Map<String, String> owner : entries.getOrDefault("owner", List.of())) {
            String faction = owner.get("faction");
            if (faction != null && !owners.contains(faction)) {
                owners.add(faction);
            }
        }
        attributes.put("owners", List.copyOf(owners));

        String licence = "";
        for (Map<String, String> restriction : entries.getOrDefault("restriction", List.of())) {
            if (restriction.get("licence") != null) {
                licence = restriction.get("licence");
                break;
            }
        }
        attributes.put("licence", licence);

        List<Map<String, Object>> productions = new ArrayList<>();
        for (Map<String, String> production : entries.getOrDefault("production", List.of())) {
            Map<String, Object> typed = new LinkedHashMap<>();
            Map<String, Object> consumption = new LinkedHashMap<>();
            production.forEach((key, value) -> {
                if (key.startsWith("primary.")) {
                    consumption.put(key.substring("primary.".length()),
                            coerce(AttributeType.INT, value, wareId, "production consumption " + key, diagnostics));
                } else if ("time".equals(key)) {
                    typed.put(key, coerce(AttributeType.FLOAT, value, wareId, "production time", diagnostics));
                } else if ("amount".equals(key)) {
                    typed.put(key, coerce(AttributeType.INT, value, wareId, "production amount", diagnostics));
                } else {
                    typed.put(key, value);
                }
            });
            typed.put("consumption", consumption);
            productions.add(typed);
        }
        return productions;
    }

    private static Object coerce(AttributeType type, String value, String subject, String what,
                                 List<Diagnostic> diagnostics) {
        try {
            return type.coerce(value);
        } catch (NumberFormatException | ArithmeticException e) {
            diagnostics.add(Diagnostic.warning(DiagnosticType.INVALID_VALUE, subject,
                    what + ": '" + value + "' is not a valid number, using 0"));
            return type == AttributeType.FLOAT ? (Object) 0.0 : (Object) 0;
        }
    }

    private static int intValue(Object value, int fallback) {
        return (value instanceof Integer number) ? number : fallback;
    }

    private static List<String> tokens(String tags) {
        return Arrays.stream(tags.trim().split("\\s+")).filter(t -> !t.isEmpty()).toList();
    }
}
