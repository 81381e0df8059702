package com.x4.projector.export;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.x4.projector.definition.ObjectKind;
import com.x4.projector.resolver.AttributeProfiles;
import com.x4.projector.resolver.model.ResolvedRecord;

/**
 * Documented columns of the tabular formats, id first.
 *
 * A missing attribute falls back to the profile default of the record's class,
 * then to an empty cell. Lists are joined with spaces.
 */
public final class ColumnLayout {

    private static final Map<ObjectKind, List<String>> COLUMNS = Map.of(
            ObjectKind.SHIPS, List.of("name", "class", "type", "purpose", "hull", "people", "cargobay", "storage",
                    "missile_storage", "drone_storage", "num_engines", "num_shields", "num_weapons",
                    "num_turrets", "num_countermeasures", "s_docks", "m_docks", "shipstorage_s",
                    "shipstorage_m", "launchtubes_s", "launchtubes_m", "mass", "drag_forward", "drag_reverse",
                    "drag_horizontal", "drag_vertical", "drag_pitch", "drag_yaw", "drag_roll", "inertia_pitch",
                    "inertia_yaw", "inertia_roll"),
            ObjectKind.ENGINES, List.of("name", "makerrace", "size", "hull", "thrust_forward", "thrust_reverse",
                    "thrust_strafe", "thrust_pitch", "thrust_yaw", "thrust_roll", "boost_thrust",
                    "boost_thrust_absolute", "boost_duration", "travel_thrust", "travel_thrust_absolute",
                    "travel_charge"),
            ObjectKind.SHIELDS, List.of("name", "makerrace", "size", "capacity", "recharge_rate", "recharge_delay",
                    "hull"),
            ObjectKind.WEAPONS, List.of("name", "makerrace", "size", "bullet_class", "rotation_speed",
                    "reload_rate", "reload_time", "heat_overheat", "heat_cooldelay", "heat_coolrate", "hull"),
            ObjectKind.MISSILE_LAUNCHERS, List.of("name", "makerrace", "size", "bullet_class", "capacity",
                    "ammunition", "rotation_speed", "hull"),
            ObjectKind.WARES, List.of("name", "factoryname", "group", "tags", "volume", "price_min",
                    "price_max"));

    private ColumnLayout() {
        // Utility class
    }

    /**
     * Header row, starting with {@code id}.
     */
    public static List<String> header(ObjectKind kind) {
        List<String> header = new ArrayList<>();
        header.add("id");
        header.addAll(COLUMNS.get(kind));
        return header;
    }

    /**
     * One row of plain cell values in header order.
     */
    public static List<String> row(ObjectKind kind, ResolvedRecord record) {
        List<String> row = new ArrayList<>();
        row.add(record.getId());
        for (String column : COLUMNS.get(kind)) {
            Object value = record.getAttributes().get(column);
            if (value == null) {
                value = AttributeProfiles.forKind(record.getKind())
                        .map(profile -> profile.defaultValue(column))
                        .orElse(null);
            }
            row.add(cell(value));
        }
        return row;
    }

    private static String cell(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).collect(Collectors.joining(" "));
        }
        return String.valueOf(value);
    }
}
