package com.x4.projector.definition;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Exportable object categories, the macro classes each one exports, and where
 * their seed documents live.
 */
public enum ObjectKind {

    ENGINES("engines", Set.of("engine"), List.of(
            DocumentLocation.directory("assets/props/engines/macros", "engine_", "thruster_"))),

    SHIELDS("shields", Set.of("shieldgenerator"), List.of(
            DocumentLocation.directory("assets/props/surfaceelements/macros", "shield_"))),

    SHIPS("ships", Set.of("ship_xs", "ship_s", "ship_m", "ship_l", "ship_xl"), List.of(
            DocumentLocation.directory("assets/units/size_xs/macros"),
            DocumentLocation.directory("assets/units/size_s/macros"),
            DocumentLocation.directory("assets/units/size_m/macros"),
            DocumentLocation.directory("assets/units/size_l/macros"),
            DocumentLocation.directory("assets/units/size_xl/macros"))),

    WEAPONS("weapons", Set.of("weapon", "turret", "bomblauncher"), weaponLocations()),

    MISSILE_LAUNCHERS("missilelaunchers", Set.of("missilelauncher", "missileturret"), missileLauncherLocations()),

    WARES("wares", Set.of(DefinitionDocumentParser.WARE_KIND), List.of(
            DocumentLocation.file("libraries/wares.xml")));

    private final String cliName;
    private final Set<String> macroClasses;
    private final List<DocumentLocation> locations;

    ObjectKind(String cliName, Set<String> macroClasses, List<DocumentLocation> locations) {
        this.cliName = cliName;
        this.macroClasses = macroClasses;
        this.locations = locations;
    }

    public String getCliName() {
        return cliName;
    }

    public Set<String> getMacroClasses() {
        return macroClasses;
    }

    public List<DocumentLocation> getLocations() {
        return locations;
    }

    /**
     * Case-insensitive lookup by command line name.
     */
    public static Optional<ObjectKind> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String wanted = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(kind -> kind.cliName.equals(wanted)).findFirst();
    }

    private static List<DocumentLocation> weaponLocations() {
        String[] prefixes = {"weapon_", "turret_", "spacesuit_gen_laser_", "spacesuit_gen_repairweapon_"};
        return List.of(
                DocumentLocation.directory("assets/props/weaponsystems/capital/macros", prefixes),
                DocumentLocation.directory("assets/props/weaponsystems/heavy/macros", prefixes),
                DocumentLocation.directory("assets/props/weaponsystems/mining/macros", prefixes),
                DocumentLocation.directory("assets/props/weaponsystems/standard/macros", prefixes),
                DocumentLocation.directory("assets/props/weaponsystems/spacesuit/macros", prefixes),
                DocumentLocation.directory("assets/props/weaponsystems/energy/macros", prefixes),
                DocumentLocation.directory("assets/props/weaponsystems/xref_parts/macros", prefixes),
                DocumentLocation.directory("assets/fx/weaponfx/macros", "bullet_"));
    }

    private static List<DocumentLocation> missileLauncherLocations() {
        String[] prefixes = {"weapon_", "turret_", "spacesuit_gen_bomblauncher_"};
        return List.of(
                DocumentLocation.directory("assets/props/weaponsystems/dumbfire/macros", prefixes),
                DocumentLocation.directory("assets/props/weaponsystems/guided/macros", prefixes),
                DocumentLocation.directory("assets/props/weaponsystems/torpedo/macros", prefixes),
                DocumentLocation.directory("assets/props/weaponsystems/spacesuit/macros", prefixes),
                DocumentLocation.directory("assets/props/weaponsystems/missile/macros", "missile_"),
                DocumentLocation.directory("assets/fx/weaponfx/macros", "bomb_"));
    }
}
