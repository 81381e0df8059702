package com.x4.projector.resolver;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import com.x4.projector.definition.DefinitionDocumentParser;

/**
 * Attribute profiles of every macro class the resolver understands.
 *
 * Classes with an empty profile (cockpits, build modules) are known but carry
 * nothing worth exporting beyond their passed-through raw keys.
 */
public final class AttributeProfiles {

    private static final AttributeProfile IDENTIFICATION = AttributeProfile.builder("identification")
            .string("name", "identification.name")
            .string("makerrace", "identification.makerrace")
            .string("description", "identification.description")
            .build();

    private static final AttributeProfile HULL = AttributeProfile.builder("hull")
            .integer("hull", -1, "hull.max")
            .integer("hull_integrated", 0, "hull.integrated")
            .decimal("hull_threshold", 0.0, "hull.threshold")
            .build();

    private static final AttributeProfile PHYSICS = AttributeProfile.builder("physics")
            .decimal("mass", 0.0, "physics.mass")
            .decimal("inertia_pitch", 0.0, "physics.inertia.pitch")
            .decimal("inertia_yaw", 0.0, "physics.inertia.yaw")
            .decimal("inertia_roll", 0.0, "physics.inertia.roll")
            .decimal("drag_forward", 0.0, "physics.drag.forward")
            .decimal("drag_reverse", 0.0, "physics.drag.reverse")
            .decimal("drag_horizontal", 0.0, "physics.drag.horizontal")
            .decimal("drag_vertical", 0.0, "physics.drag.vertical")
            .decimal("drag_pitch", 0.0, "physics.drag.pitch")
            .decimal("drag_yaw", 0.0, "physics.drag.yaw")
            .decimal("drag_roll", 0.0, "physics.drag.roll")
            .build();

    private static final AttributeProfile SHIP = AttributeProfile.builder("ship")
            .include(IDENTIFICATION)
            .integer("hull", -1, "hull.max")
            .string("purpose", "purpose.primary")
            .string("type", "ship.type")
            .integer("people", 0, "people.capacity")
            .integer("missile_storage", 0, "storage.missile")
            .integer("gas_gatherrate", 0, "gatherrate.gas")
            .include(PHYSICS)
            .build();

    private static final AttributeProfile SPACESUIT = AttributeProfile.builder("spacesuit")
            .include(IDENTIFICATION)
            .integer("hull", -1, "hull.max")
            .decimal("mass", 0.0, "physics.mass")
            .integer("oxygen_maxtime", 0, "oxygen.maxtime")
            .integer("oxygen_warningtime", 0, "oxygen.warningtime")
            .build();

    private static final AttributeProfile STORAGE = AttributeProfile.builder("storage")
            .integer("cargobay", 0, "cargo.max")
            .string("storage_type", "cargo.tags")
            .build();

    private static final AttributeProfile ENGINE = AttributeProfile.builder("engine")
            .include(IDENTIFICATION)
            .decimal("boost_duration", 0.0, "boost.duration")
            .decimal("boost_thrust", 0.0, "boost.thrust")
            .decimal("boost_release", 0.0, "boost.release")
            .decimal("boost_attack", 0.0, "boost.attack")
            .decimal("travel_charge", 0.0, "travel.charge")
            .decimal("travel_attack", 0.0, "travel.attack")
            .decimal("travel_thrust", 0.0, "travel.thrust")
            .decimal("travel_release", 0.0, "travel.release")
            .decimal("thrust_forward", 0.0, "thrust.forward")
            .decimal("thrust_reverse", 0.0, "thrust.reverse")
            .decimal("thrust_strafe", 0.0, "thrust.strafe")
            .decimal("thrust_pitch", 0.0, "thrust.pitch")
            .decimal("thrust_yaw", 0.0, "thrust.yaw")
            .decimal("thrust_roll", 0.0, "thrust.roll")
            .decimal("angular_pitch", 0.0, "angular.pitch")
            .decimal("angular_roll", 0.0, "angular.roll")
            .include(HULL)
            .build();

    private static final AttributeProfile DOCKING_BAY = AttributeProfile.builder("dockingbay")
            .string("name", "identification.name")
            .string("description", "identification.description")
            .string("docksize", "docksize.tags")
            .integer("dock_external", 0, "dock.external")
            .integer("dock_capacity", 1, "dock.capacity")
            .integer("dock_allow", 1, "dock.allow")
            .integer("dock_storage", 0, "dock.storage")
            .build();

    private static final AttributeProfile DOCK_AREA = AttributeProfile.builder("dockarea")
            .string("name", "identification.name")
            .string("description", "identification.description")
            .build();

    private static final AttributeProfile SHIELD_GENERATOR = AttributeProfile.builder("shieldgenerator")
            .include(IDENTIFICATION)
            .integer("capacity", 0, "recharge.max")
            .decimal("recharge_rate", 0.0, "recharge.rate")
            .decimal("recharge_delay", 0.0, "recharge.delay")
            .include(HULL)
            .build();

    private static final AttributeProfile WEAPON = AttributeProfile.builder("weapon")
            .include(IDENTIFICATION)
            .string("bullet_class", "bullet.class")
            .integer("heat_overheat", 0, "heat.overheat")
            .decimal("heat_cooldelay", 0.0, "heat.cooldelay")
            .integer("heat_coolrate", 0, "heat.coolrate")
            .integer("heat_reenable", 0, "heat.reenable")
            .decimal("rotation_speed", 0.0, "rotationspeed.max")
            .decimal("rotation_accel", 0.0, "rotationacceleration.max")
            .decimal("reload_rate", 0.0, "reload.rate")
            .decimal("reload_time", 0.0, "reload.time")
            .decimal("zoom_factor", 0.0, "zoom.factor")
            .decimal("zoom_time", 0.0, "zoom.time")
            .decimal("zoom_delay", 0.0, "zoom.delay")
            .include(HULL)
            .integer("hull_hittable", 1, "hull.hittable")
            .build();

    private static final AttributeProfile BULLET = AttributeProfile.builder("bullet")
            .integer("speed", 0, "bullet.speed")
            .decimal("lifetime", 0.0, "bullet.lifetime")
            .integer("range", 0, "bullet.range")
            .integer("amount", 0, "bullet.amount")
            .integer("barrelamount", 0, "bullet.barrelamount")
            .decimal("timediff", 0.0, "bullet.timediff")
            .decimal("angle", 0.0, "bullet.angle")
            .integer("maxhits", 0, "bullet.maxhits")
            .decimal("ricochet", 0.0, "bullet.ricochet")
            .decimal("restitution", 0.0, "bullet.restitution")
            .integer("scale", 0, "bullet.scale")
            .integer("attach", 0, "bullet.attach")
            .decimal("chargetime", 0.0, "bullet.chargetime")
            .integer("heat", 0, "heat.value")
            .integer("heat_initial", 0, "heat.initial")
            .decimal("reload_rate", 0.0, "reload.rate")
            .decimal("reload_time", 0.0, "reload.time")
            // hull and shield damage fall back to the plain damage value
            .integer("dmg_hull", 0, "damage.hull", "damage.value")
            .integer("dmg_shields", 0, "damage.shield", "damage.value")
            .integer("dmg_min", -1, "damage.min")
            .integer("dmg_max", -1, "damage.max")
            .integer("dmg_repair", 0, "damage.repair")
            .decimal("dmg_delay", 0.0, "damage.delay")
            .decimal("dmg_mining_mult", 1.0, "damage.multiplier.mining")
            .build();

    private static final AttributeProfile MISSILE_LAUNCHER = AttributeProfile.builder("missilelauncher")
            .include(IDENTIFICATION)
            .string("bullet_class", "bullet.class")
            .decimal("rotation_speed", 0.0, "rotationspeed.max")
            .integer("capacity", 0, "storage.capacity")
            .string("ammunition", "ammunition.tags")
            .include(HULL)
            .integer("hull_hittable", 1, "hull.hittable")
            .build();

    private static final AttributeProfile MISSILE = AttributeProfile.builder("missile")
            .include(IDENTIFICATION)
            .integer("amount", 1, "missile.amount")
            .integer("barrelamount", 1, "missile.barrelamount")
            .decimal("lifetime", 0.0, "missile.lifetime")
            .integer("range", 0, "missile.range")
            .integer("retarget", 0, "missile.retarget")
            .integer("guided", 0, "missile.guided")
            .integer("distribute", 0, "missile.distribute")
            .integer("damage_hull", 0, "explosiondamage.hull", "explosiondamage.value")
            .integer("damage_shield", 0, "explosiondamage.shield", "explosiondamage.value")
            .decimal("reload_time", 0.0, "reload.time")
            .integer("hull", -1, "hull.max")
            .decimal("countermeasure_resilience", -1.0, "countermeasure.resilience")
            .integer("lock_time", 0, "lock.time")
            .integer("lock_range", -1, "lock.range")
            .decimal("lock_angle", -1.0, "lock.angle")
            .include(PHYSICS)
            .build();

    private static final AttributeProfile WARE = AttributeProfile.builder(DefinitionDocumentParser.WARE_KIND)
            .string("name", "name")
            .string("description", "description")
            .string("factoryname", "factoryname")
            .string("group", "group")
            .string("transport", "transport")
            .integer("volume", 0, "volume")
            .list("tags", "tags")
            .list("illegal", "illegal")
            .integer("price_min", 0, "price.min")
            .integer("price_avg", 0, "price.average")
            .integer("price_max", 0, "price.max")
            .build();

    private static final Map<String, AttributeProfile> BY_KIND = new HashMap<>();

    static {
        for (String size : new String[] {"xs", "s", "m", "l", "xl"}) {
            BY_KIND.put("ship_" + size, SHIP);
        }
        BY_KIND.put("spacesuit", SPACESUIT);
        BY_KIND.put("storage", STORAGE);
        BY_KIND.put("engine", ENGINE);
        BY_KIND.put("dockingbay", DOCKING_BAY);
        BY_KIND.put("dockarea", DOCK_AREA);
        BY_KIND.put("shieldgenerator", SHIELD_GENERATOR);
        BY_KIND.put("weapon", WEAPON);
        BY_KIND.put("turret", WEAPON);
        BY_KIND.put("bomblauncher", WEAPON);
        BY_KIND.put("bullet", BULLET);
        BY_KIND.put("missilelauncher", MISSILE_LAUNCHER);
        BY_KIND.put("missileturret", MISSILE_LAUNCHER);
        BY_KIND.put("missile", MISSILE);
        BY_KIND.put("bomb", MISSILE);
        BY_KIND.put(DefinitionDocumentParser.WARE_KIND, WARE);
        for (String inert : new String[] {"cockpit", "buildmodule", "buildprocessor", "destructible"}) {
            BY_KIND.put(inert, AttributeProfile.builder(inert).build());
        }
    }

    private AttributeProfiles() {
        // Utility class
    }

    public static Optional<AttributeProfile> forKind(String kind) {
        return Optional.ofNullable(BY_KIND.get(kind));
    }
}
