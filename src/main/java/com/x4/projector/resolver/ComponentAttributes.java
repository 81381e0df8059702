package com.x4.projector.resolver;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.x4.projector.definition.model.ConnectionRef;
import com.x4.projector.definition.model.DefinitionNode;

/**
 * Attributes read from a macro's component: the mount size of equipment and the
 * mount point counts of ships.
 */
final class ComponentAttributes {
    private static final Logger log = LoggerFactory.getLogger(ComponentAttributes.class);

    private static final Pattern SIZE_TAG =
            Pattern.compile("\\b(spacesuit|extrasmall|small|medium|large|extralarge)\\b");

    private ComponentAttributes() {
        // Utility class
    }

    static Map<String, Object> derive(DefinitionNode component) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        String kind = component.getKind();
        String name = component.getId();

        if (kind.startsWith("ship_")) {
            attributes.put("num_engines", countTagged(component, "engine"));
            attributes.put("num_shields", countTagged(component, "shield"));
            attributes.put("num_weapons", countTagged(component, "weapon"));
            attributes.put("num_turrets", countTagged(component, "turret"));
            attributes.put("num_countermeasures", countTagged(component, "countermeasures"));
            return attributes;
        }

        mountTag(kind, name)
                .flatMap(tag -> size(component, tag))
                .ifPresent(size -> attributes.put("size", size));
        return attributes;
    }

    private static Optional<String> mountTag(String kind, String name) {
        return switch (kind) {
            case "shieldgenerator" -> Optional.of("shield");
            case "engine" -> {
                if (name.startsWith("engine_")) {
                    yield Optional.of("engine");
                }
                if (name.startsWith("thruster_")) {
                    yield Optional.of("thruster");
                }
                // generic engine components carry no size
                yield Optional.empty();
            }
            case "weapon", "bomblauncher" -> Optional.of("weapon");
            case "turret" -> Optional.of("turret");
            case "missilelauncher", "missileturret" -> Optional.of("missile");
            default -> Optional.empty();
        };
    }

    private static Optional<String> size(DefinitionNode component, String tag) {
        String size = null;
        for (ConnectionRef connection : component.getConnections()) {
            if (!connection.hasTag(tag)) {
                continue;
            }
            Matcher matcher = SIZE_TAG.matcher(connection.getTags());
            if (!matcher.find()) {
                continue;
            }
            if (size == null) {
                size = matcher.group(1);
            } else {
                log.warn("Component {} has more than one sized {} connection, using {}",
                        component.getId(), tag, size);
                break;
            }
        }
        if (size == null) {
            log.debug("Cannot determine {} size for component {}", tag, component.getId());
        }
        return Optional.ofNullable(size);
    }

    private static int countTagged(DefinitionNode component, String tag) {
        return (int) component.getConnections().stream().filter(c -> c.hasTag(tag)).count();
    }
}
