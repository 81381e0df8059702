package com.x4.projector.definition;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;

import com.x4.projector.definition.exception.MalformedDefinitionException;
import com.x4.projector.definition.model.ConnectionRef;
import com.x4.projector.definition.model.DefinitionNode;
import com.x4.projector.definition.model.NodeOrigin;

/**
 * Parser for game definition documents: macro files ({@code <macros>}),
 * component files ({@code <components>}) and the ware library ({@code <wares>}).
 *
 * Parsing only:
 * - Builds one {@link DefinitionNode} per definition
 * - Keeps property values as raw strings
 * - Keeps references as identifiers
 *
 * It does NOT follow references into other documents, so documents can be parsed
 * in any order.
 */
public class DefinitionDocumentParser {
    private static final Logger log = LoggerFactory.getLogger(DefinitionDocumentParser.class);

    public static final String WARE_KIND = "ware";

    /**
     * Parses one document.
     *
     * @throws MalformedDefinitionException on invalid markup, a definition without
     *         its identifier or class, or an identifier defined twice
     */
    public List<DefinitionNode> parse(byte[] bytes, String sourcePath) {
        Document document = XmlDocuments.parse(bytes, sourcePath);
        Element root = document.getDocumentElement();

        List<DefinitionNode> nodes = switch (root.getTagName()) {
            case "macros" -> parseMacros(root, sourcePath);
            case "components" -> parseComponents(root, sourcePath);
            case "wares" -> parseWares(root, sourcePath);
            default -> throw new MalformedDefinitionException(sourcePath,
                    "unexpected root element <" + root.getTagName() + ">");
        };

        if (nodes.isEmpty()) {
            log.warn("No definitions found in {}", sourcePath);
        }
        log.debug("Parsed {} definition(s) from {}", nodes.size(), sourcePath);
        return nodes;
    }

    private List<DefinitionNode> parseMacros(Element root, String sourcePath) {
        List<DefinitionNode> nodes = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (Element macro : XmlDocuments.children(root, "macro")) {
            String name = required(macro, "name", "macro", sourcePath);
            String kind = required(macro, "class", "macro " + name, sourcePath).trim();
            checkUnique(seen, name, sourcePath);

            DefinitionNode.DefinitionNodeBuilder builder = DefinitionNode.builder()
                    .id(name)
                    .kind(kind)
                    .origin(NodeOrigin.MACRO)
                    .extendsId(blankToNull(XmlDocuments.attribute(macro, "extends")))
                    .sourcePath(sourcePath);

            List<Element> components = XmlDocuments.children(macro, "component");
            if (components.size() > 1) {
                log.warn("Macro {} in {} has {} <component> nodes, using the first", name, sourcePath,
                        components.size());
            }
            if (!components.isEmpty()) {
                builder.componentRef(blankToNull(XmlDocuments.attribute(components.get(0), "ref")));
            }

            List<Element> propertyNodes = XmlDocuments.children(macro, "properties");
            if (propertyNodes.size() > 1) {
                log.warn("Macro {} in {} has {} <properties> nodes, using the first", name, sourcePath,
                        propertyNodes.size());
            }
            if (!propertyNodes.isEmpty()) {
                Map<String, String> properties = new LinkedHashMap<>();
                for (Element child : XmlDocuments.children(propertyNodes.get(0))) {
                    flattenProperties(child, child.getTagName(), properties, name, sourcePath);
                }
                builder.properties(properties);
            }

            for (Element connections : XmlDocuments.children(macro, "connections")) {
                for (Element connection : XmlDocuments.children(connections, "connection")) {
                    String role = XmlDocuments.attribute(connection, "ref");
                    if (role == null) {
                        continue;
                    }
                    for (Element target : XmlDocuments.children(connection, "macro")) {
                        String ref = blankToNull(XmlDocuments.attribute(target, "ref"));
                        if (ref != null) {
                            builder.connection(ConnectionRef.builder().role(role).targetId(ref).build());
                        }
                    }
                }
            }

            nodes.add(builder.build());
        }
        return nodes;
    }

    private List<DefinitionNode> parseComponents(Element root, String sourcePath) {
        List<DefinitionNode> nodes = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (Element component : XmlDocuments.children(root, "component")) {
            String name = required(component, "name", "component", sourcePath);
            // some components carry stray whitespace in their class
            String kind = required(component, "class", "component " + name, sourcePath).trim();
            checkUnique(seen, name, sourcePath);

            DefinitionNode.DefinitionNodeBuilder builder = DefinitionNode.builder()
                    .id(name)
                    .kind(kind)
                    .origin(NodeOrigin.COMPONENT)
                    .sourcePath(sourcePath);

            for (Element connections : XmlDocuments.children(component, "connections")) {
                for (Element connection : XmlDocuments.children(connections, "connection")) {
                    String role = XmlDocuments.attribute(connection, "name");
                    if (role == null) {
                        continue;
                    }
                    String tags = XmlDocuments.attribute(connection, "tags");
                    builder.connection(ConnectionRef.builder()
                            .role(role)
                            .tags(tags == null ? "" : tags)
                            .build());
                }
            }

            nodes.add(builder.build());
        }
        return nodes;
    }

    private List<DefinitionNode> parseWares(Element root, String sourcePath) {
        List<DefinitionNode> nodes = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (Element ware : XmlDocuments.children(root, "ware")) {
            String id = required(ware, "id", "ware", sourcePath);
            checkUnique(seen, id, sourcePath);

            DefinitionNode.DefinitionNodeBuilder builder = DefinitionNode.builder()
                    .id(id)
                    .kind(WARE_KIND)
                    .origin(NodeOrigin.WARE)
                    .sourcePath(sourcePath);

            Map<String, String> properties = new LinkedHashMap<>();
            attributes(ware).forEach((key, value) -> {
                if (!"id".equals(key)) {
                    properties.put(key, value);
                }
            });

            List<Map<String, String>> productions = new ArrayList<>();
            List<Map<String, String>> owners = new ArrayList<>();
            List<Map<String, String>> restrictions = new ArrayList<>();

            for (Element child : XmlDocuments.children(ware)) {
                switch (child.getTagName()) {
                    case "production" -> productions.add(parseProduction(child));
                    case "owner" -> owners.add(attributes(child));
                    case "restriction" -> restrictions.add(attributes(child));
                    default -> flattenProperties(child, child.getTagName(), properties, id, sourcePath);
                }
            }

            builder.properties(properties);
            if (!productions.isEmpty()) {
                builder.entry("production", productions);
            }
            if (!owners.isEmpty()) {
                builder.entry("owner", owners);
            }
            if (!restrictions.isEmpty()) {
                builder.entry("restriction", restrictions);
            }
            nodes.add(builder.build());
        }
        return nodes;
    }

    /**
     * Production attributes plus one {@code primary.<ware>} key per consumed ware.
     */
    private Map<String, String> parseProduction(Element production) {
        Map<String, String> values = attributes(production);
        for (Element primary : XmlDocuments.children(production, "primary")) {
            for (Element input : XmlDocuments.children(primary, "ware")) {
                String inputWare = XmlDocuments.attribute(input, "ware");
                if (inputWare != null) {
                    String amount = XmlDocuments.attribute(input, "amount");
                    values.put("primary." + inputWare, amount == null ? "" : amount);
                }
            }
        }
        return values;
    }

    private void flattenProperties(Element element, String path, Map<String, String> into,
                                   String ownerId, String sourcePath) {
        attributes(element).forEach((attribute, value) -> {
            String key = path + "." + attribute;
            if (into.putIfAbsent(key, value) != null) {
                log.warn("Repeated property {} in {} ({}), keeping the first value", key, ownerId, sourcePath);
            }
        });
        for (Element child : XmlDocuments.children(element)) {
            flattenProperties(child, path + "." + child.getTagName(), into, ownerId, sourcePath);
        }
    }

    private static Map<String, String> attributes(Element element) {
        Map<String, String> values = new LinkedHashMap<>();
        NamedNodeMap attributes = element.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            Attr attr = (Attr) attributes.item(i);
            values.put(attr.getName(), attr.getValue());
        }
        return values;
    }

    private static String required(Element element, String attribute, String what, String sourcePath) {
        String value = XmlDocuments.attribute(element, attribute);
        if (value == null || value.isBlank()) {
            throw new MalformedDefinitionException(sourcePath, what + " without '" + attribute + "' attribute");
        }
        return value;
    }

    private static void checkUnique(Set<String> seen, String id, String sourcePath) {
        if (!seen.add(id)) {
            throw new MalformedDefinitionException(sourcePath, "duplicate identifier " + id);
        }
    }

    private static String blankToNull(String value) {
        return (value == null || value.isBlank()) ? null : value.trim();
    }
}
