package com.x4.projector.lang;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import org.w3c.dom.Element;

import com.x4.projector.definition.XmlDocuments;
import com.x4.projector.definition.exception.MalformedDefinitionException;

/**
 * Texts of one language file, keyed by page id and text id.
 */
final class TextTable {

    private final Map<String, String> texts = new HashMap<>();

    /**
     * Parses {@code <language><page id=><t id=>text</t></page></language>}.
     */
    static TextTable parse(byte[] bytes, String sourcePath) {
        Element root = XmlDocuments.parse(bytes, sourcePath).getDocumentElement();
        if (!"language".equals(root.getTagName())) {
            throw new MalformedDefinitionException(sourcePath,
                    "unexpected root element <" + root.getTagName() + ">, expected <language>");
        }

        TextTable table = new TextTable();
        for (Element page : XmlDocuments.children(root, "page")) {
            String pageId = XmlDocuments.attribute(page, "id");
            if (pageId == null) {
                continue;
            }
            for (Element text : XmlDocuments.children(page, "t")) {
                String textId = XmlDocuments.attribute(text, "id");
                if (textId != null) {
                    table.texts.putIfAbsent(key(pageId.trim(), textId.trim()), text.getTextContent());
                }
            }
        }
        return table;
    }

    Optional<String> find(String pageId, String textId) {
        return Optional.ofNullable(texts.get(key(pageId, textId)));
    }

    int size() {
        return texts.size();
    }

    private static String key(String pageId, String textId) {
        return pageId + "," + textId;
    }
}
