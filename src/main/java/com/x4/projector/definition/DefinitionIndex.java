package com.x4.projector.definition;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import com.x4.projector.archive.GameFileSource;
import com.x4.projector.archive.GamePaths;
import com.x4.projector.definition.exception.MalformedDefinitionException;

/**
 * Identifier to document path lookup read from the game's index documents
 * ({@code index/macros.xml}, {@code index/components.xml}).
 *
 * Index values use backslashes and omit the {@code .xml} suffix.
 */
public class DefinitionIndex {
    private static final Logger log = LoggerFactory.getLogger(DefinitionIndex.class);

    public static final String MACRO_INDEX_PATH = "index/macros.xml";
    public static final String COMPONENT_INDEX_PATH = "index/components.xml";

    private final Map<String, String> paths = new HashMap<>();

    /**
     * Loads an index document if the file source has it. A missing document gives
     * an empty index, so only seed documents are loaded.
     */
    public static DefinitionIndex load(GameFileSource files, String indexPath) throws IOException {
        DefinitionIndex index = new DefinitionIndex();
        if (!files.exists(indexPath)) {
            log.warn("Index document {} not found, references outside the loaded documents stay unresolved",
                    indexPath);
            return index;
        }
        index.merge(files.read(indexPath), indexPath);
        return index;
    }

    /**
     * Adds the entries of one index document; later entries replace earlier ones.
     */
    public void merge(byte[] bytes, String sourcePath) {
        Element root = XmlDocuments.parse(bytes, sourcePath).getDocumentElement();
        if (!"index".equals(root.getTagName())) {
            throw new MalformedDefinitionException(sourcePath,
                    "unexpected root element <" + root.getTagName() + ">, expected <index>");
        }

        int added = 0;
        for (Element entry : XmlDocuments.children(root, "entry")) {
            String name = XmlDocuments.attribute(entry, "name");
            String value = XmlDocuments.attribute(entry, "value");
            if (name == null || value == null) {
                continue;
            }
            paths.put(name, GamePaths.normalize(value) + ".xml");
            added++;
        }
        log.debug("Loaded {} index entries from {}", added, sourcePath);
    }

    /**
     * Adds or repairs one entry.
     */
    public void put(String id, String path) {
        paths.put(id, GamePaths.normalize(path));
    }

    public Optional<String> pathOf(String id) {
        return Optional.ofNullable(paths.get(id));
    }

    public int size() {
        return paths.size();
    }
}
