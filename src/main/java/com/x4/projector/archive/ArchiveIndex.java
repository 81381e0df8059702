package com.x4.projector.archive;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import lombok.Getter;

/**
 * Directory table of one archive, keyed by normalized logical path.
 */
public class ArchiveIndex {

    @Getter
    private final String source;

    @Getter
    private final int rank;

    private final Map<String, IndexEntry> entries;

    public ArchiveIndex(String source, int rank, Map<String, IndexEntry> entries) {
        this.source = source;
        this.rank = rank;
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public Optional<IndexEntry> find(String path) {
        return Optional.ofNullable(entries.get(GamePaths.normalize(path)));
    }

    /**
     * Entries in table order.
     */
    public Collection<IndexEntry> getEntries() {
        return entries.values();
    }

    public int size() {
        return entries.size();
    }

    /**
     * Total number of payload bytes the table declares.
     */
    public long getPayloadLength() {
        return entries.values().stream().mapToLong(IndexEntry::getSize).sum();
    }
}
