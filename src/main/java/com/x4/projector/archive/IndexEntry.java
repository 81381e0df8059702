package com.x4.projector.archive;

import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One file listed in an archive index: where its bytes live in the paired payload
 * file and, when the index carries one, the MD5 of those bytes.
 *
 * Pure structure only.
 */
@Value
@Builder(toBuilder = true)
public class IndexEntry {

    /** Normalized logical path. */
    @NonNull
    String path;

    long offset;

    long size;

    long timestamp;

    /** Lower case hex MD5, or null when the index omits it. */
    String checksum;

    /** Rank of the layer that owns this entry. */
    int layerRank;

    public Optional<String> getChecksum() {
        return Optional.ofNullable(checksum);
    }
}
