package com.x4.projector.archive;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.x4.projector.archive.exception.CorruptPayloadException;
import com.x4.projector.archive.exception.NoLayersFoundException;

/**
 * Presents numbered archive pairs (01.cat/01.dat, 02.cat/02.dat, ...) as one
 * logical file tree.
 *
 * Two phases:
 * - discovery reads index tables only and builds the path to winning entry map
 *   once; for a path present in several layers the highest rank wins and lower
 *   copies are shadowed, never merged
 * - {@link #read(IndexEntry)} is the only operation touching payload bytes, and
 *   only for the winning entry; results are memoized per entry
 */
public class ArchiveOverlay implements GameFileSource {
    private static final Logger log = LoggerFactory.getLogger(ArchiveOverlay.class);

    public static final int DEFAULT_MAX_LAYERS = 99;

    private static final String INDEX_EXTENSION = ".cat";
    private static final String PAYLOAD_EXTENSION = ".dat";

    private final List<ArchiveLayer> layers;
    private final Map<Integer, ArchiveLayer> layersByRank = new HashMap<>();
    private final Map<String, IndexEntry> view = new HashMap<>();
    private final Map<String, TreeSet<String>> directories = new HashMap<>();
    private final Map<IndexEntry, byte[]> payloadCache = new ConcurrentHashMap<>();

    /**
     * Builds the overlay from already parsed layers, in any order.
     */
    public ArchiveOverlay(List<ArchiveLayer> layers) {
        List<ArchiveLayer> sorted = new ArrayList<>(layers);
        sorted.sort(Comparator.comparingInt(ArchiveLayer::getRank));
        this.layers = Collections.unmodifiableList(sorted);

        for (ArchiveLayer layer : sorted) {
            if (layersByRank.put(layer.getRank(), layer) != null) {
                throw new IllegalArgumentException("Duplicate layer rank " + layer.getRank());
            }
            for (IndexEntry entry : layer.getIndex().getEntries()) {
                view.put(entry.getPath(), entry);
                directories.computeIfAbsent(GamePaths.parent(entry.getPath()), k -> new TreeSet<>())
                        .add(entry.getPath());
            }
        }
    }

    /**
     * Probes {@code 01.cat/01.dat}, {@code 02.cat/02.dat}, ... under {@code root},
     * stopping at the first missing pair.
     */
    public static ArchiveOverlay discover(Path root, int maxLayers) throws IOException {
        return discover(root, "", maxLayers);
    }

    /**
     * Same as {@link #discover(Path, int)} with a file name prefix, e.g. {@code ext_}
     * for extension archives.
     *
     * @throws NoLayersFoundException if the rank 1 pair is absent
     */
    public static ArchiveOverlay discover(Path root, String filePrefix, int maxLayers) throws IOException {
        ArchiveIndexParser parser = new ArchiveIndexParser();
        List<ArchiveLayer> found = new ArrayList<>();

        for (int rank = 1; rank <= maxLayers; rank++) {
            String baseName = filePrefix + String.format("%02d", rank);
            Path indexFile = root.resolve(baseName + INDEX_EXTENSION);
            Path payloadFile = root.resolve(baseName + PAYLOAD_EXTENSION);

            if (!Files.isRegularFile(indexFile) || !Files.isRegularFile(payloadFile)) {
                if (rank == 1) {
                    throw new NoLayersFoundException(root, indexFile.getFileName().toString(),
                            payloadFile.getFileName().toString());
                }
                break;
            }

            log.info("Loading archive index {}", indexFile);
            ArchiveIndex index = parser.parse(indexFile, rank, Files.size(payloadFile));
            found.add(new ArchiveLayer(rank, indexFile, payloadFile, index));
        }

        log.info("Discovered {} archive layer(s) in {}", found.size(), root);
        return new ArchiveOverlay(found);
    }

    /**
     * Returns the entry of the highest ranked layer defining {@code path}.
     */
    public Optional<IndexEntry> resolve(String path) {
        return Optional.ofNullable(view.get(GamePaths.normalize(path)));
    }

    /**
     * Reads the payload of a resolved entry from its own layer.
     *
     * @throws CorruptPayloadException if the entry has a checksum and the bytes do not match it
     */
    public byte[] read(IndexEntry entry) throws IOException {
        byte[] cached = payloadCache.get(entry);
        if (cached != null) {
            return cached.clone();
        }

        ArchiveLayer layer = layersByRank.get(entry.getLayerRank());
        if (layer == null) {
            throw new IllegalArgumentException("No layer with rank " + entry.getLayerRank()
                    + " for entry " + entry.getPath());
        }

        byte[] bytes = layer.readPayload(entry);
        if (entry.getChecksum().isPresent()) {
            String actual = md5(bytes);
            if (!actual.equals(entry.getChecksum().get())) {
                throw new CorruptPayloadException(entry.getPath(), layer.getPayloadFile().toString(),
                        "checksum mismatch, index says " + entry.getChecksum().get() + " but data hashes to " + actual);
            }
        }

        payloadCache.putIfAbsent(entry, bytes);
        return bytes.clone();
    }

    @Override
    public boolean exists(String path) {
        return view.containsKey(GamePaths.normalize(path));
    }

    @Override
    public byte[] read(String path) throws IOException {
        IndexEntry entry = resolve(path).orElseThrow(() -> new NoSuchFileException(path));
        return read(entry);
    }

    @Override
    public List<String> list(String directory) {
        TreeSet<String> files = directories.get(GamePaths.normalize(directory));
        return (files == null) ? List.of() : List.copyOf(files);
    }

    /**
     * Layers from lowest to highest rank.
     */
    public List<ArchiveLayer> getLayers() {
        return layers;
    }

    /**
     * Number of distinct logical paths across all layers.
     */
    public int size() {
        return view.size();
    }

    @Override
    public void close() throws IOException {
        IOException failure = null;
        for (ArchiveLayer layer : layers) {
            try {
                layer.close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        payloadCache.clear();
        if (failure != null) {
            throw failure;
        }
    }

    private static String md5(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
