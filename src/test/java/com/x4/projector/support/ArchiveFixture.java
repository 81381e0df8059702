package com.x4.projector.support;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes archive pairs ({@code NN.cat} + {@code NN.dat}) for tests.
 */
public final class ArchiveFixture {

    public static final long TIMESTAMP = 1_600_000_000L;

    private final Path directory;
    private final String baseName;
    private final Map<String, byte[]> files = new LinkedHashMap<>();
    private boolean checksums = true;

    private ArchiveFixture(Path directory, String baseName) {
        this.directory = directory;
        this.baseName = baseName;
    }

    /**
     * A base game layer: {@code 01}, {@code 02}, ...
     */
    public static ArchiveFixture layer(Path directory, int rank) {
        return new ArchiveFixture(directory, String.format("%02d", rank));
    }

    /**
     * An extension layer: {@code ext_01}, {@code ext_02}, ...
     */
    public static ArchiveFixture extensionLayer(Path directory, int rank) {
        return new ArchiveFixture(directory, String.format("ext_%02d", rank));
    }

    public ArchiveFixture file(String path, String content) {
        files.put(path, content.getBytes(StandardCharsets.UTF_8));
        return this;
    }

    public ArchiveFixture files(Map<String, String> contents) {
        contents.forEach(this::file);
        return this;
    }

    public ArchiveFixture withoutChecksums() {
        this.checksums = false;
        return this;
    }

    /**
     * @return the payload file
     */
    public Path write() throws IOException {
        Files.createDirectories(directory);
        StringBuilder index = new StringBuilder();
        ByteArrayOutputStream payload = new ByteArrayOutputStream();

        for (Map.Entry<String, byte[]> file : files.entrySet()) {
            index.append(file.getKey()).append(' ')
                    .append(file.getValue().length).append(' ')
                    .append(TIMESTAMP);
            if (checksums) {
                index.append(' ').append(md5(file.getValue()));
            }
            index.append('\n');
            payload.write(file.getValue());
        }

        Files.writeString(directory.resolve(baseName + ".cat"), index.toString());
        Path payloadFile = directory.resolve(baseName + ".dat");
        Files.write(payloadFile, payload.toByteArray());
        return payloadFile;
    }

    public static String md5(byte[] bytes) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("MD5").digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
