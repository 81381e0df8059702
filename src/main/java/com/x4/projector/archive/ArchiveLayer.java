package com.x4.projector.archive;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.x4.projector.archive.exception.CorruptPayloadException;

import lombok.Getter;

/**
 * One ranked archive: an index table plus the payload file it describes.
 *
 * The payload channel is opened on the first read and shared by later reads;
 * positional reads keep it safe for concurrent callers.
 */
public class ArchiveLayer implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(ArchiveLayer.class);

    @Getter
    private final int rank;

    @Getter
    private final Path indexFile;

    @Getter
    private final Path payloadFile;

    @Getter
    private final ArchiveIndex index;

    private FileChannel channel;

    public ArchiveLayer(int rank, Path indexFile, Path payloadFile, ArchiveIndex index) {
        this.rank = rank;
        this.indexFile = Objects.requireNonNull(indexFile, "indexFile");
        this.payloadFile = Objects.requireNonNull(payloadFile, "payloadFile");
        this.index = Objects.requireNonNull(index, "index");
    }

    /**
     * Reads exactly the bytes of one entry of this layer.
     */
    public byte[] readPayload(IndexEntry entry) throws IOException {
        if (entry.getLayerRank() != rank) {
            throw new IllegalArgumentException("Entry " + entry.getPath() + " belongs to layer "
                    + entry.getLayerRank() + ", not " + rank);
        }
        if (entry.getSize() > Integer.MAX_VALUE) {
            throw new CorruptPayloadException(entry.getPath(), payloadFile.toString(),
                    "entry size " + entry.getSize() + " exceeds the readable maximum");
        }

        ByteBuffer buffer = ByteBuffer.allocate((int) entry.getSize());
        FileChannel ch = channel();
        long position = entry.getOffset();
        while (buffer.hasRemaining()) {
            int read = ch.read(buffer, position);
            if (read < 0) {
                throw new CorruptPayloadException(entry.getPath(), payloadFile.toString(),
                        "payload ends after " + buffer.position() + " of " + entry.getSize() + " bytes");
            }
            position += read;
        }

        log.debug("Read {} bytes of {} from layer {}", entry.getSize(), entry.getPath(), rank);
        return buffer.array();
    }

    private synchronized FileChannel channel() throws IOException {
        if (channel == null) {
            channel = FileChannel.open(payloadFile, StandardOpenOption.READ);
        }
        return channel;
    }

    @Override
    public synchronized void close() throws IOException {
        if (channel != null) {
            channel.close();
            channel = null;
        }
    }

    @Override
    public String toString() {
        return "ArchiveLayer[" + rank + ": " + indexFile.getFileName() + "]";
    }
}
