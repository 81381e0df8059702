package com.x4.projector.archive;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.x4.projector.archive.exception.MalformedIndexException;

/**
 * Parser for archive index (.cat) files.
 *
 * Format, one entry per line:
 * - {@code <path> <size> <timestamp> <md5>}
 * - {@code <path> <size> <timestamp>} (no checksum, integrity check skipped)
 *
 * Paths may contain spaces, so fields are read from the right. Payload offsets
 * are not stored: each entry starts where the previous one ends.
 *
 * Parsing only, no payload I/O.
 */
public class ArchiveIndexParser {
    private static final Logger log = LoggerFactory.getLogger(ArchiveIndexParser.class);

    private static final Pattern MD5_PATTERN = Pattern.compile("^[0-9a-fA-F]{32}$");
    private static final Pattern NUMBER_PATTERN = Pattern.compile("^\\d+$");

    /**
     * Parses an index file and checks it against the length of its payload file.
     *
     * @throws MalformedIndexException if the table is not valid UTF-8 or fails the checks of
     *         {@link #parse(List, String, int, long)}
     */
    public ArchiveIndex parse(Path indexFile, int rank, long payloadLength) throws IOException {
        String source = indexFile.toString();
        List<String> lines = decodeLines(Files.readAllBytes(indexFile), source);
        return parse(lines, source, rank, payloadLength);
    }

    /**
     * Parses index lines in a single linear scan.
     *
     * @param payloadLength length of the payload file, or a negative value to skip the bounds check
     */
    public ArchiveIndex parse(List<String> lines, String source, int rank, long payloadLength) {
        Map<String, IndexEntry> entries = new LinkedHashMap<>();
        long offset = 0;

        int lineNum = 0;
        for (String line : lines) {
            lineNum++;

            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                continue;
            }

            String[] tokens = trimmed.split("\\s+");
            if (tokens.length < 3) {
                throw new MalformedIndexException(source, lineNum,
                        "expected '<path> <size> <timestamp> [<md5>]' but got '" + trimmed + "'");
            }

            int last = tokens.length - 1;
            String checksum = null;
            if (tokens.length >= 4 && MD5_PATTERN.matcher(tokens[last]).matches()) {
                checksum = tokens[last].toLowerCase(Locale.ROOT);
                last--;
            }

            String timestampField = tokens[last];
            String sizeField = tokens[last - 1];
            if (!NUMBER_PATTERN.matcher(sizeField).matches()) {
                throw new MalformedIndexException(source, lineNum, "invalid size '" + sizeField + "'");
            }
            if (!NUMBER_PATTERN.matcher(timestampField).matches()) {
                throw new MalformedIndexException(source, lineNum, "invalid timestamp '" + timestampField + "'");
            }

            String rawPath = extractPath(trimmed, tokens, last - 1);
            String path = GamePaths.normalize(rawPath);
            if (path.isEmpty()) {
                throw new MalformedIndexException(source, lineNum, "empty path '" + rawPath + "'");
            }
            if (entries.containsKey(path)) {
                throw new MalformedIndexException(source, lineNum, "duplicate path " + path);
            }

            long size;
            long timestamp;
            try {
                size = Long.parseLong(sizeField);
                timestamp = Long.parseLong(timestampField);
            } catch (NumberFormatException e) {
                throw new MalformedIndexException(source, lineNum, "number out of range: " + e.getMessage());
            }

            entries.put(path, IndexEntry.builder()
                    .path(path)
                    .offset(offset)
                    .size(size)
                    .timestamp(timestamp)
                    .checksum(checksum)
                    .layerRank(rank)
                    .build());
            offset += size;
        }

        if (payloadLength >= 0 && offset > payloadLength) {
            throw new MalformedIndexException(source, 0,
                    "entries declare " + offset + " payload bytes but the payload file has " + payloadLength);
        }

        log.debug("Parsed {} entries from {}", entries.size(), source);
        return new ArchiveIndex(source, rank, entries);
    }

    /**
     * Splits on {@code \n} and decodes each line strictly, so a bad byte is reported with its line.
     */
    static List<String> decodeLines(byte[] bytes, String source) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);

        List<String> lines = new ArrayList<>();
        int start = 0;
        while (start < bytes.length) {
            int end = start;
            while (end < bytes.length && bytes[end] != '\n') {
                end++;
            }
            try {
                lines.add(decoder.decode(ByteBuffer.wrap(bytes, start, end - start)).toString());
            } catch (CharacterCodingException e) {
                throw new MalformedIndexException(source, lines.size() + 1, "not valid UTF-8");
            }
            start = end + 1;
        }
        return lines;
    }

    /**
     * Cuts the path out of the original line so inner spacing is preserved.
     */
    private String extractPath(String line, String[] tokens, int firstNumericToken) {
        int end = line.length();
        for (int i = tokens.length - 1; i >= firstNumericToken; i--) {
            end = line.lastIndexOf(tokens[i], end - 1);
        }
        return line.substring(0, end).strip();
    }
}
