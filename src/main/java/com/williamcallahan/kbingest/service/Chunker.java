package com.williamcallahan.kbingest.service;

import com.williamcallahan.kbingest.domain.ChunkOrigin;
import com.williamcallahan.kbingest.domain.ChunkRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits text into fixed-size character windows that overlap by a constant amount.
 */
public class Chunker {
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private final int chunkSize;
    private final int overlap;

    public Chunker(int chunkSize, int overlap) {
        validateWindow(chunkSize, overlap);
        this.chunkSize = chunkSize;
        this.overlap = overlap;
    }

    /**
     * Splits with the configured window.
     */
    public List<String> split(String text) {
        return split(text, chunkSize, overlap);
    }

    /**
     * Collapses whitespace, then cuts windows of {@code chunkSize} characters starting every
     * {@code chunkSize - overlap} characters. The last window may be shorter.
     *
     * @param text raw text; null or blank yields an empty list
     * @param chunkSize maximum characters per window
     * @param overlap characters shared by consecutive windows
     * @return ordered windows
     * @throws IllegalArgumentException when the window parameters are inconsistent
     */
    public static List<String> split(String text, int chunkSize, int overlap) {
        validateWindow(chunkSize, overlap);
        if (text == null) {
            return List.of();
        }
        String normalized = WHITESPACE_RUN.matcher(text).replaceAll(" ").trim();
        if (normalized.isEmpty()) {
            return List.of();
        }
        if (normalized.length() <= chunkSize) {
            return List.of(normalized);
        }
        int step = chunkSize - overlap;
        List<String> chunks = new ArrayList<>();
        for (int start = 0; start < normalized.length(); start += step) {
            int end = Math.min(start + chunkSize, normalized.length());
            chunks.add(normalized.substring(start, end));
        }
        return chunks;
    }

    /**
     * Splits with the configured window and tags each piece with its provenance.
     */
    public List<ChunkRecord> chunkRecords(String text, String provenanceUrl, ChunkOrigin origin) {
        List<String> pieces = split(text);
        List<ChunkRecord> records = new ArrayList<>(pieces.size());
        for (int index = 0; index < pieces.size(); index++) {
            records.add(new ChunkRecord(pieces.get(index), provenanceUrl, origin, index));
        }
        return records;
    }

    public int chunkSize() {
        return chunkSize;
    }

    public int overlap() {
        return overlap;
    }

    private static void validateWindow(int chunkSize, int overlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive but was " + chunkSize);
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new IllegalArgumentException(
                    "overlap must be in [0, " + chunkSize + ") but was " + overlap);
        }
    }
}
