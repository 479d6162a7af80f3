package com.williamcallahan.kbingest.store;

import com.williamcallahan.kbingest.domain.ChunkRecord;
import java.util.List;

/**
 * Supplies pre-chunked text for embedding.
 */
public interface ChunkSource {

    /**
     * Returns markdown chunks followed by forum chunks, each group in insertion order.
     */
    List<ChunkRecord> loadTextChunks();
}
