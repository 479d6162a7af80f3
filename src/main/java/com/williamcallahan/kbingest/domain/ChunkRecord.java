package com.williamcallahan.kbingest.domain;

import java.util.Objects;

/**
 * A bounded piece of source text together with the locator it came from.
 *
 * @param content chunk text, already whitespace-normalized
 * @param provenanceUrl locator carried through to the output for citation; may be empty
 * @param origin corpus the chunk was cut from
 * @param sequenceIndex position of the chunk within its source document
 */
public record ChunkRecord(String content, String provenanceUrl, ChunkOrigin origin, int sequenceIndex) {

    public ChunkRecord {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(origin, "origin");
        provenanceUrl = provenanceUrl == null ? "" : provenanceUrl;
        if (sequenceIndex < 0) {
            throw new IllegalArgumentException("sequenceIndex must not be negative");
        }
    }
}
