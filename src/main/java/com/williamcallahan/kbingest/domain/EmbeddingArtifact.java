package com.williamcallahan.kbingest.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Persisted shape of an embedding run: three position-aligned sequences.
 *
 * @param chunks embedded texts
 * @param embeddings vectors, one per chunk
 * @param sourceUrls provenance URLs, one per chunk
 * @param dimensions shared vector length, zero when the corpus is empty
 * @param savedAt write timestamp
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EmbeddingArtifact(
        @JsonProperty("chunks") List<String> chunks,
        @JsonProperty("embeddings") List<float[]> embeddings,
        @JsonProperty("source_urls") List<String> sourceUrls,
        @JsonProperty("dimensions") int dimensions,
        @JsonProperty("savedAt") Instant savedAt) {

    public EmbeddingArtifact {
        chunks = List.copyOf(Objects.requireNonNull(chunks, "chunks"));
        embeddings = List.copyOf(Objects.requireNonNull(embeddings, "embeddings"));
        sourceUrls = List.copyOf(Objects.requireNonNull(sourceUrls, "sourceUrls"));
        if (chunks.size() != embeddings.size() || chunks.size() != sourceUrls.size()) {
            throw new IllegalArgumentException("Artifact sequences must have equal length: chunks="
                    + chunks.size() + ", embeddings=" + embeddings.size() + ", sourceUrls=" + sourceUrls.size());
        }
    }

    public int size() {
        return chunks.size();
    }
}
