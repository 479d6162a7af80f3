package com.williamcallahan.kbingest.domain;

import java.util.Objects;

/**
 * One accepted entry of the embedding corpus.
 *
 * @param content embedded text, or {@code "[IMAGE] " + caption} for image-derived entries
 * @param provenanceUrl chunk source URL or image URL
 * @param embedding vector produced for {@code content}
 */
public record OutputRecord(String content, String provenanceUrl, EmbeddingVector embedding) {
    private static final String IMAGE_PREFIX = "[IMAGE] ";

    public OutputRecord {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(embedding, "embedding");
        provenanceUrl = provenanceUrl == null ? "" : provenanceUrl;
    }

    /**
     * Builds the entry for a captioned image.
     */
    public static OutputRecord forImage(String caption, String imageUrl, EmbeddingVector embedding) {
        return new OutputRecord(IMAGE_PREFIX + caption, imageUrl, embedding);
    }
}
