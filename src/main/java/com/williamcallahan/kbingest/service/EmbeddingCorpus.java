package com.williamcallahan.kbingest.service;

import com.williamcallahan.kbingest.domain.EmbeddingArtifact;
import com.williamcallahan.kbingest.domain.EmbeddingVector;
import com.williamcallahan.kbingest.domain.OutputRecord;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Accumulates accepted records as three position-aligned sequences.
 *
 * <p>All vectors share the length of the first accepted one. {@link #append(OutputRecord)} extends all three
 * sequences or none of them.</p>
 */
public class EmbeddingCorpus {
    private final List<String> contents = new ArrayList<>();
    private final List<EmbeddingVector> embeddings = new ArrayList<>();
    private final List<String> provenanceUrls = new ArrayList<>();
    private int dimensions;
    private int rejectedCount;

    /**
     * Appends a record unless its vector length disagrees with the corpus.
     *
     * @param outputRecord record to add
     * @return true when appended, false when rejected for a dimension mismatch
     */
    public synchronized boolean append(OutputRecord outputRecord) {
        Objects.requireNonNull(outputRecord, "outputRecord");
        int vectorLength = outputRecord.embedding().dimensions();
        if (vectorLength == 0 || (dimensions != 0 && vectorLength != dimensions)) {
            rejectedCount++;
            return false;
        }
        if (dimensions == 0) {
            dimensions = vectorLength;
        }
        contents.add(outputRecord.content());
        embeddings.add(outputRecord.embedding());
        provenanceUrls.add(outputRecord.provenanceUrl());
        return true;
    }

    public synchronized int size() {
        return contents.size();
    }

    /**
     * Returns the shared vector length, or zero before the first append.
     */
    public synchronized int dimensions() {
        return dimensions;
    }

    public synchronized int rejectedCount() {
        return rejectedCount;
    }

    public synchronized List<String> contents() {
        return List.copyOf(contents);
    }

    public synchronized List<EmbeddingVector> embeddings() {
        return List.copyOf(embeddings);
    }

    public synchronized List<String> provenanceUrls() {
        return List.copyOf(provenanceUrls);
    }

    /**
     * Snapshots the corpus into its persisted shape.
     */
    public synchronized EmbeddingArtifact toArtifact(Instant savedAt) {
        List<float[]> vectors = new ArrayList<>(embeddings.size());
        for (EmbeddingVector vector : embeddings) {
            vectors.add(vector.values());
        }
        return new EmbeddingArtifact(contents, vectors, provenanceUrls, dimensions, savedAt);
    }
}
