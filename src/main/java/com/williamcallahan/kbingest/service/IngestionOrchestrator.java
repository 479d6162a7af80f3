package com.williamcallahan.kbingest.service;

import com.williamcallahan.kbingest.domain.ChunkRecord;
import com.williamcallahan.kbingest.domain.EmbeddingVector;
import com.williamcallahan.kbingest.domain.ImageReference;
import com.williamcallahan.kbingest.domain.IngestionReport;
import com.williamcallahan.kbingest.domain.OutputRecord;
import com.williamcallahan.kbingest.store.ChunkSource;
import com.williamcallahan.kbingest.store.EmbeddingArtifactStore;
import com.williamcallahan.kbingest.store.ImageSource;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the embedding pipeline: a text pass over stored chunks, then an image pass that captions each image
 * and embeds the caption. Items whose embedding cannot be obtained are skipped.
 */
public class IngestionOrchestrator {
    private static final Logger INDEXING_LOG = LoggerFactory.getLogger("INDEXING");

    private final ChunkSource chunkSource;
    private final ImageSource imageSource;
    private final RetryingServiceClient serviceClient;
    private final EmbeddingArtifactStore artifactStore;
    private final Clock clock;

    public IngestionOrchestrator(
            ChunkSource chunkSource,
            ImageSource imageSource,
            RetryingServiceClient serviceClient,
            EmbeddingArtifactStore artifactStore,
            Clock clock) {
        this.chunkSource = Objects.requireNonNull(chunkSource, "chunkSource");
        this.imageSource = Objects.requireNonNull(imageSource, "imageSource");
        this.serviceClient = Objects.requireNonNull(serviceClient, "serviceClient");
        this.artifactStore = Objects.requireNonNull(artifactStore, "artifactStore");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Embeds every chunk and image, persists the corpus and reports the counts.
     *
     * @return counts for the run and the artifact location
     * @throws IOException when the artifact cannot be written
     */
    public IngestionReport run() throws IOException {
        List<ChunkRecord> chunks = chunkSource.loadTextChunks();
        List<ImageReference> images = imageSource.loadImageReferences();
        INDEXING_LOG.info("[INDEXING] Loaded {} text chunks and {} image references", chunks.size(), images.size());

        EmbeddingCorpus corpus = new EmbeddingCorpus();
        int textEmbedded = embedTextChunks(chunks, corpus);
        int imagesEmbedded = embedImages(images, corpus);

        Path artifactPath = artifactStore.write(corpus.toArtifact(clock.instant()));
        IngestionReport report = new IngestionReport(
                chunks.size(), textEmbedded, images.size(), imagesEmbedded, corpus.rejectedCount(), artifactPath);
        INDEXING_LOG.info("[INDEXING] Saved {} embeddings with source URLs to {} ({} skipped, {} dimension mismatches)",
                report.totalRecords(), artifactPath, report.skippedItems(), report.dimensionMismatches());
        return report;
    }

    private int embedTextChunks(List<ChunkRecord> chunks, EmbeddingCorpus corpus) {
        ProgressTracker progress = new ProgressTracker(chunks.size());
        int embedded = 0;
        for (ChunkRecord chunk : chunks) {
            Optional<EmbeddingVector> vector = serviceClient.embedText(chunk.content());
            boolean appended = vector.isPresent()
                    && appendOrWarn(corpus, new OutputRecord(chunk.content(), chunk.provenanceUrl(), vector.get()));
            if (appended) {
                embedded++;
            }
            logProgress("text chunks", progress, appended);
        }
        return embedded;
    }

    private int embedImages(List<ImageReference> images, EmbeddingCorpus corpus) {
        ProgressTracker progress = new ProgressTracker(images.size());
        int embedded = 0;
        for (ImageReference image : images) {
            boolean appended = false;
            Optional<String> caption = serviceClient.captionImage(image.url());
            if (caption.isPresent()) {
                Optional<EmbeddingVector> vector = serviceClient.embedText(caption.get());
                appended = vector.isPresent()
                        && appendOrWarn(corpus, OutputRecord.forImage(caption.get(), image.url(), vector.get()));
            } else {
                INDEXING_LOG.warn("[INDEXING] Skipping image without caption: {}", image.url());
            }
            if (appended) {
                embedded++;
            }
            logProgress("images", progress, appended);
        }
        return embedded;
    }

    private static boolean appendOrWarn(EmbeddingCorpus corpus, OutputRecord outputRecord) {
        if (corpus.append(outputRecord)) {
            return true;
        }
        INDEXING_LOG.warn("[INDEXING] Rejected vector of length {} (corpus uses {}) for {}",
                outputRecord.embedding().dimensions(), corpus.dimensions(), outputRecord.provenanceUrl());
        return false;
    }

    private static void logProgress(String passName, ProgressTracker progress, boolean succeeded) {
        if (progress.markProcessed(succeeded)) {
            INDEXING_LOG.info("[INDEXING] {}: {}/{} processed ({}), {} embedded",
                    passName, progress.getProcessedCount(), progress.getTotal(),
                    progress.formatPercent(), progress.getSucceededCount());
        }
    }
}
