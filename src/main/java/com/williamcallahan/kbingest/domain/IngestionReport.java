package com.williamcallahan.kbingest.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Summarizes one embedding run so the CLI can print a final tally.
 *
 * @param textChunksSeen text chunks read from the chunk source
 * @param textRecordsEmbedded text chunks that produced an output record
 * @param imagesSeen image references read from the image source
 * @param imageRecordsEmbedded images that were captioned and embedded
 * @param dimensionMismatches vectors rejected because their length disagreed with the corpus
 * @param artifactPath location of the persisted artifact
 */
public record IngestionReport(
        int textChunksSeen,
        int textRecordsEmbedded,
        int imagesSeen,
        int imageRecordsEmbedded,
        int dimensionMismatches,
        Path artifactPath) {

    public IngestionReport {
        Objects.requireNonNull(artifactPath, "artifactPath");
    }

    public int totalRecords() {
        return textRecordsEmbedded + imageRecordsEmbedded;
    }

    public int skippedItems() {
        return (textChunksSeen - textRecordsEmbedded) + (imagesSeen - imageRecordsEmbedded);
    }
}
