package com.williamcallahan.kbingest.domain;

import java.util.List;

/**
 * Counts produced by one chunk preparation run.
 *
 * @param discourseChunks forum chunks written to the store
 * @param markdownChunks markdown chunks written to the store
 * @param imageReferences image URLs written to the store
 * @param failures files that were skipped because they could not be read or parsed
 */
public record PreparationSummary(
        int discourseChunks, int markdownChunks, int imageReferences, List<SourceFileFailure> failures) {

    public PreparationSummary {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public int totalChunks() {
        return discourseChunks + markdownChunks;
    }
}
