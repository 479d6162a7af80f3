package com.williamcallahan.kbingest.domain;

import java.util.Objects;

/**
 * Captures a single source file that preparation had to skip, with phase context so triage is faster.
 *
 * @param filePath file path as seen by the processor
 * @param phase preparation phase that failed
 * @param details failure details for diagnostics
 */
public record SourceFileFailure(String filePath, String phase, String details) {

    public SourceFileFailure {
        if (filePath == null || filePath.isBlank()) {
            throw new IllegalArgumentException("File path is required");
        }
        if (phase == null || phase.isBlank()) {
            throw new IllegalArgumentException("Failure phase is required");
        }
        Objects.requireNonNull(details, "Failure details are required");
    }
}
