package com.williamcallahan.kbingest.service.ingestion;

import com.williamcallahan.kbingest.domain.SourceFileFailure;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of preparing a single source file.
 */
public sealed interface SourceFileOutcome
        permits SourceFileOutcome.Processed, SourceFileOutcome.Skipped, SourceFileOutcome.Failed {

    /**
     * Returns the number of chunks written for the file.
     */
    int chunkCount();

    /**
     * Returns the number of image references written for the file.
     */
    int imageCount();

    /**
     * Returns a typed failure when the file could not be read or parsed.
     */
    Optional<SourceFileFailure> failure();

    static SourceFileOutcome processedFile(int chunkCount, int imageCount) {
        return new Processed(chunkCount, imageCount);
    }

    /**
     * Returns a skipped outcome for files that parsed but contributed nothing.
     */
    static SourceFileOutcome skippedFile(String reason) {
        return new Skipped(reason);
    }

    static SourceFileOutcome failedFile(SourceFileFailure failure) {
        Objects.requireNonNull(failure, "failure");
        return new Failed(failure);
    }

    record Processed(int chunkCount, int imageCount) implements SourceFileOutcome {
        @Override
        public Optional<SourceFileFailure> failure() {
            return Optional.empty();
        }
    }

    record Skipped(String reason) implements SourceFileOutcome {
        @Override
        public int chunkCount() {
            return 0;
        }

        @Override
        public int imageCount() {
            return 0;
        }

        @Override
        public Optional<SourceFileFailure> failure() {
            return Optional.empty();
        }
    }

    record Failed(SourceFileFailure detail) implements SourceFileOutcome {
        public Failed {
            Objects.requireNonNull(detail, "detail");
        }

        @Override
        public int chunkCount() {
            return 0;
        }

        @Override
        public int imageCount() {
            return 0;
        }

        @Override
        public Optional<SourceFileFailure> failure() {
            return Optional.of(detail());
        }
    }
}
