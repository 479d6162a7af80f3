package com.williamcallahan.kbingest.service;

import com.williamcallahan.kbingest.domain.EmbeddingVector;
import com.williamcallahan.kbingest.support.Sleeper;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps the remote model service with throttling and bounded retries.
 *
 * <p>Every attempt first passes through the shared {@link RequestRateLimiter}. Failed attempts are retried
 * after {@code initialBackoff * 2^attempt} (attempt counted from zero) until the attempt budget is spent;
 * the last failure yields an empty result instead of an exception.</p>
 */
public class RetryingServiceClient {
    private static final Logger EMBEDDING_LOG = LoggerFactory.getLogger("EMBEDDING");

    private static final int MAX_LOGGED_ITEM_CHARS = 60;

    private final RemoteModelClient modelClient;
    private final ImageFetcher imageFetcher;
    private final RequestRateLimiter rateLimiter;
    private final int embedMaxAttempts;
    private final int captionMaxAttempts;
    private final Duration initialBackoff;
    private final String captionPrompt;
    private final Sleeper sleeper;

    public RetryingServiceClient(
            RemoteModelClient modelClient,
            ImageFetcher imageFetcher,
            RequestRateLimiter rateLimiter,
            int embedMaxAttempts,
            int captionMaxAttempts,
            Duration initialBackoff,
            String captionPrompt,
            Sleeper sleeper) {
        this.modelClient = Objects.requireNonNull(modelClient, "modelClient");
        this.imageFetcher = Objects.requireNonNull(imageFetcher, "imageFetcher");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        if (embedMaxAttempts <= 0 || captionMaxAttempts <= 0) {
            throw new IllegalArgumentException("Attempt budgets must be positive");
        }
        this.embedMaxAttempts = embedMaxAttempts;
        this.captionMaxAttempts = captionMaxAttempts;
        this.initialBackoff = Objects.requireNonNull(initialBackoff, "initialBackoff");
        this.captionPrompt = Objects.requireNonNull(captionPrompt, "captionPrompt");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Embeds a text, retrying failed attempts.
     *
     * @param content text to embed
     * @return the vector, or empty when every attempt failed
     */
    public Optional<EmbeddingVector> embedText(String content) {
        return callWithRetry("EMBEDDING", abbreviate(content), embedMaxAttempts, () -> modelClient.embed(content));
    }

    /**
     * Downloads an image and asks the multimodal model to describe it. Download errors, non-success
     * statuses and blank captions all count as failed attempts.
     *
     * @param imageUrl image location
     * @return caption text, or empty when every attempt failed
     */
    public Optional<String> captionImage(String imageUrl) {
        return callWithRetry("CAPTION", imageUrl, captionMaxAttempts, () -> imageFetcher.fetch(imageUrl)
                .flatMap(payload -> modelClient.caption(payload, captionPrompt))
                .flatMap(RetryingServiceClient::requireCaptionText));
    }

    private <T> Optional<T> callWithRetry(
            String operation, String item, int maxAttempts, Supplier<RemoteCallResult<T>> attemptCall) {
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            rateLimiter.acquire();
            RemoteCallResult<T> result = attemptCall.get();
            if (result instanceof RemoteCallResult.Success<T> success) {
                return Optional.of(success.value());
            }
            RemoteCallResult.Failure<T> failure = (RemoteCallResult.Failure<T>) result;
            if (failure.cause() != null) {
                EMBEDDING_LOG.debug("[{}] Failure cause for {}", operation, item, failure.cause());
            }
            if (attempt + 1 >= maxAttempts) {
                EMBEDDING_LOG.error("[{}] Attempt {}/{} failed for {}: {}. Giving up.",
                        operation, attempt + 1, maxAttempts, item, failure.reason());
                return Optional.empty();
            }
            Duration backoff = backoffFor(attempt);
            EMBEDDING_LOG.warn("[{}] Attempt {}/{} failed for {}: {}. Retrying in {}ms",
                    operation, attempt + 1, maxAttempts, item, failure.reason(), backoff.toMillis());
            sleepBeforeRetry(backoff);
        }
        return Optional.empty();
    }

    Duration backoffFor(int attempt) {
        return initialBackoff.multipliedBy(1L << attempt);
    }

    private void sleepBeforeRetry(Duration backoff) {
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Retry backoff interrupted", interruptedException);
        }
    }

    private static RemoteCallResult<String> requireCaptionText(String caption) {
        if (caption == null || caption.isBlank()) {
            return RemoteCallResult.failure("Caption was blank");
        }
        return RemoteCallResult.success(caption.strip());
    }

    private static String abbreviate(String content) {
        if (content == null) {
            return "<null>";
        }
        String singleLine = content.replace('\n', ' ').replace('\r', ' ');
        if (singleLine.length() <= MAX_LOGGED_ITEM_CHARS) {
            return "'" + singleLine + "'";
        }
        return "'" + singleLine.substring(0, MAX_LOGGED_ITEM_CHARS) + "...'";
    }
}
