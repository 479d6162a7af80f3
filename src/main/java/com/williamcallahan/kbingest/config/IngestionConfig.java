package com.williamcallahan.kbingest.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.kbingest.service.Chunker;
import com.williamcallahan.kbingest.service.HttpImageFetcher;
import com.williamcallahan.kbingest.service.ImageFetcher;
import com.williamcallahan.kbingest.service.IngestionOrchestrator;
import com.williamcallahan.kbingest.service.OpenAiCompatibleModelClient;
import com.williamcallahan.kbingest.service.RemoteModelClient;
import com.williamcallahan.kbingest.service.RequestRateLimiter;
import com.williamcallahan.kbingest.service.RetryingServiceClient;
import com.williamcallahan.kbingest.store.EmbeddingArtifactStore;
import com.williamcallahan.kbingest.store.SqliteChunkStore;
import com.williamcallahan.kbingest.support.Sleeper;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the embedding pipeline.
 *
 * <p>The rate limiter is a singleton shared by the embed and caption paths so both draw from one quota.</p>
 */
@Configuration
public class IngestionConfig {
    private static final Logger log = LoggerFactory.getLogger(IngestionConfig.class);
    private static final Duration IMAGE_DOWNLOAD_TIMEOUT = Duration.ofSeconds(30);

    @Bean
    public Chunker chunker(AppProperties appProperties) {
        AppProperties.Chunking chunking = appProperties.getChunking();
        return new Chunker(chunking.getSize(), chunking.getOverlap());
    }

    /**
     * Creates the client for the configured OpenAI-compatible endpoint.
     */
    @Bean
    public OpenAiCompatibleModelClient remoteModelClient(AppProperties appProperties) {
        RemoteModel remote = Objects.requireNonNull(appProperties, "appProperties").getRemote();
        log.info("[EMBEDDING] Using remote OpenAI-compatible provider (urlId={}, embeddingModel={}, captionModel={})",
                Integer.toHexString(Objects.hashCode(remote.getServerUrl())),
                remote.getEmbeddingModel(),
                remote.getCaptionModel());
        return OpenAiCompatibleModelClient.create(
                remote.getServerUrl(),
                remote.getApiKey(),
                remote.getEmbeddingModel(),
                remote.getEmbeddingTaskType(),
                remote.getCaptionModel());
    }

    @Bean
    public ImageFetcher imageFetcher() {
        return new HttpImageFetcher(IMAGE_DOWNLOAD_TIMEOUT);
    }

    @Bean
    public RequestRateLimiter requestRateLimiter(AppProperties appProperties) {
        AppProperties.RateLimit rateLimit = appProperties.getRateLimit();
        return new RequestRateLimiter(rateLimit.getRequestsPerSecond(), rateLimit.getRequestsPerMinute());
    }

    @Bean
    public RetryingServiceClient retryingServiceClient(
            RemoteModelClient remoteModelClient,
            ImageFetcher imageFetcher,
            RequestRateLimiter requestRateLimiter,
            AppProperties appProperties) {
        AppProperties.Retry retry = appProperties.getRetry();
        return new RetryingServiceClient(
                remoteModelClient,
                imageFetcher,
                requestRateLimiter,
                retry.getEmbedMaxAttempts(),
                retry.getCaptionMaxAttempts(),
                retry.getInitialBackoff(),
                appProperties.getRemote().getCaptionPrompt(),
                Sleeper.SYSTEM);
    }

    @Bean
    public EmbeddingArtifactStore embeddingArtifactStore(ObjectMapper objectMapper, AppProperties appProperties) {
        return new EmbeddingArtifactStore(objectMapper, Path.of(appProperties.getOutput().getArtifactPath()));
    }

    @Bean
    public IngestionOrchestrator ingestionOrchestrator(
            SqliteChunkStore chunkStore,
            RetryingServiceClient retryingServiceClient,
            EmbeddingArtifactStore embeddingArtifactStore) {
        return new IngestionOrchestrator(
                chunkStore, chunkStore, retryingServiceClient, embeddingArtifactStore, Clock.systemUTC());
    }
}
