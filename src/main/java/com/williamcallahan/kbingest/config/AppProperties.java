package com.williamcallahan.kbingest.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.Locale;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {
    private static final String POSITIVE_FMT = "%s must be greater than 0.";

    private Chunking chunking = new Chunking();
    private RateLimit rateLimit = new RateLimit();
    private Retry retry = new Retry();
    private RemoteModel remote = new RemoteModel();
    private Sources sources = new Sources();
    private Output output = new Output();

    /**
     * Rejects settings that would make a run hang or misbehave before any item is processed.
     *
     * @throws IllegalArgumentException when a numeric setting is out of range
     */
    @PostConstruct
    public void validateConfiguration() {
        requirePositive("app.chunking.size", chunking.getSize());
        if (chunking.getOverlap() < 0 || chunking.getOverlap() >= chunking.getSize()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT,
                    "app.chunking.overlap must be in [0, %d) but was %d.", chunking.getSize(), chunking.getOverlap()));
        }
        requirePositive("app.rate-limit.requests-per-second", rateLimit.getRequestsPerSecond());
        requirePositive("app.rate-limit.requests-per-minute", rateLimit.getRequestsPerMinute());
        requirePositive("app.retry.embed-max-attempts", retry.getEmbedMaxAttempts());
        requirePositive("app.retry.caption-max-attempts", retry.getCaptionMaxAttempts());
        if (retry.getInitialBackoff() == null || retry.getInitialBackoff().isNegative()) {
            throw new IllegalArgumentException("app.retry.initial-backoff must not be negative.");
        }
        requirePositive("app.sources.min-post-length", sources.getMinPostLength());
        remote.validateConfiguration();
    }

    private static void requirePositive(String propertyKey, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, propertyKey));
        }
    }

    public Chunking getChunking() {
        return chunking;
    }

    public void setChunking(Chunking chunking) {
        this.chunking = chunking;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(RateLimit rateLimit) {
        this.rateLimit = rateLimit;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public RemoteModel getRemote() {
        return remote;
    }

    public void setRemote(RemoteModel remote) {
        this.remote = remote;
    }

    public Sources getSources() {
        return sources;
    }

    public void setSources(Sources sources) {
        this.sources = sources;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
    }

    public static class Chunking {
        private int size = 1000;
        private int overlap = 200;

        public int getSize() {
            return size;
        }

        public void setSize(int size) {
            this.size = size;
        }

        public int getOverlap() {
            return overlap;
        }

        public void setOverlap(int overlap) {
            this.overlap = overlap;
        }
    }

    public static class RateLimit {
        private int requestsPerSecond = 2;
        private int requestsPerMinute = 60;

        public int getRequestsPerSecond() { return requestsPerSecond; }
        public void setRequestsPerSecond(int requestsPerSecond) { this.requestsPerSecond = requestsPerSecond; }

        public int getRequestsPerMinute() { return requestsPerMinute; }
        public void setRequestsPerMinute(int requestsPerMinute) { this.requestsPerMinute = requestsPerMinute; }
    }

    public static class Retry {
        private int embedMaxAttempts = 3;
        private int captionMaxAttempts = 2;
        private Duration initialBackoff = Duration.ofSeconds(1);

        public int getEmbedMaxAttempts() { return embedMaxAttempts; }
        public void setEmbedMaxAttempts(int embedMaxAttempts) { this.embedMaxAttempts = embedMaxAttempts; }

        public int getCaptionMaxAttempts() { return captionMaxAttempts; }
        public void setCaptionMaxAttempts(int captionMaxAttempts) { this.captionMaxAttempts = captionMaxAttempts; }

        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }
    }

    public static class Sources {
        private String markdownDir = "data/tools-in-data-science-public";
        private String markdownBaseUrl = "https://tds.s-anand.net/#/";
        private String discourseDir = "data/discourse_posts";
        private String discourseBaseUrl = "https://discourse.onlinedegree.iitm.ac.in";
        private int minPostLength = 20;

        public String getMarkdownDir() { return markdownDir; }
        public void setMarkdownDir(String markdownDir) { this.markdownDir = markdownDir; }

        public String getMarkdownBaseUrl() { return markdownBaseUrl; }
        public void setMarkdownBaseUrl(String markdownBaseUrl) { this.markdownBaseUrl = markdownBaseUrl; }

        public String getDiscourseDir() { return discourseDir; }
        public void setDiscourseDir(String discourseDir) { this.discourseDir = discourseDir; }

        public String getDiscourseBaseUrl() { return discourseBaseUrl; }
        public void setDiscourseBaseUrl(String discourseBaseUrl) { this.discourseBaseUrl = discourseBaseUrl; }

        public int getMinPostLength() { return minPostLength; }
        public void setMinPostLength(int minPostLength) { this.minPostLength = minPostLength; }
    }

    public static class Output {
        private String artifactPath = "data/embeddings.json.gz";

        public String getArtifactPath() { return artifactPath; }
        public void setArtifactPath(String artifactPath) { this.artifactPath = artifactPath; }
    }
}
