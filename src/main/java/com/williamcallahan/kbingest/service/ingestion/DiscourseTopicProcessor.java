package com.williamcallahan.kbingest.service.ingestion;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.kbingest.config.AppProperties;
import com.williamcallahan.kbingest.domain.ChunkOrigin;
import com.williamcallahan.kbingest.domain.ChunkRecord;
import com.williamcallahan.kbingest.domain.SourceFileFailure;
import com.williamcallahan.kbingest.service.Chunker;
import com.williamcallahan.kbingest.store.SqliteChunkStore;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns one saved Discourse topic into forum chunks.
 *
 * <p>Expected file shape: {@code {"source_url": ..., "post_data": {"id", "slug", "post_stream":
 * {"posts": [{"id", "cooked"}]}}}}. Each chunk links back to {@code {base}/t/{slug}/{topicId}/{chunkIndex}}, with
 * {@value #MISSING_TOPIC_ID} standing in for an absent topic id.</p>
 */
@Service
public class DiscourseTopicProcessor {
    private static final Logger log = LoggerFactory.getLogger(DiscourseTopicProcessor.class);

    /** Topic id used in URLs and rows when the topic JSON carries none. */
    static final long MISSING_TOPIC_ID = -1L;

    private final ObjectMapper objectMapper;
    private final Chunker chunker;
    private final SqliteChunkStore chunkStore;
    private final String baseUrl;
    private final int minPostLength;

    public DiscourseTopicProcessor(
            ObjectMapper objectMapper, Chunker chunker, SqliteChunkStore chunkStore, AppProperties appProperties) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.chunker = Objects.requireNonNull(chunker, "chunker");
        this.chunkStore = Objects.requireNonNull(chunkStore, "chunkStore");
        AppProperties.Sources sources = appProperties.getSources();
        this.baseUrl = stripTrailingSlash(sources.getDiscourseBaseUrl());
        this.minPostLength = sources.getMinPostLength();
    }

    /**
     * Parses, cleans, chunks and stores every post of a topic file.
     *
     * @param topicFile JSON topic dump
     * @return processed counts, a skip when no post was long enough, or a failure for unusable files
     */
    public SourceFileOutcome process(Path topicFile) {
        JsonNode root;
        try {
            root = objectMapper.readTree(topicFile.toFile());
        } catch (IOException parseFailure) {
            log.warn("[PREPARE] Skipping unreadable topic file {}: {}", topicFile, parseFailure.getMessage());
            return SourceFileOutcome.failedFile(
                    new SourceFileFailure(topicFile.toString(), "parse", String.valueOf(parseFailure.getMessage())));
        }
        JsonNode postData = root == null ? null : root.get("post_data");
        if (postData == null || !postData.isObject()) {
            log.warn("[PREPARE] Skipping topic file without post_data: {}", topicFile);
            return SourceFileOutcome.failedFile(
                    new SourceFileFailure(topicFile.toString(), "parse", "missing post_data object"));
        }

        long topicId = postData.hasNonNull("id") ? postData.get("id").asLong() : MISSING_TOPIC_ID;
        String slug = postData.path("slug").asText("");
        int storedChunks = 0;
        for (JsonNode post : postData.path("post_stream").path("posts")) {
            String text = extractText(post.path("cooked").asText(""));
            if (text.length() < minPostLength) {
                continue;
            }
            Long postId = post.hasNonNull("id") ? post.get("id").asLong() : null;
            List<String> pieces = chunker.split(text);
            List<ChunkRecord> records = new ArrayList<>(pieces.size());
            for (int chunkIndex = 0; chunkIndex < pieces.size(); chunkIndex++) {
                records.add(new ChunkRecord(
                        pieces.get(chunkIndex),
                        topicUrl(slug, topicId, chunkIndex),
                        ChunkOrigin.DISCOURSE,
                        chunkIndex));
            }
            chunkStore.insertDiscourseChunks(postId, topicId, records);
            storedChunks += records.size();
        }

        if (storedChunks == 0) {
            return SourceFileOutcome.skippedFile("no post reached " + minPostLength + " characters");
        }
        log.debug("[PREPARE] {} -> {} chunks", topicFile.getFileName(), storedChunks);
        return SourceFileOutcome.processedFile(storedChunks, 0);
    }

    /**
     * Converts rendered post HTML to plain text with normalized whitespace.
     */
    static String extractText(String cookedHtml) {
        if (cookedHtml == null || cookedHtml.isBlank()) {
            return "";
        }
        Document document = Jsoup.parse(cookedHtml);
        document.select("script, style").remove();
        return document.text().trim();
    }

    private String topicUrl(String slug, long topicId, int chunkIndex) {
        return baseUrl + "/t/" + slug + "/" + topicId + "/" + chunkIndex;
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        String trimmed = url.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
