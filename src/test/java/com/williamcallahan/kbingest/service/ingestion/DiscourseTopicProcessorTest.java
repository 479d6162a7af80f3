package com.williamcallahan.kbingest.service.ingestion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.kbingest.config.AppProperties;
import com.williamcallahan.kbingest.domain.ChunkOrigin;
import com.williamcallahan.kbingest.domain.ChunkRecord;
import com.williamcallahan.kbingest.service.Chunker;
import com.williamcallahan.kbingest.store.SqliteChunkStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

class DiscourseTopicProcessorTest {

    @TempDir
    Path tempDir;

    private SqliteChunkStore store;
    private DiscourseTopicProcessor processor;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource("jdbc:sqlite:" + tempDir.resolve("kb.db"));
        dataSource.setDriverClassName("org.sqlite.JDBC");
        store = new SqliteChunkStore(new JdbcTemplate(dataSource));
        store.createTables();
        AppProperties appProperties = new AppProperties();
        appProperties.getSources().setDiscourseBaseUrl("https://forum.example/");
        processor = new DiscourseTopicProcessor(new ObjectMapper(), new Chunker(1000, 200), store, appProperties);
    }

    @Test
    void storesCleanedPostsWithTopicUrls() throws IOException {
        Path topic = tempDir.resolve("topic.json");
        Files.writeString(topic, """
                {
                  "source_url": "https://forum.example/t/grading-question/155",
                  "post_data": {
                    "id": 155,
                    "slug": "grading-question",
                    "post_stream": {
                      "posts": [
                        {"id": 1, "cooked": "<p>How is the <b>final project</b> graded this term?</p><script>track()</script>"},
                        {"id": 2, "cooked": "<p>+1</p>"}
                      ]
                    }
                  }
                }
                """);

        SourceFileOutcome outcome = processor.process(topic);

        assertEquals(1, outcome.chunkCount());
        List<ChunkRecord> chunks = store.loadTextChunks();
        assertEquals(1, chunks.size());
        ChunkRecord chunk = chunks.get(0);
        assertEquals("How is the final project graded this term?", chunk.content());
        assertEquals("https://forum.example/t/grading-question/155/0", chunk.provenanceUrl());
        assertEquals(ChunkOrigin.DISCOURSE, chunk.origin());
    }

    @Test
    void topicWithoutIdLinksToPlaceholderId() throws IOException {
        Path topic = tempDir.resolve("no-id.json");
        Files.writeString(topic, """
                {
                  "post_data": {
                    "slug": "office-hours",
                    "post_stream": {
                      "posts": [
                        {"id": 9, "cooked": "<p>Office hours move to Thursday afternoon this week.</p>"}
                      ]
                    }
                  }
                }
                """);

        processor.process(topic);

        List<ChunkRecord> chunks = store.loadTextChunks();
        assertEquals(1, chunks.size());
        assertEquals("https://forum.example/t/office-hours/-1/0", chunks.get(0).provenanceUrl());
    }

    @Test
    void malformedJsonIsReportedAsFailure() throws IOException {
        Path topic = tempDir.resolve("broken.json");
        Files.writeString(topic, "{ \"post_data\": ");

        SourceFileOutcome outcome = processor.process(topic);

        SourceFileOutcome.Failed failed = assertInstanceOf(SourceFileOutcome.Failed.class, outcome);
        assertEquals("parse", failed.detail().phase());
        assertTrue(store.loadTextChunks().isEmpty());
    }

    @Test
    void missingPostDataIsReportedAsFailure() throws IOException {
        Path topic = tempDir.resolve("empty.json");
        Files.writeString(topic, "{\"source_url\": \"https://forum.example/t/x/1\"}");

        assertTrue(processor.process(topic).failure().isPresent());
    }

    @Test
    void topicWithOnlyShortPostsIsSkipped() throws IOException {
        Path topic = tempDir.resolve("short.json");
        Files.writeString(topic, """
                {"post_data": {"id": 9, "slug": "s", "post_stream": {"posts": [{"id": 1, "cooked": "<p>thanks!</p>"}]}}}
                """);

        assertInstanceOf(SourceFileOutcome.Skipped.class, processor.process(topic));
    }

    @Test
    void extractTextDropsMarkupAndCollapsesWhitespace() {
        assertEquals("Hello world", DiscourseTopicProcessor.extractText("<div>Hello\n\n <em>world</em><style>p{}</style></div>"));
        assertEquals("", DiscourseTopicProcessor.extractText(null));
    }
}
