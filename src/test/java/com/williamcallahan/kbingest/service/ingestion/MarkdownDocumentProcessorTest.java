package com.williamcallahan.kbingest.service.ingestion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.vladsch.flexmark.parser.Parser;
import com.williamcallahan.kbingest.domain.ChunkRecord;
import com.williamcallahan.kbingest.domain.ImageReference;
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

class MarkdownDocumentProcessorTest {

    private static final String DOCUMENT = """
            <!-- source_url: https://tds.s-anand.net/#/docker -->

            # Docker basics

            Containers **package** an application with `docker build` and its [runtime](https://docs.docker.com).

            ![architecture](https://img.example/docker.png)

            ```bash
            docker run hello-world
            ```
            """;

    @TempDir
    Path tempDir;

    private SqliteChunkStore store;
    private MarkdownDocumentProcessor processor;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource("jdbc:sqlite:" + tempDir.resolve("kb.db"));
        dataSource.setDriverClassName("org.sqlite.JDBC");
        store = new SqliteChunkStore(new JdbcTemplate(dataSource));
        store.createTables();
        processor = new MarkdownDocumentProcessor(new Chunker(1000, 200), store);
    }

    @Test
    void storesProseChunksAndImageReferences() throws IOException {
        Path file = tempDir.resolve("docker.md");
        Files.writeString(file, DOCUMENT);

        SourceFileOutcome outcome = processor.process(file);

        assertEquals(1, outcome.chunkCount());
        assertEquals(1, outcome.imageCount());
        List<ChunkRecord> chunks = store.loadTextChunks();
        ChunkRecord chunk = chunks.get(0);
        assertEquals("https://tds.s-anand.net/#/docker", chunk.provenanceUrl());
        assertTrue(chunk.content().startsWith("Docker basics Containers package an application with"));
        assertFalse(chunk.content().contains("docker build"));
        assertFalse(chunk.content().contains("hello-world"));
        assertFalse(chunk.content().contains("runtime"));
        assertFalse(chunk.content().contains("source_url"));
        assertFalse(chunk.content().contains("**"));
        assertEquals(List.of(new ImageReference("https://img.example/docker.png")), store.loadImageReferences());
    }

    @Test
    void missingSourceCommentYieldsEmptyUrl() {
        assertEquals("", MarkdownDocumentProcessor.extractSourceUrl("# Title\n\nText"));
        assertEquals("https://x.test/#/a",
                MarkdownDocumentProcessor.extractSourceUrl("<!--   source_url:   https://x.test/#/a   -->\n"));
    }

    @Test
    void proseKeepsInlineEmphasisTextWithoutExtraSpaces() {
        String prose = MarkdownDocumentProcessor.extractProse(
                Parser.builder().build().parse("Use *snake_case* names, then **commit**.\n\n- one\n- two\n"));

        assertEquals("Use snake_case names, then commit. one two", prose);
    }

    @Test
    void documentWithOnlyCodeIsSkipped() throws IOException {
        Path file = tempDir.resolve("code.md");
        Files.writeString(file, "```\nprint(1)\n```\n");

        assertInstanceOf(SourceFileOutcome.Skipped.class, processor.process(file));
    }
}
