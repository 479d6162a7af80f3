package com.williamcallahan.kbingest.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.kbingest.domain.ChunkOrigin;
import com.williamcallahan.kbingest.domain.ChunkRecord;
import com.williamcallahan.kbingest.domain.ImageReference;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

class SqliteChunkStoreTest {

    @TempDir
    Path tempDir;

    private JdbcTemplate jdbcTemplate;
    private SqliteChunkStore store;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource =
                new DriverManagerDataSource("jdbc:sqlite:" + tempDir.resolve("knowledge_base.db"));
        dataSource.setDriverClassName("org.sqlite.JDBC");
        jdbcTemplate = new JdbcTemplate(dataSource);
        store = new SqliteChunkStore(jdbcTemplate);
    }

    @Test
    void missingImageTableYieldsNoImages() {
        assertTrue(store.loadImageReferences().isEmpty());
    }

    @Test
    void readsMarkdownBeforeDiscourseInInsertionOrder() {
        store.createTables();
        store.insertDiscourseChunks(11L, 7L, List.of(
                new ChunkRecord("forum one", "https://forum/t/s/7/0", ChunkOrigin.DISCOURSE, 0)));
        store.insertMarkdownChunks("docs/a.md", List.of(
                new ChunkRecord("md one", "https://docs/a", ChunkOrigin.MARKDOWN, 0),
                new ChunkRecord("md two", "https://docs/a", ChunkOrigin.MARKDOWN, 1)));

        List<ChunkRecord> chunks = store.loadTextChunks();

        assertEquals(List.of("md one", "md two", "forum one"), chunks.stream().map(ChunkRecord::content).toList());
        assertEquals(ChunkOrigin.MARKDOWN, chunks.get(0).origin());
        assertEquals(ChunkOrigin.DISCOURSE, chunks.get(2).origin());
        assertEquals(1, chunks.get(1).sequenceIndex());
        assertEquals("https://forum/t/s/7/0", chunks.get(2).provenanceUrl());
    }

    @Test
    void rowsWithoutContentOrWithNegativeIndexAreSkipped() {
        store.createTables();
        jdbcTemplate.update("INSERT INTO markdown_chunks (file_path, chunk_index, content, source_url) "
                + "VALUES ('a.md', 0, 'good one', 'u'), ('a.md', 1, NULL, 'u'), ('a.md', 2, 'good two', 'u')");
        jdbcTemplate.update("INSERT INTO discourse_chunks (post_id, topic_id, chunk_index, content, source_url) "
                + "VALUES (1, 2, -1, 'bad index', 'u'), (1, 2, 0, '   ', 'u')");

        List<ChunkRecord> chunks = store.loadTextChunks();

        assertEquals(List.of("good one", "good two"), chunks.stream().map(ChunkRecord::content).toList());
        assertEquals(2, chunks.get(1).sequenceIndex());
    }

    @Test
    void storesDiscourseIdentifiers() {
        store.createTables();
        store.insertDiscourseChunks(42L, null, List.of(
                new ChunkRecord("text", "url", ChunkOrigin.DISCOURSE, 3)));

        assertEquals(42L, jdbcTemplate.queryForObject("SELECT post_id FROM discourse_chunks", Long.class));
        assertEquals(3, jdbcTemplate.queryForObject("SELECT chunk_index FROM discourse_chunks", Integer.class));
    }

    @Test
    void imageReferencesSkipBlankUrls() {
        store.createTables();
        store.insertImageReferences("docs/a.md", List.of("https://img/1.png", " ", "https://img/2.png"));

        List<ImageReference> images = store.loadImageReferences();

        assertEquals(List.of(new ImageReference("https://img/1.png"), new ImageReference("https://img/2.png")), images);
    }

    @Test
    void clearAllEmptiesEveryTable() {
        store.createTables();
        store.insertMarkdownChunks("docs/a.md", List.of(new ChunkRecord("md", "u", ChunkOrigin.MARKDOWN, 0)));
        store.insertImageReferences("docs/a.md", List.of("https://img/1.png"));

        store.clearAll();

        assertTrue(store.loadTextChunks().isEmpty());
        assertTrue(store.loadImageReferences().isEmpty());
    }
}
