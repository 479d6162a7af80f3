package com.williamcallahan.kbingest.store;

import com.williamcallahan.kbingest.domain.ChunkOrigin;
import com.williamcallahan.kbingest.domain.ChunkRecord;
import com.williamcallahan.kbingest.domain.ImageReference;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Repository;

/**
 * SQLite-backed chunk store written by preparation and read by the embedding run.
 */
@Repository
public class SqliteChunkStore implements ChunkSource, ImageSource {
    private static final Logger log = LoggerFactory.getLogger(SqliteChunkStore.class);

    private static final String CREATE_DISCOURSE_TABLE = """
            CREATE TABLE IF NOT EXISTS discourse_chunks (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                post_id INTEGER,
                topic_id INTEGER,
                chunk_index INTEGER,
                content TEXT,
                source_url TEXT
            )""";
    private static final String CREATE_MARKDOWN_TABLE = """
            CREATE TABLE IF NOT EXISTS markdown_chunks (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                file_path TEXT,
                chunk_index INTEGER,
                content TEXT,
                source_url TEXT
            )""";
    private static final String CREATE_IMAGE_TABLE = """
            CREATE TABLE IF NOT EXISTS image_chunks (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                file_path TEXT,
                image_url TEXT
            )""";

    private final JdbcTemplate jdbcTemplate;

    public SqliteChunkStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate");
    }

    /**
     * Creates the three chunk tables when they do not exist yet.
     */
    public void createTables() {
        jdbcTemplate.execute(CREATE_DISCOURSE_TABLE);
        jdbcTemplate.execute(CREATE_MARKDOWN_TABLE);
        jdbcTemplate.execute(CREATE_IMAGE_TABLE);
    }

    /**
     * Removes previously prepared rows so a repeated preparation run does not duplicate chunks.
     */
    public void clearAll() {
        jdbcTemplate.update("DELETE FROM discourse_chunks");
        jdbcTemplate.update("DELETE FROM markdown_chunks");
        jdbcTemplate.update("DELETE FROM image_chunks");
    }

    public void insertDiscourseChunks(Long postId, Long topicId, List<ChunkRecord> chunks) {
        if (chunks.isEmpty()) {
            return;
        }
        List<Object[]> rows = new ArrayList<>(chunks.size());
        for (ChunkRecord chunk : chunks) {
            rows.add(new Object[] {postId, topicId, chunk.sequenceIndex(), chunk.content(), chunk.provenanceUrl()});
        }
        jdbcTemplate.batchUpdate(
                "INSERT INTO discourse_chunks (post_id, topic_id, chunk_index, content, source_url) "
                        + "VALUES (?, ?, ?, ?, ?)",
                rows);
    }

    public void insertMarkdownChunks(String filePath, List<ChunkRecord> chunks) {
        if (chunks.isEmpty()) {
            return;
        }
        List<Object[]> rows = new ArrayList<>(chunks.size());
        for (ChunkRecord chunk : chunks) {
            rows.add(new Object[] {filePath, chunk.sequenceIndex(), chunk.content(), chunk.provenanceUrl()});
        }
        jdbcTemplate.batchUpdate(
                "INSERT INTO markdown_chunks (file_path, chunk_index, content, source_url) VALUES (?, ?, ?, ?)",
                rows);
    }

    public void insertImageReferences(String filePath, List<String> imageUrls) {
        if (imageUrls.isEmpty()) {
            return;
        }
        List<Object[]> rows = new ArrayList<>(imageUrls.size());
        for (String imageUrl : imageUrls) {
            rows.add(new Object[] {filePath, imageUrl});
        }
        jdbcTemplate.batchUpdate("INSERT INTO image_chunks (file_path, image_url) VALUES (?, ?)", rows);
    }

    @Override
    public List<ChunkRecord> loadTextChunks() {
        List<ChunkRecord> chunks = new ArrayList<>();
        readChunks("markdown_chunks", ChunkOrigin.MARKDOWN, chunks);
        readChunks("discourse_chunks", ChunkOrigin.DISCOURSE, chunks);
        return chunks;
    }

    /**
     * Appends the table's rows in insertion order. Rows without content or with a negative index are
     * logged and skipped so one bad row cannot abort the run.
     */
    private void readChunks(String table, ChunkOrigin origin, List<ChunkRecord> target) {
        jdbcTemplate.query("SELECT id, content, source_url, chunk_index FROM " + table + " ORDER BY id",
                (RowCallbackHandler) resultSet -> {
                    String content = resultSet.getString("content");
                    int sequenceIndex = resultSet.getInt("chunk_index");
                    if (content == null || content.isBlank() || sequenceIndex < 0) {
                        log.warn("[STORE] Skipping unusable row {} in {} (index={}, content={})",
                                resultSet.getLong("id"), table, sequenceIndex,
                                content == null ? "null" : "blank");
                        return;
                    }
                    target.add(new ChunkRecord(content, resultSet.getString("source_url"), origin, sequenceIndex));
                });
    }

    @Override
    public List<ImageReference> loadImageReferences() {
        List<String> imageUrls;
        try {
            imageUrls = jdbcTemplate.queryForList("SELECT image_url FROM image_chunks ORDER BY id", String.class);
        } catch (DataAccessException queryFailure) {
            log.warn("[STORE] Image references unavailable, continuing without images: {}",
                    queryFailure.getMostSpecificCause().getMessage());
            return List.of();
        }
        List<ImageReference> references = new ArrayList<>(imageUrls.size());
        for (String imageUrl : imageUrls) {
            if (imageUrl != null && !imageUrl.isBlank()) {
                references.add(new ImageReference(imageUrl.strip()));
            }
        }
        return references;
    }
}
