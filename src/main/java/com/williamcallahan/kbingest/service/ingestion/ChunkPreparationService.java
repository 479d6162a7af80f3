package com.williamcallahan.kbingest.service.ingestion;

import com.williamcallahan.kbingest.config.AppProperties;
import com.williamcallahan.kbingest.domain.PreparationSummary;
import com.williamcallahan.kbingest.domain.SourceFileFailure;
import com.williamcallahan.kbingest.store.SqliteChunkStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Fills the chunk store from the configured forum and markdown directories.
 */
@Service
public class ChunkPreparationService {
    private static final Logger INDEXING_LOG = LoggerFactory.getLogger("INDEXING");

    private final SqliteChunkStore chunkStore;
    private final DiscourseTopicProcessor discourseProcessor;
    private final MarkdownDocumentProcessor markdownProcessor;
    private final Path discourseDir;
    private final Path markdownDir;

    public ChunkPreparationService(
            SqliteChunkStore chunkStore,
            DiscourseTopicProcessor discourseProcessor,
            MarkdownDocumentProcessor markdownProcessor,
            AppProperties appProperties) {
        this.chunkStore = Objects.requireNonNull(chunkStore, "chunkStore");
        this.discourseProcessor = Objects.requireNonNull(discourseProcessor, "discourseProcessor");
        this.markdownProcessor = Objects.requireNonNull(markdownProcessor, "markdownProcessor");
        this.discourseDir = Path.of(appProperties.getSources().getDiscourseDir());
        this.markdownDir = Path.of(appProperties.getSources().getMarkdownDir());
    }

    /**
     * Recreates the store contents from the source directories. Files that cannot be read or parsed are
     * skipped and reported in the summary.
     *
     * @return chunk and image counts plus per-file failures
     * @throws IOException when listing a source directory fails
     */
    public PreparationSummary prepare() throws IOException {
        chunkStore.createTables();
        chunkStore.clearAll();
        List<SourceFileFailure> failures = new ArrayList<>();

        List<Path> topicFiles = listFiles(discourseDir, false, ".json");
        int discourseChunks = 0;
        for (Path topicFile : topicFiles) {
            SourceFileOutcome outcome = discourseProcessor.process(topicFile);
            discourseChunks += outcome.chunkCount();
            outcome.failure().ifPresent(failures::add);
        }
        INDEXING_LOG.info("[PREPARE] Discourse: {} files -> {} chunks", topicFiles.size(), discourseChunks);

        List<Path> markdownFiles = listFiles(markdownDir, true, ".md");
        int markdownChunks = 0;
        int imageReferences = 0;
        for (Path markdownFile : markdownFiles) {
            SourceFileOutcome outcome = markdownProcessor.process(markdownFile);
            markdownChunks += outcome.chunkCount();
            imageReferences += outcome.imageCount();
            outcome.failure().ifPresent(failures::add);
        }
        INDEXING_LOG.info("[PREPARE] Markdown: {} files -> {} chunks, {} images",
                markdownFiles.size(), markdownChunks, imageReferences);

        return new PreparationSummary(discourseChunks, markdownChunks, imageReferences, failures);
    }

    private static List<Path> listFiles(Path rootDir, boolean recursive, String extension) throws IOException {
        if (!Files.isDirectory(rootDir)) {
            INDEXING_LOG.warn("[PREPARE] Source directory not found, skipping: {}", rootDir);
            return List.of();
        }
        try (Stream<Path> paths = recursive ? Files.walk(rootDir) : Files.list(rootDir)) {
            return paths.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(extension))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }
}
