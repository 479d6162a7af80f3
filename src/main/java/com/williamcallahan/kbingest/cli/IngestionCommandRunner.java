package com.williamcallahan.kbingest.cli;

import com.williamcallahan.kbingest.config.AppProperties;
import com.williamcallahan.kbingest.domain.IngestionReport;
import com.williamcallahan.kbingest.domain.PreparationSummary;
import com.williamcallahan.kbingest.domain.SourceFileFailure;
import com.williamcallahan.kbingest.service.IngestionOrchestrator;
import com.williamcallahan.kbingest.service.ingestion.ChunkPreparationService;
import com.williamcallahan.kbingest.service.ingestion.MarkdownSourceUrlAnnotator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Command-line entry point. The first argument selects the step: {@code annotate}, {@code prepare},
 * {@code embed}, or {@code all} to run the three in order.
 */
@Component
public class IngestionCommandRunner implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(IngestionCommandRunner.class);

    private static final String BANNER = "===============================================";

    private final MarkdownSourceUrlAnnotator annotator;
    private final ChunkPreparationService preparationService;
    private final IngestionOrchestrator orchestrator;
    private final AppProperties appProperties;

    public IngestionCommandRunner(
            MarkdownSourceUrlAnnotator annotator,
            ChunkPreparationService preparationService,
            IngestionOrchestrator orchestrator,
            AppProperties appProperties) {
        this.annotator = annotator;
        this.preparationService = preparationService;
        this.orchestrator = orchestrator;
        this.appProperties = appProperties;
    }

    @Override
    public void run(String... args) throws IOException {
        if (args.length == 0) {
            log.info("Usage: kb-ingest <annotate|prepare|embed|all>");
            return;
        }
        String command = args[0].trim().toLowerCase(Locale.ROOT);
        switch (command) {
            case "annotate" -> annotate();
            case "prepare" -> prepare();
            case "embed" -> embed();
            case "all" -> {
                annotate();
                prepare();
                embed();
            }
            default -> throw new IllegalArgumentException(
                    "Unknown command '" + args[0] + "'. Expected one of: annotate, prepare, embed, all");
        }
    }

    private void annotate() throws IOException {
        Path markdownDir = Path.of(appProperties.getSources().getMarkdownDir());
        log.info(BANNER);
        log.info("Annotating markdown source URLs");
        log.info(BANNER);
        log.info("Markdown directory: {}", markdownDir);
        int annotated = annotator.annotateDirectory(markdownDir);
        log.info("Annotated files: {}", annotated);
    }

    private void prepare() throws IOException {
        log.info(BANNER);
        log.info("Preparing chunks");
        log.info(BANNER);
        log.info("Discourse directory: {}", appProperties.getSources().getDiscourseDir());
        log.info("Markdown directory: {}", appProperties.getSources().getMarkdownDir());
        long startTime = System.currentTimeMillis();
        PreparationSummary summary = preparationService.prepare();
        log.info("");
        log.info(BANNER);
        log.info("CHUNK PREPARATION COMPLETE ({} ms)", System.currentTimeMillis() - startTime);
        log.info(BANNER);
        log.info("Discourse chunks: {}", summary.discourseChunks());
        log.info("Markdown chunks: {}", summary.markdownChunks());
        log.info("Image references: {}", summary.imageReferences());
        log.info("Skipped files: {}", summary.failures().size());
        for (SourceFileFailure failure : summary.failures()) {
            log.warn("  {} [{}]: {}", failure.filePath(), failure.phase(), failure.details());
        }
    }

    private void embed() throws IOException {
        log.info(BANNER);
        log.info("Embedding chunks and images");
        log.info(BANNER);
        log.info("Embedding model: {}", appProperties.getRemote().getEmbeddingModel());
        log.info("Caption model: {}", appProperties.getRemote().getCaptionModel());
        log.info("Rate limit: {}/s, {}/min",
                appProperties.getRateLimit().getRequestsPerSecond(),
                appProperties.getRateLimit().getRequestsPerMinute());
        long startTime = System.currentTimeMillis();
        IngestionReport report = orchestrator.run();
        log.info("");
        log.info(BANNER);
        log.info("EMBEDDING COMPLETE ({} ms)", System.currentTimeMillis() - startTime);
        log.info(BANNER);
        log.info("Text chunks embedded: {}/{}", report.textRecordsEmbedded(), report.textChunksSeen());
        log.info("Images embedded: {}/{}", report.imageRecordsEmbedded(), report.imagesSeen());
        log.info("Dimension mismatches: {}", report.dimensionMismatches());
        log.info("Total records: {}", report.totalRecords());
        log.info("Artifact: {}", report.artifactPath());
        log.info(BANNER);
    }
}
