package com.williamcallahan.kbingest.service.ingestion;

import com.williamcallahan.kbingest.config.AppProperties;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Writes a {@code <!-- source_url: ... -->} comment as the first line of each markdown file so later
 * preparation can attribute chunks to their published page.
 */
@Service
public class MarkdownSourceUrlAnnotator {
    private static final Logger log = LoggerFactory.getLogger(MarkdownSourceUrlAnnotator.class);

    private static final String COMMENT_MARKER = "<!-- source_url:";

    private final String baseUrl;

    public MarkdownSourceUrlAnnotator(AppProperties appProperties) {
        String configured = appProperties.getSources().getMarkdownBaseUrl();
        this.baseUrl = configured == null ? "" : configured.trim();
    }

    /**
     * Annotates every markdown file under a directory.
     *
     * @param rootDir directory walked recursively
     * @return number of files rewritten
     * @throws IOException when walking the directory or rewriting a file fails
     */
    public int annotateDirectory(Path rootDir) throws IOException {
        if (!Files.isDirectory(rootDir)) {
            log.warn("[PREPARE] Markdown directory not found, nothing to annotate: {}", rootDir);
            return 0;
        }
        int annotated = 0;
        try (Stream<Path> paths = Files.walk(rootDir)) {
            Iterator<Path> markdownFiles = paths.filter(Files::isRegularFile)
                    .filter(MarkdownSourceUrlAnnotator::isMarkdownFile)
                    .sorted()
                    .iterator();
            while (markdownFiles.hasNext()) {
                annotate(markdownFiles.next());
                annotated++;
            }
        }
        log.info("[PREPARE] Added source URLs to {} markdown files", annotated);
        return annotated;
    }

    /**
     * Replaces an existing source URL comment on the first line, or inserts one followed by a blank line.
     */
    public void annotate(Path markdownFile) throws IOException {
        String original = Files.readString(markdownFile, StandardCharsets.UTF_8);
        String comment = COMMENT_MARKER + " " + pageUrlFor(markdownFile) + " -->";
        int firstLineEnd = original.indexOf('\n');
        String firstLine = firstLineEnd < 0 ? original : original.substring(0, firstLineEnd);
        String updated;
        if (firstLine.strip().startsWith(COMMENT_MARKER)) {
            updated = comment + (firstLineEnd < 0 ? "\n" : original.substring(firstLineEnd));
        } else {
            updated = comment + "\n\n" + original;
        }
        Files.writeString(markdownFile, updated, StandardCharsets.UTF_8);
    }

    /**
     * Derives the published page URL: the lower-cased file name without extension, each dash, underscore
     * or space written as a dash, appended to the base URL.
     */
    public String pageUrlFor(Path markdownFile) {
        String fileName = markdownFile.getFileName().toString();
        int extensionStart = fileName.lastIndexOf('.');
        String stem = extensionStart > 0 ? fileName.substring(0, extensionStart) : fileName;
        String pageName = stem.replace('-', ' ').replace('_', ' ').replace(' ', '-').toLowerCase(Locale.ROOT);
        return baseUrl + pageName;
    }

    static boolean isMarkdownFile(Path path) {
        Path fileName = path.getFileName();
        return fileName != null && fileName.toString().toLowerCase(Locale.ROOT).endsWith(".md");
    }
}
