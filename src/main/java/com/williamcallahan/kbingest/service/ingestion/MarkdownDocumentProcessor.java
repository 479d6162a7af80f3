package com.williamcallahan.kbingest.service.ingestion;

import com.vladsch.flexmark.ast.AutoLink;
import com.vladsch.flexmark.ast.Code;
import com.vladsch.flexmark.ast.FencedCodeBlock;
import com.vladsch.flexmark.ast.HardLineBreak;
import com.vladsch.flexmark.ast.HtmlBlock;
import com.vladsch.flexmark.ast.HtmlCommentBlock;
import com.vladsch.flexmark.ast.HtmlInline;
import com.vladsch.flexmark.ast.HtmlInlineComment;
import com.vladsch.flexmark.ast.Image;
import com.vladsch.flexmark.ast.IndentedCodeBlock;
import com.vladsch.flexmark.ast.Link;
import com.vladsch.flexmark.ast.SoftLineBreak;
import com.vladsch.flexmark.ast.Text;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.ast.Block;
import com.vladsch.flexmark.util.ast.Node;
import com.williamcallahan.kbingest.domain.ChunkOrigin;
import com.williamcallahan.kbingest.domain.ChunkRecord;
import com.williamcallahan.kbingest.domain.SourceFileFailure;
import com.williamcallahan.kbingest.service.Chunker;
import com.williamcallahan.kbingest.store.SqliteChunkStore;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns one markdown file into prose chunks and image references.
 */
@Service
public class MarkdownDocumentProcessor {
    private static final Logger log = LoggerFactory.getLogger(MarkdownDocumentProcessor.class);

    private static final Pattern SOURCE_URL_COMMENT = Pattern.compile("<!--\\s*source_url:\\s*(.*?)\\s*-->");

    private final Parser parser = Parser.builder().build();
    private final Chunker chunker;
    private final SqliteChunkStore chunkStore;

    public MarkdownDocumentProcessor(Chunker chunker, SqliteChunkStore chunkStore) {
        this.chunker = Objects.requireNonNull(chunker, "chunker");
        this.chunkStore = Objects.requireNonNull(chunkStore, "chunkStore");
    }

    /**
     * Reads, cleans, chunks and stores a markdown document along with its image URLs.
     *
     * @param markdownFile file to process
     * @return processed counts, a skip for documents without prose or images, or a read failure
     */
    public SourceFileOutcome process(Path markdownFile) {
        String markdown;
        try {
            markdown = Files.readString(markdownFile, StandardCharsets.UTF_8);
        } catch (IOException readFailure) {
            log.warn("[PREPARE] Skipping unreadable markdown file {}: {}", markdownFile, readFailure.getMessage());
            return SourceFileOutcome.failedFile(
                    new SourceFileFailure(markdownFile.toString(), "read", String.valueOf(readFailure.getMessage())));
        }

        String sourceUrl = extractSourceUrl(markdown);
        Node document = parser.parse(markdown);
        List<String> imageUrls = new ArrayList<>();
        collectImageUrls(document, imageUrls);
        List<ChunkRecord> chunks = chunker.chunkRecords(extractProse(document), sourceUrl, ChunkOrigin.MARKDOWN);

        String filePath = markdownFile.toString();
        chunkStore.insertImageReferences(filePath, imageUrls);
        chunkStore.insertMarkdownChunks(filePath, chunks);

        if (chunks.isEmpty() && imageUrls.isEmpty()) {
            return SourceFileOutcome.skippedFile("no prose or images");
        }
        log.debug("[PREPARE] {} -> {} chunks, {} images", markdownFile.getFileName(), chunks.size(), imageUrls.size());
        return SourceFileOutcome.processedFile(chunks.size(), imageUrls.size());
    }

    /**
     * Returns the URL from the first {@code <!-- source_url: ... -->} comment, or an empty string.
     */
    static String extractSourceUrl(String markdown) {
        Matcher matcher = SOURCE_URL_COMMENT.matcher(markdown);
        return matcher.find() ? matcher.group(1).trim() : "";
    }

    /**
     * Renders the prose of a parsed document as plain text. Code, links, images and raw HTML are dropped.
     */
    static String extractProse(Node document) {
        StringBuilder prose = new StringBuilder();
        appendProse(document, prose);
        return prose.toString().replaceAll("\\s+", " ").trim();
    }

    private static void appendProse(Node parent, StringBuilder prose) {
        for (Node childNode = parent.getFirstChild(); childNode != null; childNode = childNode.getNext()) {
            if (isExcluded(childNode)) {
                prose.append(' ');
                continue;
            }
            if (childNode instanceof Text) {
                prose.append(childNode.getChars());
            } else if (childNode instanceof SoftLineBreak || childNode instanceof HardLineBreak) {
                prose.append(' ');
            } else if (childNode.hasChildren()) {
                appendProse(childNode, prose);
            }
            if (childNode instanceof Block) {
                prose.append(' ');
            }
        }
    }

    private static boolean isExcluded(Node node) {
        return node instanceof Code
                || node instanceof FencedCodeBlock
                || node instanceof IndentedCodeBlock
                || node instanceof Link
                || node instanceof AutoLink
                || node instanceof Image
                || node instanceof HtmlBlock
                || node instanceof HtmlCommentBlock
                || node instanceof HtmlInline
                || node instanceof HtmlInlineComment;
    }

    private static void collectImageUrls(Node parent, List<String> imageUrls) {
        for (Node childNode = parent.getFirstChild(); childNode != null; childNode = childNode.getNext()) {
            if (childNode instanceof Image image) {
                String url = image.getUrl().toString().trim();
                if (!url.isEmpty()) {
                    imageUrls.add(url);
                }
            }
            if (childNode.hasChildren()) {
                collectImageUrls(childNode, imageUrls);
            }
        }
    }
}
