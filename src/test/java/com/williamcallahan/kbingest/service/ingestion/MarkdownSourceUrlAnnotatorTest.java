package com.williamcallahan.kbingest.service.ingestion;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.williamcallahan.kbingest.config.AppProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MarkdownSourceUrlAnnotatorTest {

    @TempDir
    Path tempDir;

    private MarkdownSourceUrlAnnotator annotator;

    @BeforeEach
    void setUp() {
        AppProperties appProperties = new AppProperties();
        appProperties.getSources().setMarkdownBaseUrl("https://tds.s-anand.net/#/");
        annotator = new MarkdownSourceUrlAnnotator(appProperties);
    }

    @Test
    void pageUrlIsLowerCaseDashedFileStem() {
        assertEquals("https://tds.s-anand.net/#/large-language-models",
                annotator.pageUrlFor(Path.of("docs", "Large-Language_Models.md")));
        assertEquals("https://tds.s-anand.net/#/vs-code", annotator.pageUrlFor(Path.of("VS_Code.md")));
    }

    @Test
    void insertsCommentAndBlankLineAtTop() throws IOException {
        Path file = tempDir.resolve("git-basics.md");
        Files.writeString(file, "# Git\n\nText\n");

        annotator.annotate(file);

        assertEquals("<!-- source_url: https://tds.s-anand.net/#/git-basics -->\n\n# Git\n\nText\n",
                Files.readString(file));
    }

    @Test
    void replacesExistingCommentOnFirstLine() throws IOException {
        Path file = tempDir.resolve("git-basics.md");
        Files.writeString(file, "<!-- source_url: https://old.example/x -->\n\n# Git\n");

        annotator.annotate(file);

        assertEquals("<!-- source_url: https://tds.s-anand.net/#/git-basics -->\n\n# Git\n", Files.readString(file));
    }

    @Test
    void annotatingTwiceIsStable() throws IOException {
        Path file = tempDir.resolve("intro.md");
        Files.writeString(file, "Hello\n");

        annotator.annotate(file);
        String once = Files.readString(file);
        annotator.annotate(file);

        assertEquals(once, Files.readString(file));
    }

    @Test
    void annotatesMarkdownFilesRecursively() throws IOException {
        Files.createDirectories(tempDir.resolve("nested"));
        Files.writeString(tempDir.resolve("a.md"), "A\n");
        Files.writeString(tempDir.resolve("nested/b.md"), "B\n");
        Files.writeString(tempDir.resolve("notes.txt"), "C\n");

        assertEquals(2, annotator.annotateDirectory(tempDir));
        assertEquals("C\n", Files.readString(tempDir.resolve("notes.txt")));
    }

    @Test
    void missingDirectoryAnnotatesNothing() throws IOException {
        assertEquals(0, annotator.annotateDirectory(tempDir.resolve("absent")));
    }
}
