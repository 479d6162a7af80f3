package com.williamcallahan.kbingest;

import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import com.williamcallahan.kbingest.service.IngestionOrchestrator;
import com.williamcallahan.kbingest.service.RequestRateLimiter;
import com.williamcallahan.kbingest.store.SqliteChunkStore;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

@SpringBootTest(properties = "app.remote.api-key=test-key")
class KbIngestApplicationTests {

    @Autowired
    private ApplicationContext context;

    @DynamicPropertySource
    static void workspaceProperties(DynamicPropertyRegistry registry) {
        Path workDir = createWorkDir();
        registry.add("spring.datasource.url", () -> "jdbc:sqlite:" + workDir.resolve("kb.db"));
        registry.add("app.output.artifact-path", () -> workDir.resolve("embeddings.json.gz").toString());
    }

    private static Path createWorkDir() {
        try {
            return Files.createTempDirectory("kb-ingest-context");
        } catch (IOException ioException) {
            throw new UncheckedIOException(ioException);
        }
    }

    @Test
    void contextLoadsWithSharedRateLimiter() {
        assertNotNull(context.getBean(IngestionOrchestrator.class));
        assertNotNull(context.getBean(SqliteChunkStore.class));
        assertSame(context.getBean(RequestRateLimiter.class), context.getBean(RequestRateLimiter.class));
    }
}
