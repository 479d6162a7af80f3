package com.williamcallahan.kbingest.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.kbingest.domain.EmbeddingArtifact;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists embedding artifacts as gzipped JSON.
 *
 * <p>Writes go to a temporary sibling first and are moved into place, so readers never observe a partial
 * artifact.</p>
 */
public class EmbeddingArtifactStore {
    private static final Logger INDEXING_LOG = LoggerFactory.getLogger("INDEXING");

    private final ObjectMapper objectMapper;
    private final Path artifactPath;

    public EmbeddingArtifactStore(ObjectMapper objectMapper, Path artifactPath) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.artifactPath = Objects.requireNonNull(artifactPath, "artifactPath").toAbsolutePath().normalize();
    }

    public Path artifactPath() {
        return artifactPath;
    }

    /**
     * Writes the artifact to the configured location.
     *
     * @return the final artifact path
     * @throws IOException when the file cannot be written or moved
     */
    public Path write(EmbeddingArtifact artifact) throws IOException {
        Objects.requireNonNull(artifact, "artifact");
        Path parent = artifactPath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tempFile = Files.createTempFile(parent, artifactPath.getFileName().toString(), ".tmp");
        try {
            try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(tempFile))) {
                objectMapper.writeValue(out, artifact);
            }
            Files.move(tempFile, artifactPath, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(tempFile);
        }
        INDEXING_LOG.info("[INDEXING] Wrote {} embeddings ({} dimensions) to {}",
                artifact.size(), artifact.dimensions(), artifactPath);
        return artifactPath;
    }

    /**
     * Reads the artifact at the configured location.
     */
    public EmbeddingArtifact read() throws IOException {
        return read(artifactPath);
    }

    /**
     * Reads an artifact previously written by {@link #write(EmbeddingArtifact)}.
     */
    public EmbeddingArtifact read(Path path) throws IOException {
        try (InputStream in = new GZIPInputStream(Files.newInputStream(path))) {
            return objectMapper.readValue(in, EmbeddingArtifact.class);
        }
    }
}
