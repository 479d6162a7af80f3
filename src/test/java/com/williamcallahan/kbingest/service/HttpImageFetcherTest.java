package com.williamcallahan.kbingest.service;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sun.net.httpserver.HttpServer;
import com.williamcallahan.kbingest.domain.ImagePayload;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Exercises the image fetcher against a local HTTP server.
 */
class HttpImageFetcherTest {

    private static final byte[] IMAGE_BYTES = {(byte) 0x89, 'P', 'N', 'G'};

    private HttpServer server;
    private String baseUrl;
    private final HttpImageFetcher fetcher = new HttpImageFetcher(Duration.ofSeconds(5));

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/typed.png", exchange -> {
            exchange.getResponseHeaders().add("Content-Type", "image/png; charset=binary");
            exchange.sendResponseHeaders(200, IMAGE_BYTES.length);
            try (OutputStream body = exchange.getResponseBody()) {
                body.write(IMAGE_BYTES);
            }
        });
        server.createContext("/untyped", exchange -> {
            exchange.sendResponseHeaders(200, IMAGE_BYTES.length);
            try (OutputStream body = exchange.getResponseBody()) {
                body.write(IMAGE_BYTES);
            }
        });
        server.createContext("/missing.png", exchange -> {
            exchange.sendResponseHeaders(404, -1);
            exchange.close();
        });
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void returnsBytesAndDeclaredMimeType() {
        RemoteCallResult<ImagePayload> result = fetcher.fetch(baseUrl + "/typed.png");

        ImagePayload payload = result.asOptional().orElseThrow();
        assertArrayEquals(IMAGE_BYTES, payload.bytes());
        assertEquals("image/png", payload.mimeType());
    }

    @Test
    void fallsBackToWebpWhenContentTypeIsMissing() {
        RemoteCallResult<ImagePayload> result = fetcher.fetch(baseUrl + "/untyped");

        assertEquals(HttpImageFetcher.FALLBACK_MIME_TYPE, result.asOptional().orElseThrow().mimeType());
    }

    @Test
    void nonSuccessStatusIsFailure() {
        RemoteCallResult<ImagePayload> result = fetcher.fetch(baseUrl + "/missing.png");

        assertFalse(result.succeeded());
        assertTrue(((RemoteCallResult.Failure<ImagePayload>) result).reason().contains("404"));
    }

    @Test
    void malformedUrlIsFailure() {
        assertFalse(fetcher.fetch("not a url").succeeded());
    }

    @Test
    void blankUrlIsFailureWithoutConnecting() {
        assertFalse(fetcher.fetch("  ").succeeded());
    }

    @Test
    void mimeTypeDropsParametersAndCase() {
        assertEquals("image/jpeg", HttpImageFetcher.mimeTypeOf("Image/JPEG ; q=0.9"));
        assertEquals(HttpImageFetcher.FALLBACK_MIME_TYPE, HttpImageFetcher.mimeTypeOf(" ;x=1"));
        assertEquals(HttpImageFetcher.FALLBACK_MIME_TYPE, HttpImageFetcher.mimeTypeOf(null));
    }
}
