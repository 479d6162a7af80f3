package com.williamcallahan.kbingest.service;

import com.williamcallahan.kbingest.domain.ImagePayload;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import org.jsoup.Connection;
import org.jsoup.Jsoup;

/**
 * Downloads images with jsoup's HTTP connection.
 *
 * <p>The MIME type comes from the {@code Content-Type} header, stripped of parameters. Servers that omit
 * it get {@value #FALLBACK_MIME_TYPE}.</p>
 */
public class HttpImageFetcher implements ImageFetcher {

    static final String FALLBACK_MIME_TYPE = "image/webp";

    private final int timeoutMillis;

    public HttpImageFetcher(Duration timeout) {
        this.timeoutMillis = (int) Objects.requireNonNull(timeout, "timeout").toMillis();
    }

    @Override
    public RemoteCallResult<ImagePayload> fetch(String imageUrl) {
        if (imageUrl == null || imageUrl.isBlank()) {
            return RemoteCallResult.failure("Image URL is blank");
        }
        Connection.Response response;
        byte[] body;
        try {
            response = Jsoup.connect(imageUrl)
                    .ignoreContentType(true)
                    .ignoreHttpErrors(true)
                    .followRedirects(true)
                    .maxBodySize(0)
                    .timeout(timeoutMillis)
                    .execute();
            body = response.bodyAsBytes();
        } catch (IllegalArgumentException invalidUrl) {
            return RemoteCallResult.failure("Invalid image URL: " + imageUrl, invalidUrl);
        } catch (IOException | UncheckedIOException ioException) {
            return RemoteCallResult.failure(
                    "Image download failed: " + ioException.getClass().getSimpleName(), ioException);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            return RemoteCallResult.failure("Image download returned HTTP " + status);
        }
        if (body == null || body.length == 0) {
            return RemoteCallResult.failure("Image download returned an empty body");
        }
        return RemoteCallResult.success(new ImagePayload(body, mimeTypeOf(response.contentType())));
    }

    static String mimeTypeOf(String contentType) {
        if (contentType == null) {
            return FALLBACK_MIME_TYPE;
        }
        int separator = contentType.indexOf(';');
        String bare = (separator < 0 ? contentType : contentType.substring(0, separator))
                .trim()
                .toLowerCase(Locale.ROOT);
        return bare.isEmpty() ? FALLBACK_MIME_TYPE : bare;
    }
}
