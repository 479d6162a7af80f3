package com.williamcallahan.kbingest.domain;

import java.util.Base64;
import java.util.Objects;

/**
 * Downloaded image bytes and the MIME type the server declared for them.
 */
public final class ImagePayload {
    private final byte[] bytes;
    private final String mimeType;

    public ImagePayload(byte[] bytes, String mimeType) {
        Objects.requireNonNull(bytes, "bytes");
        if (mimeType == null || mimeType.isBlank()) {
            throw new IllegalArgumentException("mimeType is required");
        }
        this.bytes = bytes.clone();
        this.mimeType = mimeType;
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    public String mimeType() {
        return mimeType;
    }

    public int size() {
        return bytes.length;
    }

    /**
     * Renders the payload as a {@code data:} URI for inline transmission.
     */
    public String toDataUri() {
        return "data:" + mimeType + ";base64," + Base64.getEncoder().encodeToString(bytes);
    }
}
