package com.williamcallahan.kbingest.service;

import com.williamcallahan.kbingest.domain.EmbeddingVector;
import com.williamcallahan.kbingest.domain.ImagePayload;

/**
 * Port to the remote model service. Implementations make exactly one request per call and never throw
 * for provider-side failures.
 */
public interface RemoteModelClient {

    /**
     * Embeds one text for document retrieval.
     *
     * @param text text to embed
     * @return vector on success, failure variant otherwise
     */
    RemoteCallResult<EmbeddingVector> embed(String text);

    /**
     * Asks a multimodal model to describe an image.
     *
     * @param image downloaded image and its MIME type
     * @param prompt instruction sent alongside the image
     * @return caption text on success, failure variant otherwise
     */
    RemoteCallResult<String> caption(ImagePayload image, String prompt);
}
