package com.williamcallahan.kbingest.service;

import com.williamcallahan.kbingest.domain.ImagePayload;

/**
 * Downloads images referenced by source documents.
 */
public interface ImageFetcher {

    /**
     * Fetches the image once.
     *
     * @param imageUrl absolute image URL
     * @return bytes and MIME type, or a failure for network errors and non-success statuses
     */
    RemoteCallResult<ImagePayload> fetch(String imageUrl);
}
