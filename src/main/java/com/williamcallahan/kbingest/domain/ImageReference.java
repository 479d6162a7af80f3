package com.williamcallahan.kbingest.domain;

/**
 * Locator of an image embedded in a source document.
 *
 * @param url absolute image URL
 */
public record ImageReference(String url) {

    public ImageReference {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Image url is required");
        }
    }
}
