package com.williamcallahan.kbingest.store;

import com.williamcallahan.kbingest.domain.ImageReference;
import java.util.List;

/**
 * Supplies image references found in source documents.
 */
public interface ImageSource {

    /**
     * Returns image references in insertion order, or an empty list when none were recorded.
     */
    List<ImageReference> loadImageReferences();
}
