package com.williamcallahan.kbingest.domain;

/**
 * Identifies which upstream corpus a chunk was cut from.
 */
public enum ChunkOrigin {
    /** Course or reference pages authored as markdown files. */
    MARKDOWN,
    /** Forum posts exported from a Discourse topic dump. */
    DISCOURSE
}
