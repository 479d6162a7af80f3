package com.williamcallahan.kbingest.domain;

import java.util.Arrays;
import java.util.Objects;

/**
 * Dense embedding returned by the remote embedding operation.
 */
public final class EmbeddingVector {
    private final float[] values;

    public EmbeddingVector(float[] values) {
        Objects.requireNonNull(values, "values");
        if (values.length == 0) {
            throw new IllegalArgumentException("Embedding vector must not be empty");
        }
        this.values = values.clone();
    }

    public float[] values() {
        return values.clone();
    }

    public int dimensions() {
        return values.length;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof EmbeddingVector that && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "EmbeddingVector[dimensions=" + values.length + "]";
    }
}
