package com.svsbrowser.springboot.service;

/**
 * Converts embeddings to the pgvector text form ({@code [0.1,0.2,0.3]}) used in native queries.
 */
public final class VectorFormat {

    private VectorFormat() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String toLiteral(float[] vector) {
        if (vector == null) {
            throw new IllegalArgumentException("vector must not be null");
        }
        StringBuilder sb = new StringBuilder(vector.length * 10 + 2).append('[');
        for (int i = 0; i < vector.length; i++) {
            if (i > 0) sb.append(',');
            sb.append(vector[i]);
        }
        return sb.append(']').toString();
    }
}
