package com.knowledge.importer.similarity;

import java.util.List;

/**
 * Cosine similarity between embedding vectors.
 */
public final class CosineSimilarity {

    private CosineSimilarity() {
    }

    /**
     * @return the cosine of the angle between the vectors, or 0.0 when either is empty,
     *         zero-length in norm, or the dimensions differ
     */
    public static double compute(float[] a, float[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    /**
     * Reads a vector held either as {@code float[]} or as a list of numbers.
     *
     * @return the vector, or null when the value is neither or holds a non-number
     */
    public static float[] toVector(Object value) {
        if (value instanceof float[] vector) {
            return vector;
        }
        if (value instanceof List<?> list && !list.isEmpty()) {
            float[] vector = new float[list.size()];
            for (int i = 0; i < vector.length; i++) {
                if (!(list.get(i) instanceof Number n)) {
                    return null;
                }
                vector[i] = n.floatValue();
            }
            return vector;
        }
        return null;
    }
}
