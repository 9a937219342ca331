package com.nevis.curation.similarity;

public final class CosineSimilarity {

    private CosineSimilarity() {
    }

    /**
     * Cosine similarity clamped to [0,1]. Negative similarity is floored to 0, and a zero-magnitude
     * vector is similar to nothing.
     */
    public static double of(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vectors must have same dimension: " + a.length + " vs " + b.length);
        }
        return fromParts(dot(a, b), norm(a), norm(b));
    }

    static double fromParts(double dot, double normA, double normB) {
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        double cosine = dot / (normA * normB);
        if (Double.isNaN(cosine)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, cosine));
    }

    static double dot(float[] a, float[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += (double) a[i] * b[i];
        }
        return sum;
    }

    static double norm(float[] v) {
        double sum = 0.0;
        for (float x : v) {
            sum += (double) x * x;
        }
        return Math.sqrt(sum);
    }
}
