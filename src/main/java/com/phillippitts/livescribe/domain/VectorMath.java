package com.phillippitts.livescribe.domain;

/**
 * Small vector helpers shared by voice profiles and the diarization engine.
 */
public final class VectorMath {

    private VectorMath() {
        // Utility class - prevent instantiation
    }

    public static double l2Norm(double[] v) {
        double sum = 0.0;
        for (double x : v) {
            sum += x * x;
        }
        return Math.sqrt(sum);
    }

    /**
     * Returns a unit-length copy of {@code v}, or a zero copy when {@code v} has no magnitude.
     */
    public static double[] l2Normalize(double[] v) {
        double norm = l2Norm(v);
        double[] out = new double[v.length];
        if (norm == 0.0 || Double.isNaN(norm)) {
            return out;
        }
        for (int i = 0; i < v.length; i++) {
            out[i] = v[i] / norm;
        }
        return out;
    }

    /**
     * Cosine similarity of two equal-length vectors; 0 when either has no magnitude.
     */
    public static double cosineSimilarity(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("vectors must have equal length: " + a.length + " != " + b.length);
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
