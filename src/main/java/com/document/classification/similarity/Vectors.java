package com.document.classification.similarity;

import java.util.List;

/**
 * Vector helpers for embedding comparison.
 */
public final class Vectors {

    private Vectors() {
    }

    /**
     * Cosine similarity between two vectors of equal length.
     *
     * @throws IllegalArgumentException when the dimensions differ or either vector
     *                                  has zero norm or a non-finite component
     */
    public static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Dimension mismatch: " + a.length + " vs " + b.length);
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (!(normA > 0.0) || !(normB > 0.0) || Double.isInfinite(normA) || Double.isInfinite(normB)) {
            throw new IllegalArgumentException("Cosine is undefined for zero or non-finite vectors");
        }
        double similarity = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        return Math.max(-1.0, Math.min(1.0, similarity));
    }

    /**
     * Returns why the vector cannot be compared by cosine, or {@code null} when it can.
     */
    public static String defect(float[] vector) {
        double norm = 0.0;
        for (float value : vector) {
            if (!Float.isFinite(value)) {
                return "embedding contains non-finite values";
            }
            norm += (double) value * value;
        }
        return norm > 0.0 ? null : "embedding has zero norm";
    }

    /**
     * Weighted mean of equally sized vectors.
     *
     * @param vectors vectors to average, at least one
     * @param weights one non-negative weight per vector, not all zero
     */
    public static float[] weightedMean(List<float[]> vectors, double[] weights) {
        if (vectors.isEmpty()) {
            throw new IllegalArgumentException("At least one vector is required");
        }
        if (weights.length != vectors.size()) {
            throw new IllegalArgumentException("Expected " + vectors.size() + " weights, got " + weights.length);
        }
        int dimension = vectors.get(0).length;
        double[] sum = new double[dimension];
        double totalWeight = 0.0;
        for (int v = 0; v < vectors.size(); v++) {
            float[] vector = vectors.get(v);
            if (vector.length != dimension) {
                throw new IllegalArgumentException("Dimension mismatch: " + dimension + " vs " + vector.length);
            }
            for (int i = 0; i < dimension; i++) {
                sum[i] += weights[v] * vector[i];
            }
            totalWeight += weights[v];
        }
        if (totalWeight <= 0.0) {
            throw new IllegalArgumentException("Weights must not all be zero");
        }
        float[] mean = new float[dimension];
        for (int i = 0; i < dimension; i++) {
            mean[i] = (float) (sum[i] / totalWeight);
        }
        return mean;
    }
}
