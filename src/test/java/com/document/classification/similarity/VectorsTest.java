package com.document.classification.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VectorsTest {

    @Test
    @DisplayName("Should compute cosine similarity")
    void testCosine() {
        assertEquals(1.0, Vectors.cosine(new float[]{1, 2, 3}, new float[]{2, 4, 6}), 1e-9);
        assertEquals(0.0, Vectors.cosine(new float[]{1, 0}, new float[]{0, 1}), 1e-9);
        assertEquals(-1.0, Vectors.cosine(new float[]{1, 0}, new float[]{-1, 0}), 1e-9);
    }

    @Test
    @DisplayName("Should refuse to compare zero or non-finite vectors")
    void testZeroNorm() {
        assertThrows(IllegalArgumentException.class, () -> Vectors.cosine(new float[]{0, 0}, new float[]{1, 1}));
        assertThrows(IllegalArgumentException.class,
                () -> Vectors.cosine(new float[]{Float.NaN, 1}, new float[]{1, 1}));
    }

    @Test
    @DisplayName("Should describe unusable vectors")
    void testDefect() {
        assertNull(Vectors.defect(new float[]{0.5f, -0.5f}));
        assertEquals("embedding has zero norm", Vectors.defect(new float[]{0f, 0f}));
        assertEquals("embedding contains non-finite values", Vectors.defect(new float[]{1f, Float.NaN}));
        assertEquals("embedding contains non-finite values",
                Vectors.defect(new float[]{Float.NEGATIVE_INFINITY, 0f}));
    }

    @Test
    @DisplayName("Should reject vectors of different dimension")
    void testDimensionMismatch() {
        assertThrows(IllegalArgumentException.class, () -> Vectors.cosine(new float[]{1}, new float[]{1, 2}));
    }

    @Test
    @DisplayName("Should weight the mean by the given weights")
    void testWeightedMean() {
        float[] mean = Vectors.weightedMean(List.of(new float[]{1, 0}, new float[]{0, 1}), new double[]{3, 1});
        assertArrayEquals(new float[]{0.75f, 0.25f}, mean, 1e-6f);
    }

    @Test
    @DisplayName("Should reject inconsistent inputs to the mean")
    void testWeightedMeanValidation() {
        assertThrows(IllegalArgumentException.class, () -> Vectors.weightedMean(List.of(), new double[0]));
        assertThrows(IllegalArgumentException.class,
                () -> Vectors.weightedMean(List.of(new float[]{1}), new double[]{1, 2}));
        assertThrows(IllegalArgumentException.class,
                () -> Vectors.weightedMean(List.of(new float[]{1}, new float[]{1, 2}), new double[]{1, 1}));
        assertThrows(IllegalArgumentException.class,
                () -> Vectors.weightedMean(List.of(new float[]{1}), new double[]{0}));
    }
}
