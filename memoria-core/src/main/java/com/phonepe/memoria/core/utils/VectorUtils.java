package com.phonepe.memoria.core.utils;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;

@UtilityClass
public class VectorUtils {

    /**
     * Compute cosine similarity between two vectors.
     * Returns a value between -1 and 1, where 1 means identical, 0 means orthogonal, and -1 means opposite.
     * Vectors of different lengths, or with zero magnitude, score 0.
     */
    public static double cosineSimilarity(float[] lhs, float[] rhs) {
        if (lhs == null || rhs == null || lhs.length != rhs.length) {
            return 0.0;
        }
        double dotProduct = 0.0;
        double normLhs = 0.0;
        double normRhs = 0.0;
        for (int i = 0; i < lhs.length; i++) {
            dotProduct += lhs[i] * rhs[i];
            normLhs += lhs[i] * lhs[i];
            normRhs += rhs[i] * rhs[i];
        }
        if (normLhs == 0.0 || normRhs == 0.0) {
            return 0.0;
        }
        return dotProduct / (Math.sqrt(normLhs) * Math.sqrt(normRhs));
    }

    public static float[] l2Normalize(float[] vector) {
        double norm = 0.0;
        for (float v : vector) {
            norm += v * v;
        }
        if (norm == 0.0) {
            return vector;
        }
        final var scale = (float) (1.0 / Math.sqrt(norm));
        final var normalized = new float[vector.length];
        for (int i = 0; i < vector.length; i++) {
            normalized[i] = vector[i] * scale;
        }
        return normalized;
    }

    public static List<Float> toList(float[] vector) {
        final var list = new ArrayList<Float>(vector.length);
        for (float v : vector) {
            list.add(v);
        }
        return list;
    }

    public static float[] fromList(List<? extends Number> values) {
        final var vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = values.get(i).floatValue();
        }
        return vector;
    }
}
