package com.face.attendance.registry;

import com.face.attendance.core.model.Signature;

/**
 * How two signatures are compared. Every metric maps onto [0,1], higher is more similar.
 */
public enum SimilarityMetric {

    /**
     * Cosine similarity; opposed vectors (negative cosine) count as 0.
     */
    COSINE("cosine") {
        @Override
        public double similarity(Signature a, Signature b) {
            checkDimensions(a, b);
            float[] x = a.values();
            float[] y = b.values();
            double dot = 0.0;
            for (int i = 0; i < x.length; i++) {
                dot += (double) x[i] * y[i];
            }
            double norms = a.l2Norm() * b.l2Norm();
            if (norms == 0.0) {
                return 0.0;
            }
            return clamp(dot / norms);
        }

        @Override
        public double fromDistance(double distance) {
            // FalkorDB reports cosine distance as 1 - cos, in [0,2]
            return clamp(1.0 - distance);
        }
    },

    /**
     * Euclidean distance mapped as {@code max(0, 1 - d)}; a distance of 0.4 is 0.6 similar.
     */
    EUCLIDEAN("euclidean") {
        @Override
        public double similarity(Signature a, Signature b) {
            checkDimensions(a, b);
            float[] x = a.values();
            float[] y = b.values();
            double sum = 0.0;
            for (int i = 0; i < x.length; i++) {
                double d = (double) x[i] - y[i];
                sum += d * d;
            }
            return fromDistance(Math.sqrt(sum));
        }

        @Override
        public double fromDistance(double distance) {
            return clamp(1.0 - distance);
        }
    };

    private final String falkorName;

    SimilarityMetric(String falkorName) {
        this.falkorName = falkorName;
    }

    public abstract double similarity(Signature a, Signature b);

    /**
     * Converts a distance reported by a vector index into a similarity.
     */
    public abstract double fromDistance(double distance);

    /**
     * Name of the similarity function in a FalkorDB vector index definition.
     */
    public String falkorName() {
        return falkorName;
    }

    public static SimilarityMetric fromString(String value) {
        if (value == null || value.isBlank()) {
            return COSINE;
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown similarity metric: " + value, e);
        }
    }

    private static void checkDimensions(Signature a, Signature b) {
        if (a.dimension() != b.dimension()) {
            throw new IllegalArgumentException("Signature dimensions differ: "
                    + a.dimension() + " vs " + b.dimension());
        }
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
