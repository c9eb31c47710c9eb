package com.face.attendance.testing;

import com.face.attendance.core.model.Signature;

/**
 * Builds signatures with a known cosine similarity to each other.
 *
 * <p>Identity {@code i} is enrolled as the unit vector on axis {@code i}. A signature for
 * identity {@code i} at score {@code s} is {@code s} on axis {@code i} plus the
 * remainder on the last axis, which no identity uses, so its cosine similarity is
 * {@code s} to identity {@code i} and 0 to every other identity.</p>
 */
public final class Vectors {

    public static final int DIMENSION = 8;

    private Vectors() {
    }

    public static Signature enrolled(int axis) {
        float[] v = new float[DIMENSION];
        v[axis] = 1f;
        return Signature.of(v);
    }

    public static Signature capture(int axis, double score) {
        double[] v = new double[DIMENSION];
        v[axis] = score;
        v[DIMENSION - 1] = Math.sqrt(1.0 - score * score);
        return Signature.of(v);
    }

    /**
     * A signature scoring {@code scoreA} against identity {@code axisA} and {@code scoreB}
     * against identity {@code axisB}.
     */
    public static Signature capture(int axisA, double scoreA, int axisB, double scoreB) {
        double[] v = new double[DIMENSION];
        v[axisA] = scoreA;
        v[axisB] = scoreB;
        v[DIMENSION - 1] = Math.sqrt(1.0 - scoreA * scoreA - scoreB * scoreB);
        return Signature.of(v);
    }
}
