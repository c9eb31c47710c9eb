package com.face.attendance.core.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Fixed-length numeric vector representing one face.
 * Immutable: the backing array is copied on the way in and on the way out.
 */
public final class Signature {

    private final float[] values;

    private Signature(float[] values) {
        Objects.requireNonNull(values, "values is required");
        if (values.length == 0) {
            throw new IllegalArgumentException("Signature must have at least one dimension");
        }
        for (float v : values) {
            if (Float.isNaN(v) || Float.isInfinite(v)) {
                throw new IllegalArgumentException("Signature values must be finite");
            }
        }
        this.values = values.clone();
    }

    public static Signature of(float... values) {
        return new Signature(values);
    }

    public static Signature of(double[] values) {
        Objects.requireNonNull(values, "values is required");
        float[] copy = new float[values.length];
        for (int i = 0; i < values.length; i++) {
            copy[i] = (float) values[i];
        }
        return new Signature(copy);
    }

    public int dimension() {
        return values.length;
    }

    public float get(int index) {
        return values[index];
    }

    /**
     * Returns a copy of the vector.
     */
    public float[] values() {
        return values.clone();
    }

    public double l2Norm() {
        double sum = 0;
        for (float v : values) {
            sum += (double) v * v;
        }
        return Math.sqrt(sum);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(values, ((Signature) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Signature{dimension=" + values.length + '}';
    }
}
