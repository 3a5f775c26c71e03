package com.entity.semantic.core.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Fixed-length float vector produced from a canonical name.
 * The vector is copied on the way in and out; the L2 norm is computed once.
 */
public final class Embedding {

    private final float[] values;
    private final double norm;

    private Embedding(float[] values) {
        this.values = values;
        double sum = 0.0;
        for (float v : values) {
            sum += (double) v * v;
        }
        this.norm = Math.sqrt(sum);
    }

    public static Embedding of(float[] values) {
        Objects.requireNonNull(values, "values is required");
        return new Embedding(values.clone());
    }

    public static Embedding of(double... values) {
        float[] converted = new float[values.length];
        for (int i = 0; i < values.length; i++) {
            converted[i] = (float) values[i];
        }
        return new Embedding(converted);
    }

    public int dimension() {
        return values.length;
    }

    public double norm() {
        return norm;
    }

    public boolean isZero() {
        return norm == 0.0 || Double.isNaN(norm);
    }

    public float get(int i) {
        return values[i];
    }

    public float[] toArray() {
        return values.clone();
    }

    /**
     * Direct view of the backing array for similarity loops. Callers must not modify it.
     */
    public float[] unsafeValues() {
        return values;
    }

    /**
     * Cosine similarity, {@code dot(a,b) / (|a| * |b|)}. Both vectors must be non-zero
     * and of equal dimension.
     */
    public double cosine(Embedding other) {
        float[] a = values;
        float[] b = other.values;
        double dot = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
        }
        return dot / (norm * other.norm);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Embedding that)) return false;
        return Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Embedding{dimension=" + values.length + ", norm=" + String.format("%.4f", norm) + '}';
    }
}
