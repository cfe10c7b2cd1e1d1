package org.example.cryoingest.geometry;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

@Getter
@EqualsAndHashCode
@ToString
public final class Matrix2 {

    public static final Matrix2 IDENTITY = new Matrix2(1, 0, 0, 1);

    private final double m11;
    private final double m12;
    private final double m21;
    private final double m22;

    public Matrix2(double m11, double m12, double m21, double m22) {
        this.m11 = m11;
        this.m12 = m12;
        this.m21 = m21;
        this.m22 = m22;
    }

    /**
     * Builds a matrix from the {@code m11..m22} keys used in microscope metadata and
     * control-plane payloads.
     */
    public static Matrix2 fromMap(Map<String, Double> values) {
        return new Matrix2(
                require(values, "m11"),
                require(values, "m12"),
                require(values, "m21"),
                require(values, "m22")
        );
    }

    private static double require(Map<String, Double> values, String key) {
        Double v = values.get(key);
        if (v == null) {
            throw new IllegalArgumentException("matrix element missing: " + key);
        }
        return v;
    }

    public Map<String, Double> toMap() {
        return Map.of("m11", m11, "m12", m12, "m21", m21, "m22", m22);
    }

    public double determinant() {
        return m11 * m22 - m12 * m21;
    }

    public Matrix2 multiply(Matrix2 other) {
        return new Matrix2(
                m11 * other.m11 + m12 * other.m21,
                m11 * other.m12 + m12 * other.m22,
                m21 * other.m11 + m22 * other.m21,
                m21 * other.m12 + m22 * other.m22
        );
    }

    public Vector2 apply(Vector2 v) {
        return new Vector2(m11 * v.getX() + m12 * v.getY(), m21 * v.getX() + m22 * v.getY());
    }

    public Matrix2 inverse() {
        double det = determinant();
        if (Math.abs(det) < 1e-12) {
            throw new IllegalArgumentException("matrix is singular: " + this);
        }
        return new Matrix2(m22 / det, -m12 / det, -m21 / det, m11 / det);
    }
}
