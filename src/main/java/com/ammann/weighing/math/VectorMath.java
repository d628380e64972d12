/* (C)2026 */
package com.ammann.weighing.math;

import com.ammann.weighing.model.Vector3;

/**
 * Vector helpers for the gravity filter and orientation angles.
 */
public final class VectorMath {

    private VectorMath() {}

    public static double dot(Vector3 a, Vector3 b) {
        return a.x() * b.x() + a.y() * b.y() + a.z() * b.z();
    }

    public static double magnitude(Vector3 v) {
        return Math.sqrt(v.x() * v.x() + v.y() * v.y() + v.z() * v.z());
    }

    /**
     * Returns the unit vector along {@code v}; the zero vector normalizes to the zero vector.
     */
    public static Vector3 normalize(Vector3 v) {
        double mag = magnitude(v);
        if (mag == 0.0) {
            return Vector3.ZERO;
        }
        return new Vector3(v.x() / mag, v.y() / mag, v.z() / mag);
    }

    /**
     * Exponential smoothing step {@code alpha * previous + (1 - alpha) * input}, per component.
     */
    public static Vector3 blend(Vector3 previous, Vector3 input, double alpha) {
        double beta = 1.0 - alpha;
        return new Vector3(
                alpha * previous.x() + beta * input.x(),
                alpha * previous.y() + beta * input.y(),
                alpha * previous.z() + beta * input.z());
    }

    public static double radToDeg(double rad) {
        return rad * 180.0 / Math.PI;
    }

    public static double degToRad(double deg) {
        return deg * Math.PI / 180.0;
    }
}
