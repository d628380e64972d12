/* (C)2026 */
package com.ammann.weighing.model;

/**
 * Three-component vector in device coordinates, used for acceleration and gravity estimates (m/s²).
 *
 * @param x x component
 * @param y y component
 * @param z z component
 */
public record Vector3(double x, double y, double z) {

    public static final Vector3 ZERO = new Vector3(0.0, 0.0, 0.0);

    public Vector3 minus(Vector3 other) {
        return new Vector3(x - other.x, y - other.y, z - other.z);
    }
}
