/* (C)2026 */
package com.ammann.weighing.model;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * One accelerometer/gyroscope event as delivered by the device sensor bridge.
 *
 * <p>The acceleration vector is absent when the sensor was momentarily silent. The rotation
 * rate is carried for diagnostics only; orientation is derived from acceleration alone.
 *
 * @param accelerationIncludingGravity raw acceleration including gravity (m/s²), if reported
 * @param rotationRate                 rotation rate (deg/s), if reported
 * @param intervalMs                   device-reported inter-sample interval, if reported
 * @param timestamp                    monotonic capture time in milliseconds
 */
public record RawInertialSample(
        Optional<Vector3> accelerationIncludingGravity,
        Optional<Vector3> rotationRate,
        OptionalDouble intervalMs,
        long timestamp) {

    public RawInertialSample {
        Objects.requireNonNull(accelerationIncludingGravity, "accelerationIncludingGravity");
        Objects.requireNonNull(rotationRate, "rotationRate");
        Objects.requireNonNull(intervalMs, "intervalMs");
    }

    /**
     * Sample carrying only an acceleration vector.
     */
    public static RawInertialSample of(Vector3 acceleration, long timestamp) {
        return new RawInertialSample(
                Optional.of(acceleration), Optional.empty(), OptionalDouble.empty(), timestamp);
    }

    /**
     * Sample for an event in which the accelerometer reported nothing.
     */
    public static RawInertialSample silent(long timestamp) {
        return new RawInertialSample(
                Optional.empty(), Optional.empty(), OptionalDouble.empty(), timestamp);
    }
}
