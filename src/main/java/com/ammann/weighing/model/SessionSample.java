/* (C)2026 */
package com.ammann.weighing.model;

/**
 * One row of a continuous session: motion state plus the scale reading held at that instant.
 *
 * @param timestamp            inertial capture time in milliseconds
 * @param verticalAcceleration a_z (m/s²)
 * @param roll                 roll (deg)
 * @param pitch                pitch (deg)
 * @param scaleReading         scale value in grams, sampled at the scale cadence
 * @param good                 all instantaneous thresholds held for this sample
 */
public record SessionSample(
        long timestamp,
        double verticalAcceleration,
        double roll,
        double pitch,
        double scaleReading,
        boolean good) {}
