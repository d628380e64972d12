/* (C)2026 */
package com.ammann.weighing.model;

/**
 * Orientation-derived quantities for one inertial sample.
 *
 * @param verticalAcceleration linear acceleration projected onto unit gravity (m/s²)
 * @param roll                 roll angle in degrees
 * @param pitch                pitch angle in degrees
 * @param gravityEstimate      smoothed gravity vector after this sample
 * @param gravityUnit          normalized gravity estimate
 * @param linearAcceleration   raw acceleration minus gravity estimate
 * @param timestamp            capture time in milliseconds
 */
public record ProcessedSample(
        double verticalAcceleration,
        double roll,
        double pitch,
        Vector3 gravityEstimate,
        Vector3 gravityUnit,
        Vector3 linearAcceleration,
        long timestamp) {}
