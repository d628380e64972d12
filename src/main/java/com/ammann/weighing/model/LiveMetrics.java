/* (C)2026 */
package com.ammann.weighing.model;

/**
 * Snapshot of live motion quality, recomputed for every processed inertial sample.
 *
 * @param verticalAcceleration    most recent a_z (m/s²)
 * @param roll                    most recent roll (deg)
 * @param pitch                   most recent pitch (deg)
 * @param rmsVerticalAcceleration RMS of a_z over the trailing window
 * @param rmsRoll                 RMS of roll over the trailing window
 * @param rmsPitch                RMS of pitch over the trailing window
 * @param samplingRateHz          estimated device rate, 0 when unknown
 * @param stable                  all three RMS values below their thresholds
 * @param confidence              soft companion score in [0, 1]
 */
public record LiveMetrics(
        double verticalAcceleration,
        double roll,
        double pitch,
        double rmsVerticalAcceleration,
        double rmsRoll,
        double rmsPitch,
        double samplingRateHz,
        boolean stable,
        double confidence) {

    public static final LiveMetrics NONE = new LiveMetrics(0, 0, 0, 0, 0, 0, 0, false, 0);
}
