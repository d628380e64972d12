/* (C)2026 */
package com.ammann.weighing.model;

import java.util.List;

/**
 * Immutable snapshot of a stopped continuous session.
 *
 * @param samples         collected samples in arrival order
 * @param startTime       wall-clock start in epoch milliseconds, 0 for an empty snapshot
 * @param endTime         wall-clock stop in epoch milliseconds, 0 for an empty snapshot
 * @param durationSeconds session length in seconds
 * @param rmsVerticalAcceleration RMS of a_z over all samples
 * @param rmsRoll         RMS of roll over all samples
 * @param rmsPitch        RMS of pitch over all samples
 * @param percentGood     share of samples flagged good, 0-100
 */
public record SessionData(
        List<SessionSample> samples,
        long startTime,
        long endTime,
        double durationSeconds,
        double rmsVerticalAcceleration,
        double rmsRoll,
        double rmsPitch,
        double percentGood) {

    public SessionData {
        samples = List.copyOf(samples);
    }

    public static SessionData empty() {
        return new SessionData(List.of(), 0L, 0L, 0.0, 0.0, 0.0, 0.0, 0.0);
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }
}
