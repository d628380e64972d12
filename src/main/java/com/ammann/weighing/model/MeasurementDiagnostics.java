/* (C)2026 */
package com.ammann.weighing.model;

/**
 * Intermediate values of the continuous-mode pipeline, reported for troubleshooting.
 *
 * @param nTotal                  readings that survived range filtering and correction
 * @param nGood                   of those, readings flagged good
 * @param percentGood             {@code nGood / nTotal} in percent
 * @param sessionRmsVerticalAcceleration session RMS of a_z
 * @param sessionRmsRoll          session RMS of roll
 * @param sessionRmsPitch         session RMS of pitch
 * @param sigmaMotion             motion contribution to the 1-sigma uncertainty (g)
 * @param sigmaScale              scale-noise contribution to the 1-sigma uncertainty (g)
 * @param sigmaTotal              combined 1-sigma uncertainty (g)
 */
public record MeasurementDiagnostics(
        int nTotal,
        int nGood,
        double percentGood,
        double sessionRmsVerticalAcceleration,
        double sessionRmsRoll,
        double sessionRmsPitch,
        double sigmaMotion,
        double sigmaScale,
        double sigmaTotal) {

    public static final MeasurementDiagnostics EMPTY =
            new MeasurementDiagnostics(0, 0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0);
}
