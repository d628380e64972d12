/* (C)2026 */
package com.ammann.weighing.model;

import java.util.List;

/**
 * Outcome of a continuous measurement session.
 *
 * <p>Unreliable results are still returned so that callers can show the diagnostics.
 *
 * @param fixedMeasurement point estimate in grams
 * @param confidence       blended quality score in [0, 1]
 * @param errorBand        half-width of the 95% band in grams
 * @param relativeError    error band relative to the estimate, in percent
 * @param reliable         reliability verdict
 * @param motionCorrected  whether the vertical-acceleration correction was applied
 * @param diagnostics      pipeline intermediates
 * @param notes            advisory notes, empty when none apply
 */
public record MeasurementResult(
        double fixedMeasurement,
        double confidence,
        double errorBand,
        double relativeError,
        boolean reliable,
        boolean motionCorrected,
        MeasurementDiagnostics diagnostics,
        List<String> notes) {

    public MeasurementResult {
        notes = List.copyOf(notes);
    }
}
