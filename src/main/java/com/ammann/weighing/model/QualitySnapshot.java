/* (C)2026 */
package com.ammann.weighing.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Live motion quality captured at the moment a manual reading was entered.
 *
 * @param qualityScore            live confidence in [0, 1]
 * @param rmsVerticalAcceleration RMS of a_z at entry time
 * @param rmsRoll                 RMS of roll at entry time
 * @param rmsPitch                RMS of pitch at entry time
 */
public record QualitySnapshot(
        @DecimalMin("0.0") @DecimalMax("1.0") double qualityScore,
        @PositiveOrZero double rmsVerticalAcceleration,
        @PositiveOrZero double rmsRoll,
        @PositiveOrZero double rmsPitch) {

    public static QualitySnapshot from(LiveMetrics metrics) {
        return new QualitySnapshot(
                metrics.confidence(),
                metrics.rmsVerticalAcceleration(),
                metrics.rmsRoll(),
                metrics.rmsPitch());
    }
}
