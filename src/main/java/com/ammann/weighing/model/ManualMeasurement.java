/* (C)2026 */
package com.ammann.weighing.model;

import com.ammann.weighing.enumeration.SessionKind;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Operator-entered reading corrected with the tare locked at session start.
 *
 * @param timestamp         entry time in epoch milliseconds
 * @param kind              session the reading belongs to
 * @param scaleReading      raw reading in grams
 * @param bias              bias locked at session start
 * @param tareUncertainty95 95% tare uncertainty locked at session start
 * @param correctedValue    {@code scaleReading - bias}
 * @param quality           live motion quality at entry time, or {@code null}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ManualMeasurement(
        long timestamp,
        SessionKind kind,
        double scaleReading,
        double bias,
        double tareUncertainty95,
        double correctedValue,
        QualitySnapshot quality) {

    public boolean hasQuality() {
        return quality != null;
    }
}
