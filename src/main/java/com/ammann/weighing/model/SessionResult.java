/* (C)2026 */
package com.ammann.weighing.model;

import com.ammann.weighing.enumeration.SessionKind;
import java.util.List;

/**
 * Aggregate of a completed manual session.
 *
 * @param kind                   base or final
 * @param measurements           measurements the result was computed from
 * @param nTotal                 valid corrected values before trimming
 * @param nTrim                  values left after trimming
 * @param trimFraction           fraction dropped from each end
 * @param bias                   locked session bias
 * @param tareUncertainty95      locked 95% tare uncertainty
 * @param tareSigma              1-sigma tare uncertainty
 * @param mean                   mean of the trimmed set
 * @param median                 median of the trimmed set
 * @param trimmedMean            trimmed mean
 * @param fixedValue             chosen point estimate
 * @param stdDev                 sample standard deviation of the trimmed set
 * @param stdError               standard error of the trimmed set
 * @param totalUncertainty1Sigma standard error and tare sigma combined in quadrature
 * @param errorBand95            {@code k95 * totalUncertainty1Sigma}
 * @param relativeError95        error band relative to the point estimate, in percent
 * @param confidence             step score from the trimmed count
 * @param k95                    interpolated Student-t multiplier
 * @param notes                  advisory notes, empty when none apply
 */
public record SessionResult(
        SessionKind kind,
        List<ManualMeasurement> measurements,
        int nTotal,
        int nTrim,
        double trimFraction,
        double bias,
        double tareUncertainty95,
        double tareSigma,
        double mean,
        double median,
        double trimmedMean,
        double fixedValue,
        double stdDev,
        double stdError,
        double totalUncertainty1Sigma,
        double errorBand95,
        double relativeError95,
        double confidence,
        double k95,
        List<String> notes) {

    public SessionResult {
        measurements = List.copyOf(measurements);
        notes = List.copyOf(notes);
    }
}
