/* (C)2026 */
package com.ammann.weighing.model;

import java.util.List;

/**
 * Relative mass change between a base and a final session, {@code (Wbase - Wfinal) / Wbase}.
 *
 * @param base                   base session result
 * @param fin                    final session result
 * @param ratio                  relative change
 * @param percent                relative change in percent
 * @param sigmaRatio1Sigma       propagated 1-sigma uncertainty of the ratio
 * @param errorBand95Ratio       95% band of the ratio
 * @param errorBand95Percent     95% band in percentage points
 * @param relativeErrorPercent95 95% band relative to the percent change, in percent
 * @param k95                    multiplier for the effective sample count
 * @param effectiveN             smaller of the two trimmed counts
 * @param notes                  advisory notes, empty when none apply
 */
public record RatioResult(
        SessionResult base,
        SessionResult fin,
        double ratio,
        double percent,
        double sigmaRatio1Sigma,
        double errorBand95Ratio,
        double errorBand95Percent,
        double relativeErrorPercent95,
        double k95,
        int effectiveN,
        List<String> notes) {

    public RatioResult {
        notes = List.copyOf(notes);
    }
}
