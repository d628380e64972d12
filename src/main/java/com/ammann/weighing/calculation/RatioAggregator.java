/* (C)2026 */
package com.ammann.weighing.calculation;

import com.ammann.weighing.math.ConfidenceTable;
import com.ammann.weighing.model.RatioResult;
import com.ammann.weighing.model.SessionResult;
import java.util.ArrayList;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Relative change between a base and a final weighing, {@code (Wbase - Wfinal) / Wbase},
 * with first-order error propagation.
 *
 * <p>The two sessions are treated as independent:
 * <pre>
 * d(ratio)/dWbase  =  Wfinal / Wbase²
 * d(ratio)/dWfinal = -1 / Wbase
 * sigma_ratio = sqrt((d/dWbase * sigma_base)² + (d/dWfinal * sigma_final)²)
 * </pre>
 * The 95% band uses the k-factor of the smaller trimmed count of the two sessions.
 */
public class RatioAggregator {

    private static final Logger LOG = Logger.getLogger(RatioAggregator.class);

    private static final int LOW_COUNT = 3;

    public RatioResult compute(SessionResult base, SessionResult fin) {
        double wb = base.fixedValue();
        double wf = fin.fixedValue();

        if (wb <= 0) {
            LOG.warnf("Ratio requested with non-positive base weight %.3f", wb);
            return new RatioResult(
                    base, fin, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0,
                    ConfidenceTable.FALLBACK_K, 0,
                    List.of("W_base must be > 0 (division guard triggered)"));
        }

        double ratio = (wb - wf) / wb;
        double percent = 100.0 * ratio;

        double dRatioDWb = wf / (wb * wb);
        double dRatioDWf = -1.0 / wb;
        double termBase = dRatioDWb * base.totalUncertainty1Sigma();
        double termFinal = dRatioDWf * fin.totalUncertainty1Sigma();
        double sigmaRatio = Math.sqrt(termBase * termBase + termFinal * termFinal);

        int effectiveN = ConfidenceTable.effectiveN(base.nTrim(), fin.nTrim());
        double k95 = ConfidenceTable.kFromN(effectiveN);
        double band95Ratio = k95 * sigmaRatio;
        double band95Percent = 100.0 * band95Ratio;
        double relativeErrorPercent95 = Math.abs(percent) > 0
                ? band95Percent / Math.abs(percent) * 100.0
                : 0.0;

        List<String> notes = new ArrayList<>();
        if (base.nTrim() < LOW_COUNT) {
            notes.add(String.format("Low base sample count (%d)", base.nTrim()));
        }
        if (fin.nTrim() < LOW_COUNT) {
            notes.add(String.format("Low final sample count (%d)", fin.nTrim()));
        }
        if (effectiveN < LOW_COUNT) {
            notes.add(String.format("Low effective sample count (%d) for k-factor", effectiveN));
        }
        if (base.tareUncertainty95() == 0 && fin.tareUncertainty95() == 0) {
            notes.add("No tare uncertainty specified for either session");
        }

        LOG.debugf("Ratio %.4f%% ± %.4f%% (nEff=%d, k=%.3f)", percent, band95Percent, effectiveN, k95);

        return new RatioResult(
                base, fin, ratio, percent, sigmaRatio, band95Ratio, band95Percent,
                relativeErrorPercent95, k95, effectiveN, notes);
    }
}
