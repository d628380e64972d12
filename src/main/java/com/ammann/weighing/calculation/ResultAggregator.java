/* (C)2026 */
package com.ammann.weighing.calculation;

import com.ammann.weighing.config.EstimatorConfig;
import com.ammann.weighing.enumeration.SessionKind;
import com.ammann.weighing.math.ConfidenceTable;
import com.ammann.weighing.math.Statistics;
import com.ammann.weighing.model.ManualMeasurement;
import com.ammann.weighing.model.MeasurementDiagnostics;
import com.ammann.weighing.model.MeasurementResult;
import com.ammann.weighing.model.SessionData;
import com.ammann.weighing.model.SessionResult;
import com.ammann.weighing.model.SessionSample;
import java.util.ArrayList;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Turns a completed session into a point estimate with a 95% uncertainty band.
 *
 * <p>Two pipelines share the robust selection logic (trimmed mean, with the median for small
 * counts or when the two disagree by more than 10%):
 * <ul>
 *   <li><b>Continuous</b> ({@link #computeContinuous}): optional vertical-acceleration
 *       correction, hard filtering to good samples, motion and scale-noise uncertainty,
 *       fixed coverage factor 2.</li>
 *   <li><b>Manual</b> ({@link #computeManual}): standard error combined with the locked tare
 *       sigma, interpolated Student-t coverage factor.</li>
 * </ul>
 *
 * <p>Holds no mutable state; identical inputs give identical results.
 */
public class ResultAggregator
{

    private static final Logger LOG = Logger.getLogger(ResultAggregator.class);

    /** Exclusive bounds of a physically plausible scale reading, grams. */
    static final double MIN_READING_G = 0.0;
    static final double MAX_READING_G = 100_000.0;

    static final int MIN_GOOD_SAMPLES = 3;
    static final int MIN_SAMPLES_FOR_TRIMMED_MEAN = 3;

    /** Relative disagreement between trimmed mean and median that forces the median. */
    static final double MEDIAN_FALLBACK_THRESHOLD = 0.10;

    /**
     * Coverage factor of the continuous-mode band. Manual mode uses the Student-t k-factor for
     * the same nominal 95% level; the two are intentionally not unified here.
     */
    static final double CONTINUOUS_COVERAGE_FACTOR = 2.0;

    private static final double NEAR_ZERO = 1e-9;

    private final EstimatorConfig config;

    public ResultAggregator(EstimatorConfig config)
    {
        this.config = config;
    }

    // Continuous mode

    /**
     * Computes the result of a continuous session.
     *
     * @param session                 stopped session snapshot
     * @param bias                    tare bias subtracted from each reading, grams
     * @param motionCorrectionEnabled apply {@code reading * g / (g + a_z)}
     * @return result; never null, flagged unreliable with notes when data is insufficient
     */
    public MeasurementResult computeContinuous(SessionData session, double bias, boolean motionCorrectionEnabled)
    {
        if (session.isEmpty()) {
            return emptyContinuous(motionCorrectionEnabled, "No session samples collected");
        }

        double g = config.standardGravity();
        List<Double> all = new ArrayList<>();
        List<Double> good = new ArrayList<>();

        for (SessionSample sample : session.samples()) {
            double raw = sample.scaleReading();
            if (Double.isNaN(raw) || raw <= MIN_READING_G || raw >= MAX_READING_G) {
                continue;
            }
            double value = raw - bias;
            if (motionCorrectionEnabled) {
                value = correctForMotion(value, sample.verticalAcceleration(), g);
                if (!Double.isFinite(value) || value <= 0) {
                    continue;
                }
            }
            all.add(value);
            if (sample.good()) {
                good.add(value);
            }
        }

        if (all.isEmpty()) {
            return emptyContinuous(motionCorrectionEnabled, "No valid scale readings in session");
        }

        List<String> notes = new ArrayList<>();
        int nTotal = all.size();
        int nGood = good.size();
        double percentGood = nGood * 100.0 / nTotal;

        double[] used;
        if (nGood >= MIN_GOOD_SAMPLES) {
            used = toArray(good);
        } else {
            used = toArray(all);
            notes.add(String.format("Only %d good samples - using all %d samples", nGood, nTotal));
        }

        double fixed;
        double confidence;
        double stdDev = Statistics.sampleStdDev(used);

        if (used.length >= MIN_SAMPLES_FOR_TRIMMED_MEAN) {
            fixed = robustCentre(used, Statistics.trimmedMean(used, config.trimFraction()), notes);

            double cv = fixed != 0 ? stdDev / fixed : 0.0;
            double qualityScore = Math.min(1.0, percentGood / 80.0);
            double consistencyScore = Math.max(0.0, 1.0 - cv * 10.0);
            double sampleCountScore = Math.min(1.0, used.length / 20.0);
            confidence = Statistics.clamp(
                    qualityScore * 0.4 + consistencyScore * 0.4 + sampleCountScore * 0.2, 0.0, 1.0);
        } else {
            fixed = Statistics.median(used);
            confidence = Math.min(1.0, used.length / 10.0);
            notes.add(String.format("Insufficient samples (%d) - using median", used.length));
        }

        double sigmaMotion = fixed * (config.uncertaintyK() * session.rmsVerticalAcceleration()) / g;
        double sigmaScale = stdDev;
        double sigmaTotal = Math.sqrt(sigmaMotion * sigmaMotion + sigmaScale * sigmaScale);
        double errorBand = CONTINUOUS_COVERAGE_FACTOR * sigmaTotal;
        double relativeError = fixed > 0 ? errorBand / fixed * 100.0 : 0.0;

        boolean unstable = session.rmsVerticalAcceleration() >= config.azRmsThreshold() * 2.0;
        if (unstable) {
            notes.add(String.format("Session a_z RMS %.3f m/s² exceeds twice the stability threshold",
                    session.rmsVerticalAcceleration()));
        }

        boolean reliable = confidence > 0.3
                && nGood >= MIN_GOOD_SAMPLES
                && errorBand < fixed * 0.1
                && !unstable;

        MeasurementDiagnostics diagnostics = new MeasurementDiagnostics(
                nTotal,
                nGood,
                percentGood,
                session.rmsVerticalAcceleration(),
                session.rmsRoll(),
                session.rmsPitch(),
                sigmaMotion,
                sigmaScale,
                sigmaTotal);

        LOG.debugf("Continuous result: %.2f g ± %.2f g (confidence %.2f, %d/%d good, reliable=%s)",
                fixed, errorBand, confidence, nGood, nTotal, reliable);

        return new MeasurementResult(
                fixed, confidence, errorBand, relativeError, reliable, motionCorrectionEnabled, diagnostics, notes);
    }

    /**
     * Single-pole correction of a reading perturbed by vertical acceleration. Falls back to
     * the uncorrected value when {@code g + a_z} is zero.
     */
    static double correctForMotion(double reading, double az, double g)
    {
        double denominator = g + az;
        if (Math.abs(denominator) < NEAR_ZERO) {
            return reading;
        }
        return reading * g / denominator;
    }

    private static MeasurementResult emptyContinuous(boolean motionCorrected, String note)
    {
        return new MeasurementResult(
                0.0, 0.0, 0.0, 0.0, false, motionCorrected, MeasurementDiagnostics.EMPTY, List.of(note));
    }

    // Manual mode

    /**
     * Computes the result of a manual session.
     *
     * @param kind         session kind, reported even when no measurements are present
     * @param measurements measurements sharing the same locked tare
     * @return result; never null, a zeroed result with a note when nothing is usable
     */
    public SessionResult computeManual(SessionKind kind, List<ManualMeasurement> measurements)
    {
        double trimFraction = config.trimFraction();
        if (measurements.isEmpty()) {
            return emptyManual(kind, trimFraction);
        }

        double[] corrected = measurements.stream()
                .mapToDouble(ManualMeasurement::correctedValue)
                .filter(v -> !Double.isNaN(v) && v > MIN_READING_G && v < MAX_READING_G)
                .toArray();
        if (corrected.length == 0) {
            return emptyManual(kind, trimFraction);
        }

        int nTotal = corrected.length;
        double[] trimmed = Statistics.trim(corrected, trimFraction);
        int nTrim = trimmed.length;
        if (nTrim == 0) {
            return emptyManual(kind, trimFraction);
        }

        List<String> notes = new ArrayList<>();

        double mean = Statistics.mean(trimmed);
        double median = Statistics.median(trimmed);
        double trimmedMean = mean;
        double fixedValue = nTrim >= MIN_SAMPLES_FOR_TRIMMED_MEAN
                ? robustCentre(trimmed, trimmedMean, notes)
                : median;

        double stdDev = nTrim >= 2 ? Statistics.sampleStdDev(trimmed) : 0.0;
        double stdError = nTrim >= 2 ? stdDev / Math.sqrt(nTrim) : 0.0;

        ManualMeasurement first = measurements.get(0);
        double tareUncertainty95 = first.tareUncertainty95();
        double tareSigma = tareUncertainty95 / 2.0;

        double total = Math.sqrt(stdError * stdError + tareSigma * tareSigma);
        double k95 = ConfidenceTable.kFromN(nTrim);
        double errorBand95 = k95 * total;
        double relativeError95 = fixedValue != 0 ? errorBand95 / Math.abs(fixedValue) * 100.0 : 0.0;

        double confidence = confidenceForCount(nTrim);
        double[] qualityScores = measurements.stream()
                .filter(ManualMeasurement::hasQuality)
                .mapToDouble(m -> m.quality().qualityScore())
                .toArray();
        if (qualityScores.length > 0) {
            double meanQuality = Statistics.clamp(Statistics.mean(qualityScores), 0.0, 1.0);
            confidence = Statistics.clamp(confidence * (0.5 + 0.5 * meanQuality), 0.0, 1.0);
        }

        if (nTotal == 1) {
            notes.add("Single measurement - no statistical variation");
        }
        if (nTrim < MIN_SAMPLES_FOR_TRIMMED_MEAN) {
            notes.add(String.format("Low sample count (%d) - using median instead of trimmed mean", nTrim));
        }
        if (tareUncertainty95 == 0) {
            notes.add("No tare uncertainty specified");
        }
        if (nTrim == 1) {
            notes.add("n=1, k-factor fallback used");
        }

        LOG.debugf("Manual %s result: %.2f g ± %.2f g (nTrim=%d, k=%.3f)",
                kind, fixedValue, errorBand95, nTrim, k95);

        return new SessionResult(
                kind,
                measurements,
                nTotal,
                nTrim,
                trimFraction,
                first.bias(),
                tareUncertainty95,
                tareSigma,
                mean,
                median,
                trimmedMean,
                fixedValue,
                stdDev,
                stdError,
                total,
                errorBand95,
                relativeError95,
                confidence,
                k95,
                notes);
    }

    /**
     * Confidence ladder by trimmed count: 0.3, 0.5, 0.7, 0.85, 0.95 at n = 1, 2, 3+, 6+, 10+.
     */
    static double confidenceForCount(int nTrim)
    {
        if (nTrim >= 10) return 0.95;
        if (nTrim >= 6) return 0.85;
        if (nTrim >= 3) return 0.7;
        if (nTrim == 2) return 0.5;
        if (nTrim == 1) return 0.3;
        return 0.0;
    }

    private static SessionResult emptyManual(SessionKind kind, double trimFraction)
    {
        return new SessionResult(
                kind, List.of(), 0, 0, trimFraction,
                0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0,
                ConfidenceTable.FALLBACK_K,
                List.of("No measurements available"));
    }

    // Shared

    /**
     * Returns the trimmed mean unless it is more than 10% away from the median, in which case
     * the trim window still holds an outlier cluster and the median is used.
     */
    private static double robustCentre(double[] values, double trimmedMean, List<String> notes)
    {
        double median = Statistics.median(values);
        if (Math.abs(trimmedMean - median) > Math.abs(median) * MEDIAN_FALLBACK_THRESHOLD) {
            notes.add(String.format("Trimmed mean %.2f deviates more than 10%% from median %.2f - using median",
                    trimmedMean, median));
            return median;
        }
        return trimmedMean;
    }

    private static double[] toArray(List<Double> values)
    {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
