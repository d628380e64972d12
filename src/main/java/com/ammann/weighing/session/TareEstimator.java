/* (C)2026 */
package com.ammann.weighing.session;

import com.ammann.weighing.enumeration.TareMethod;
import com.ammann.weighing.exception.ValidationException;
import com.ammann.weighing.math.Statistics;
import com.ammann.weighing.model.TareEstimate;
import com.ammann.weighing.model.TareSample;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects zero-load readings and estimates the scale bias.
 *
 * <p>Bias is the median of the readings. The 95% tare uncertainty is half their range, a
 * distribution-free bound suited to the handful of readings an operator takes; its 1-sigma
 * equivalent is half of that. A single reading gives its value as bias and zero uncertainty.
 */
public class TareEstimator {

    private final Clock clock;
    private final List<TareSample> samples = new ArrayList<>();

    public TareEstimator(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param value zero-load reading in grams
     * @throws ValidationException for NaN or negative values
     */
    public void addTareSample(double value) {
        if (Double.isNaN(value) || value < 0) {
            throw ValidationException.invalidParameter("tareReading", value, "a non-negative number");
        }
        samples.add(new TareSample(clock.millis(), value));
    }

    /**
     * Removes the sample at {@code index}; out-of-range indices are ignored.
     */
    public void removeTareSample(int index) {
        if (index >= 0 && index < samples.size()) {
            samples.remove(index);
        }
    }

    public void clear() {
        samples.clear();
    }

    public List<TareSample> samples() {
        return List.copyOf(samples);
    }

    public int count() {
        return samples.size();
    }

    public TareEstimate estimate() {
        int count = samples.size();
        if (count == 0) {
            return TareEstimate.NONE;
        }
        if (count == 1) {
            return new TareEstimate(1, samples.get(0).reading(), 0.0, 0.0, TareMethod.HALF_RANGE);
        }

        double[] readings = samples.stream().mapToDouble(TareSample::reading).toArray();
        double min = readings[0];
        double max = readings[0];
        for (double r : readings) {
            min = Math.min(min, r);
            max = Math.max(max, r);
        }
        double uncertainty95 = (max - min) / 2.0;

        return new TareEstimate(
                count, Statistics.median(readings), uncertainty95, uncertainty95 / 2.0, TareMethod.HALF_RANGE);
    }

    /**
     * Estimate from operator-entered values, bypassing the collected samples.
     *
     * @param bias              bias in grams
     * @param tareUncertainty95 95% tare uncertainty in grams
     * @return estimate with count 0 and method {@link TareMethod#USER_ENTERED}
     */
    public static TareEstimate manualEstimate(double bias, double tareUncertainty95) {
        if (Double.isNaN(bias)) {
            throw ValidationException.invalidParameter("bias", bias, "a number");
        }
        if (Double.isNaN(tareUncertainty95) || tareUncertainty95 < 0) {
            throw ValidationException.invalidParameter("tareUncertainty95", tareUncertainty95, "a non-negative number");
        }
        return new TareEstimate(0, bias, tareUncertainty95, tareUncertainty95 / 2.0, TareMethod.USER_ENTERED);
    }
}
