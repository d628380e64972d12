/* (C)2026 */
package com.ammann.weighing.math;

import java.util.Arrays;

/**
 * Descriptive statistics over plain {@code double} arrays.
 *
 * <p>Every function is total: an empty input yields 0 rather than NaN or an exception,
 * so aggregation code can always produce a structurally valid result.
 */
public final class Statistics
{

    private Statistics() {}

    public static double mean(double[] values)
    {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Median; the mean of the two middle values for even lengths.
     */
    public static double median(double[] values)
    {
        if (values.length == 0) {
            return 0.0;
        }
        double[] sorted = sorted(values);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 0) {
            return (sorted[mid - 1] + sorted[mid]) / 2.0;
        }
        return sorted[mid];
    }

    /**
     * Sorts a copy and drops {@code floor(n * fraction)} values from each end.
     *
     * @param values   input values (not modified)
     * @param fraction share to drop from each end, in [0, 0.5)
     * @return sorted remaining values; may be empty
     */
    public static double[] trim(double[] values, double fraction)
    {
        double[] sorted = sorted(values);
        int drop = (int) Math.floor(sorted.length * fraction);
        if (drop * 2 >= sorted.length) {
            return new double[0];
        }
        return Arrays.copyOfRange(sorted, drop, sorted.length - drop);
    }

    /**
     * Mean after dropping {@code floor(n * fraction)} values from each end.
     *
     * <p>Two or fewer values are averaged as-is. If trimming would leave nothing, the
     * median of the input is returned.
     */
    public static double trimmedMean(double[] values, double fraction)
    {
        if (values.length == 0) {
            return 0.0;
        }
        if (values.length <= 2) {
            return mean(values);
        }
        double[] trimmed = trim(values, fraction);
        if (trimmed.length == 0) {
            return median(values);
        }
        return mean(trimmed);
    }

    /**
     * Standard deviation with Bessel's correction; 0 for fewer than two values.
     */
    public static double sampleStdDev(double[] values)
    {
        if (values.length < 2) {
            return 0.0;
        }
        double mean = mean(values);
        double sumSquares = 0.0;
        for (double v : values) {
            double d = v - mean;
            sumSquares += d * d;
        }
        return Math.sqrt(sumSquares / (values.length - 1));
    }

    /**
     * Root mean square; 0 for an empty input.
     */
    public static double rms(double[] values)
    {
        if (values.length == 0) {
            return 0.0;
        }
        double sumSquares = 0.0;
        for (double v : values) {
            sumSquares += v * v;
        }
        return Math.sqrt(sumSquares / values.length);
    }

    public static double clamp(double value, double min, double max)
    {
        return Math.max(min, Math.min(max, value));
    }

    private static double[] sorted(double[] values)
    {
        double[] copy = values.clone();
        Arrays.sort(copy);
        return copy;
    }
}
