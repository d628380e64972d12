/* (C)2026 */
package com.ammann.weighing.math;

/**
 * Two-sided 95% Student-t multipliers ("k-factors") by sample count.
 *
 * <p>Tabulated degrees of freedom are 1-10, 12, 15, 20, 25 and 30; values in between are
 * linearly interpolated. From 30 to 100 degrees of freedom the multiplier is interpolated
 * linearly towards the normal value 1.960, which is used as-is from 100 on.
 */
public final class ConfidenceTable {

    /** Multiplier used when a single value cannot support a t-interval. Not statistically derived. */
    public static final double FALLBACK_K = 2.0;

    /** Normal-distribution limit of the two-sided 95% multiplier. */
    public static final double ASYMPTOTIC_K = 1.960;

    private static final int[] DF = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 12, 15, 20, 25, 30};
    private static final double[] T95 = {
        12.706, 4.303, 3.182, 2.776, 2.571, 2.447, 2.365, 2.306, 2.262, 2.228,
        2.179, 2.131, 2.086, 2.060, 2.042
    };

    private static final int LAST_TABULATED_DF = 30;
    private static final int ASYMPTOTIC_DF = 100;

    private ConfidenceTable() {}

    /**
     * Returns the 95% multiplier for {@code n} samples ({@code df = n - 1}).
     *
     * @param n sample count
     * @return k-factor; {@link #FALLBACK_K} for {@code n <= 1}
     */
    public static double kFromN(int n) {
        if (n <= 1) {
            return FALLBACK_K;
        }

        int df = n - 1;
        if (df >= ASYMPTOTIC_DF) {
            return ASYMPTOTIC_K;
        }
        if (df >= LAST_TABULATED_DF) {
            double t30 = T95[T95.length - 1];
            double slope = (t30 - ASYMPTOTIC_K) / (ASYMPTOTIC_DF - LAST_TABULATED_DF);
            return Math.max(ASYMPTOTIC_K, t30 - (df - LAST_TABULATED_DF) * slope);
        }

        for (int i = 0; i < DF.length - 1; i++) {
            if (df >= DF[i] && df <= DF[i + 1]) {
                if (df == DF[i]) {
                    return T95[i];
                }
                double fraction = (double) (df - DF[i]) / (DF[i + 1] - DF[i]);
                return T95[i] + fraction * (T95[i + 1] - T95[i]);
            }
        }
        // unreachable for 1 <= df < 30
        return T95[0];
    }

    /**
     * The weaker of two sessions bounds the confidence of a quantity derived from both.
     */
    public static int effectiveN(int nBase, int nFinal) {
        return Math.min(nBase, nFinal);
    }
}
