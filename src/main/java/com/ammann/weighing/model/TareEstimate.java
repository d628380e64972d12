/* (C)2026 */
package com.ammann.weighing.model;

import com.ammann.weighing.enumeration.TareMethod;

/**
 * Scale bias with its uncertainty.
 *
 * @param count             number of tare samples behind the estimate, 0 for user-entered values
 * @param biasMedian        bias in grams
 * @param tareUncertainty95 95% tare uncertainty in grams
 * @param tareSigma         1-sigma equivalent, half of the 95% value
 * @param method            provenance of the values
 */
public record TareEstimate(
        int count,
        double biasMedian,
        double tareUncertainty95,
        double tareSigma,
        TareMethod method) {

    public static final TareEstimate NONE = new TareEstimate(0, 0.0, 0.0, 0.0, TareMethod.HALF_RANGE);
}
