/* (C)2026 */
package com.ammann.weighing.enumeration;

/**
 * Aggregation pipeline that produced a result. Used as a metric tag and in log output.
 */
public enum CalculationMode
{
    /** Live inertial stream plus polled scale readings, optional motion correction. */
    CONTINUOUS,
    /** Discrete operator-entered readings under a locked tare. */
    MANUAL;

    public String tag() {
        return name().toLowerCase();
    }
}
