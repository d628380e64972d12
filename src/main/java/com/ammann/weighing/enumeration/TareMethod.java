/* (C)2026 */
package com.ammann.weighing.enumeration;

/**
 * Provenance of a tare estimate.
 */
public enum TareMethod
{
    /** Bias is the median of collected zero-load readings, uncertainty is half their range. */
    HALF_RANGE,
    /** Bias and 95% uncertainty were typed in by the operator. */
    USER_ENTERED
}
