/* (C)2026 */
package com.ammann.weighing.session;

/**
 * Pull-style accessor for the scale value the operator is currently reading off the display.
 */
@FunctionalInterface
public interface ScaleReadingSource {

    /**
     * @return current scale reading in grams; NaN when nothing has been entered
     */
    double currentReading();
}
