/* (C)2026 */
package com.ammann.weighing.model;

/**
 * Everything emitted for one accepted inertial sample.
 *
 * @param sample  derived orientation quantities
 * @param metrics live quality metrics after the sample entered the windows
 */
public record OrientationUpdate(ProcessedSample sample, LiveMetrics metrics) {}
