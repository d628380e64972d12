/* (C)2026 */
package com.ammann.weighing.model;

/**
 * Scalar with its capture time in milliseconds.
 */
public record TimestampedValue(double value, long timestamp) {}
