/* (C)2026 */
package com.ammann.weighing.model;

/**
 * Zero-load scale reading.
 *
 * @param timestamp entry time in epoch milliseconds
 * @param reading   reading in grams
 */
public record TareSample(long timestamp, double reading) {}
