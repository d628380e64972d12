/* (C)2026 */
package com.ammann.weighing.model;

/**
 * Running counters of an active continuous session.
 */
public record SessionProgress(boolean active, double elapsedSeconds, int sampleCount, int goodCount) {

    public static final SessionProgress IDLE = new SessionProgress(false, 0.0, 0, 0);
}
