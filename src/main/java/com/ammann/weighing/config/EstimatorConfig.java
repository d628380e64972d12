/* (C)2026 */
package com.ammann.weighing.config;

/**
 * Immutable set of thresholds and coefficients shared by the estimation components.
 *
 * <p>Passed explicitly to every component that needs it. A new snapshot replaces the old
 * one as a whole; sessions keep the snapshot they were started with.
 *
 * @param azRmsThreshold        T_az_rms, live RMS gate on vertical acceleration (m/s²)
 * @param rollRmsThreshold      T_roll_rms, live RMS gate on roll (deg)
 * @param pitchRmsThreshold     T_pitch_rms, live RMS gate on pitch (deg)
 * @param azInstantThreshold    T_az_instant, per-sample gate on |a_z| (m/s²)
 * @param rollInstantThreshold  T_roll_instant, per-sample gate on |roll| (deg)
 * @param pitchInstantThreshold T_pitch_instant, per-sample gate on |pitch| (deg)
 * @param gravityFilterAlpha    smoothing coefficient of the gravity filter, 0.90-0.98 recommended
 * @param sampleMassDefault     nominal sample mass in grams
 * @param scaleSampleRateHz     cadence at which the live scale value is polled
 * @param liveWindowSeconds     trailing window of the live RMS metrics
 * @param uncertaintyK          worst-case excursion factor of the motion uncertainty term
 * @param standardGravity       g in m/s²
 * @param trimFraction          share dropped from each end by the robust means
 */
public record EstimatorConfig(
        double azRmsThreshold,
        double rollRmsThreshold,
        double pitchRmsThreshold,
        double azInstantThreshold,
        double rollInstantThreshold,
        double pitchInstantThreshold,
        double gravityFilterAlpha,
        double sampleMassDefault,
        double scaleSampleRateHz,
        double liveWindowSeconds,
        double uncertaintyK,
        double standardGravity,
        double trimFraction) {

    public static final double DEFAULT_AZ_RMS = 0.35;
    public static final double DEFAULT_ROLL_RMS = 2.5;
    public static final double DEFAULT_PITCH_RMS = 2.5;
    public static final double DEFAULT_AZ_INSTANT = 0.8;
    public static final double DEFAULT_ROLL_INSTANT = 6.0;
    public static final double DEFAULT_PITCH_INSTANT = 6.0;
    public static final double DEFAULT_GRAVITY_ALPHA = 0.92;
    public static final double DEFAULT_SAMPLE_MASS = 150.0;
    public static final double DEFAULT_SCALE_SAMPLE_RATE = 5.0;
    public static final double DEFAULT_LIVE_WINDOW = 5.0;
    public static final double DEFAULT_UNCERTAINTY_K = 2.0;
    public static final double STANDARD_GRAVITY = 9.80665;
    public static final double DEFAULT_TRIM_FRACTION = 0.10;

    public static final double MIN_RECOMMENDED_ALPHA = 0.90;
    public static final double MAX_RECOMMENDED_ALPHA = 0.98;

    public EstimatorConfig {
        if (!(scaleSampleRateHz > 0)) {
            throw new IllegalArgumentException("scaleSampleRateHz must be positive, got " + scaleSampleRateHz);
        }
        if (!(liveWindowSeconds > 0)) {
            throw new IllegalArgumentException("liveWindowSeconds must be positive, got " + liveWindowSeconds);
        }
        if (!(standardGravity > 0)) {
            throw new IllegalArgumentException("standardGravity must be positive, got " + standardGravity);
        }
        if (trimFraction < 0 || trimFraction >= 0.5) {
            throw new IllegalArgumentException("trimFraction must be in [0, 0.5), got " + trimFraction);
        }
    }

    public static EstimatorConfig defaults() {
        return new EstimatorConfig(
                DEFAULT_AZ_RMS,
                DEFAULT_ROLL_RMS,
                DEFAULT_PITCH_RMS,
                DEFAULT_AZ_INSTANT,
                DEFAULT_ROLL_INSTANT,
                DEFAULT_PITCH_INSTANT,
                DEFAULT_GRAVITY_ALPHA,
                DEFAULT_SAMPLE_MASS,
                DEFAULT_SCALE_SAMPLE_RATE,
                DEFAULT_LIVE_WINDOW,
                DEFAULT_UNCERTAINTY_K,
                STANDARD_GRAVITY,
                DEFAULT_TRIM_FRACTION);
    }

    public long liveWindowMillis() {
        return Math.round(liveWindowSeconds * 1000.0);
    }

    public double scaleSampleIntervalMillis() {
        return 1000.0 / scaleSampleRateHz;
    }

    /**
     * Values outside the recommended range still work but make the gravity estimate either
     * sluggish or noisy.
     */
    public boolean isGravityAlphaInRecommendedRange() {
        return gravityFilterAlpha >= MIN_RECOMMENDED_ALPHA && gravityFilterAlpha <= MAX_RECOMMENDED_ALPHA;
    }

    public EstimatorConfig withGravityFilterAlpha(double alpha) {
        return new EstimatorConfig(
                azRmsThreshold, rollRmsThreshold, pitchRmsThreshold,
                azInstantThreshold, rollInstantThreshold, pitchInstantThreshold,
                alpha, sampleMassDefault, scaleSampleRateHz, liveWindowSeconds,
                uncertaintyK, standardGravity, trimFraction);
    }
}
