/* (C)2026 */
package com.ammann.weighing.sensor;

import com.ammann.weighing.config.EstimatorConfig;
import com.ammann.weighing.math.VectorMath;
import com.ammann.weighing.model.LiveMetrics;
import com.ammann.weighing.model.OrientationUpdate;
import com.ammann.weighing.model.ProcessedSample;
import com.ammann.weighing.model.RawInertialSample;
import com.ammann.weighing.model.Vector3;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Derives gravity, vertical acceleration and roll/pitch from raw accelerometer samples and
 * tracks live motion quality.
 *
 * <p>Gravity is an exponential low-pass estimate of the acceleration-including-gravity
 * vector: {@code g = alpha * g + (1 - alpha) * a}. The first valid sample seeds the estimate
 * directly and produces no output. Every later sample yields one {@link OrientationUpdate}.
 *
 * <h3>Angles</h3>
 * <p>Derived from the unit gravity vector only (no gyroscope, no magnetometer):
 * <pre>
 * pitch = atan2(-g.x, hypot(g.y, g.z))
 * roll  = atan2(g.y, g.z)
 * </pre>
 * These assume a static or slowly accelerating platform.
 *
 * <h3>Live gating</h3>
 * <p>Stable when the RMS of a_z, roll and pitch over the trailing window are all strictly
 * below their thresholds. The confidence score averages {@code max(0, 1 - rms / (2 * T))}
 * over the three channels.
 *
 * <p>Single-threaded: one sample is fully processed before the next is accepted.
 */
public class OrientationEstimator {

    /** Sample-rate ceiling used to size the live windows. */
    static final int ASSUMED_MAX_RATE_HZ = 200;

    static final int RATE_ESTIMATE_INTERVALS = 100;

    private EstimatorConfig config;

    private Vector3 gravityEstimate = Vector3.ZERO;
    private boolean initialized;

    private final RingWindow azWindow;
    private final RingWindow rollWindow;
    private final RingWindow pitchWindow;

    private boolean hasPreviousTimestamp;
    private long lastTimestamp;
    private final Deque<Long> intervals = new ArrayDeque<>();
    private long intervalSum;

    private LiveMetrics latestMetrics = LiveMetrics.NONE;

    public OrientationEstimator(EstimatorConfig config) {
        this.config = config;
        int capacity = (int) Math.ceil(ASSUMED_MAX_RATE_HZ * config.liveWindowSeconds());
        this.azWindow = new RingWindow(capacity);
        this.rollWindow = new RingWindow(capacity);
        this.pitchWindow = new RingWindow(capacity);
    }

    /**
     * Processes one raw sample.
     *
     * @param raw raw inertial sample
     * @return the derived sample and live metrics, or empty when the sample carried no
     *         acceleration or only seeded the gravity estimate
     */
    public Optional<OrientationUpdate> process(RawInertialSample raw) {
        if (raw.accelerationIncludingGravity().isEmpty()) {
            return Optional.empty();
        }

        Vector3 acceleration = raw.accelerationIncludingGravity().get();
        long timestamp = raw.timestamp();

        if (!initialized) {
            gravityEstimate = acceleration;
            initialized = true;
            recordTimestamp(timestamp);
            return Optional.empty();
        }

        gravityEstimate = VectorMath.blend(gravityEstimate, acceleration, config.gravityFilterAlpha());

        Vector3 linear = acceleration.minus(gravityEstimate);
        Vector3 unit = VectorMath.normalize(gravityEstimate);
        double az = VectorMath.dot(linear, unit);

        double pitch = VectorMath.radToDeg(Math.atan2(-unit.x(), Math.hypot(unit.y(), unit.z())));
        double roll = VectorMath.radToDeg(Math.atan2(unit.y(), unit.z()));

        azWindow.push(az, timestamp);
        rollWindow.push(roll, timestamp);
        pitchWindow.push(pitch, timestamp);

        recordTimestamp(timestamp);

        ProcessedSample sample = new ProcessedSample(
                az, roll, pitch, gravityEstimate, unit, linear, timestamp);
        latestMetrics = computeMetrics(az, roll, pitch);
        return Optional.of(new OrientationUpdate(sample, latestMetrics));
    }

    private LiveMetrics computeMetrics(double az, double roll, double pitch) {
        long windowMs = config.liveWindowMillis();
        double rmsAz = azWindow.rmsInWindow(windowMs);
        double rmsRoll = rollWindow.rmsInWindow(windowMs);
        double rmsPitch = pitchWindow.rmsInWindow(windowMs);

        boolean stable = rmsAz < config.azRmsThreshold()
                && rmsRoll < config.rollRmsThreshold()
                && rmsPitch < config.pitchRmsThreshold();

        double confidence = (channelScore(rmsAz, config.azRmsThreshold())
                + channelScore(rmsRoll, config.rollRmsThreshold())
                + channelScore(rmsPitch, config.pitchRmsThreshold())) / 3.0;

        return new LiveMetrics(
                az, roll, pitch,
                rmsAz, rmsRoll, rmsPitch,
                samplingRateHz(),
                stable,
                Math.max(0.0, Math.min(1.0, confidence)));
    }

    private static double channelScore(double rms, double threshold) {
        return Math.max(0.0, 1.0 - rms / (2.0 * threshold));
    }

    private void recordTimestamp(long timestamp) {
        if (hasPreviousTimestamp) {
            long interval = timestamp - lastTimestamp;
            intervals.addLast(interval);
            intervalSum += interval;
            if (intervals.size() > RATE_ESTIMATE_INTERVALS) {
                intervalSum -= intervals.removeFirst();
            }
        }
        lastTimestamp = timestamp;
        hasPreviousTimestamp = true;
    }

    /**
     * Average rate over the last {@value #RATE_ESTIMATE_INTERVALS} intervals; 0 when unknown.
     */
    public double samplingRateHz() {
        if (intervals.isEmpty()) {
            return 0.0;
        }
        double averageInterval = (double) intervalSum / intervals.size();
        return averageInterval > 0 ? 1000.0 / averageInterval : 0.0;
    }

    /**
     * Adopts a new configuration for all subsequent samples. The window capacity chosen at
     * construction is kept.
     */
    public void updateConfig(EstimatorConfig config) {
        this.config = config;
    }

    /**
     * Clears the windows and the rate estimate and re-arms first-sample seeding.
     */
    public void reset() {
        initialized = false;
        gravityEstimate = Vector3.ZERO;
        azWindow.clear();
        rollWindow.clear();
        pitchWindow.clear();
        intervals.clear();
        intervalSum = 0L;
        hasPreviousTimestamp = false;
        lastTimestamp = 0L;
        latestMetrics = LiveMetrics.NONE;
    }

    public EstimatorConfig config() {
        return config;
    }

    public boolean isInitialized() {
        return initialized;
    }

    public Vector3 gravityEstimate() {
        return gravityEstimate;
    }

    public LiveMetrics latestMetrics() {
        return latestMetrics;
    }

    int windowCapacity() {
        return azWindow.capacity();
    }
}
