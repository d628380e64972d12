/* (C)2026 */
package com.ammann.weighing.session;

import com.ammann.weighing.config.EstimatorConfig;
import com.ammann.weighing.math.Statistics;
import com.ammann.weighing.model.ProcessedSample;
import com.ammann.weighing.model.SessionData;
import com.ammann.weighing.model.SessionProgress;
import com.ammann.weighing.model.SessionSample;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Collects processed inertial samples together with the live scale value during a
 * continuous measurement.
 *
 * <p>Lifecycle is {@code Idle -> Active -> Idle}; there is no pause. The scale value is
 * polled at the configured cadence (5 Hz by default) and held between polls, so scale input
 * latency is independent of the inertial rate.
 *
 * <p>Each sample is flagged good when |a_z|, |roll| and |pitch| are all below the
 * instantaneous thresholds. These are looser than the RMS thresholds behind the live
 * stability flag and are configured separately.
 *
 * <p>A configuration passed to {@link #updateConfig(EstimatorConfig)} takes effect at the
 * next {@link #start()}; a running session keeps the snapshot it started with.
 */
public class ContinuousSession {

    private static final Logger LOG = Logger.getLogger(ContinuousSession.class);

    private final ScaleReadingSource scaleSource;
    private final Clock clock;

    private EstimatorConfig pendingConfig;
    private EstimatorConfig activeConfig;

    private boolean active;
    private final List<SessionSample> samples = new ArrayList<>();
    private long startTime;
    private boolean scaleSampled;
    private long lastScaleSampleTime;
    private double heldScaleReading;

    public ContinuousSession(ScaleReadingSource scaleSource, EstimatorConfig config, Clock clock) {
        this.scaleSource = scaleSource;
        this.clock = clock;
        this.pendingConfig = config;
        this.activeConfig = config;
    }

    /**
     * Starts collecting. Ignored when the session is already active.
     */
    public void start() {
        if (active) {
            LOG.debug("Continuous session already active, start ignored");
            return;
        }
        activeConfig = pendingConfig;
        active = true;
        samples.clear();
        startTime = clock.millis();
        scaleSampled = false;
        lastScaleSampleTime = 0L;
        heldScaleReading = 0.0;
        LOG.infof("Continuous session started at %d", startTime);
    }

    /**
     * Appends one processed sample. Ignored while idle.
     */
    public void addSample(ProcessedSample processed) {
        if (!active) {
            return;
        }

        long now = clock.millis();
        if (!scaleSampled || now - lastScaleSampleTime >= activeConfig.scaleSampleIntervalMillis()) {
            heldScaleReading = scaleSource.currentReading();
            lastScaleSampleTime = now;
            scaleSampled = true;
        }

        boolean good = Math.abs(processed.verticalAcceleration()) < activeConfig.azInstantThreshold()
                && Math.abs(processed.roll()) < activeConfig.rollInstantThreshold()
                && Math.abs(processed.pitch()) < activeConfig.pitchInstantThreshold();

        samples.add(new SessionSample(
                processed.timestamp(),
                processed.verticalAcceleration(),
                processed.roll(),
                processed.pitch(),
                heldScaleReading,
                good));
    }

    /**
     * Stops collecting and summarizes the session.
     *
     * @return immutable snapshot; an empty all-zero snapshot when the session was idle
     */
    public SessionData stop() {
        if (!active) {
            return SessionData.empty();
        }

        active = false;
        long endTime = clock.millis();

        double[] az = samples.stream().mapToDouble(SessionSample::verticalAcceleration).toArray();
        double[] roll = samples.stream().mapToDouble(SessionSample::roll).toArray();
        double[] pitch = samples.stream().mapToDouble(SessionSample::pitch).toArray();
        long good = samples.stream().filter(SessionSample::good).count();

        SessionData data = new SessionData(
                samples,
                startTime,
                endTime,
                (endTime - startTime) / 1000.0,
                Statistics.rms(az),
                Statistics.rms(roll),
                Statistics.rms(pitch),
                samples.isEmpty() ? 0.0 : good * 100.0 / samples.size());

        LOG.infof("Continuous session stopped: %d samples (%.1f%% good) in %.1fs",
                samples.size(), data.percentGood(), data.durationSeconds());
        return data;
    }

    public SessionProgress progress() {
        if (!active) {
            return SessionProgress.IDLE;
        }
        int goodCount = (int) samples.stream().filter(SessionSample::good).count();
        return new SessionProgress(true, (clock.millis() - startTime) / 1000.0, samples.size(), goodCount);
    }

    /**
     * Drops collected samples without changing the active state.
     */
    public void reset() {
        samples.clear();
        startTime = active ? clock.millis() : 0L;
        scaleSampled = false;
        lastScaleSampleTime = 0L;
    }

    public void updateConfig(EstimatorConfig config) {
        this.pendingConfig = config;
        if (!active) {
            this.activeConfig = config;
        }
    }

    /**
     * Configuration the current (or most recent) session runs with.
     */
    public EstimatorConfig activeConfig() {
        return activeConfig;
    }

    public boolean isActive() {
        return active;
    }
}
