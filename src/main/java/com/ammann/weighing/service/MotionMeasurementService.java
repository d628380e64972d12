/* (C)2026 */
package com.ammann.weighing.service;

import com.ammann.weighing.calculation.ResultAggregator;
import com.ammann.weighing.config.EstimatorConfig;
import com.ammann.weighing.config.EstimatorConfigRegistry;
import com.ammann.weighing.enumeration.CalculationMode;
import com.ammann.weighing.exception.ValidationException;
import com.ammann.weighing.model.LiveMetrics;
import com.ammann.weighing.model.MeasurementResult;
import com.ammann.weighing.model.OrientationUpdate;
import com.ammann.weighing.model.RawInertialSample;
import com.ammann.weighing.model.SessionData;
import com.ammann.weighing.model.SessionProgress;
import com.ammann.weighing.sensor.OrientationEstimator;
import com.ammann.weighing.session.ContinuousSession;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Continuous-mode weighing: inertial processing, the live scale value and one continuous
 * session.
 *
 * <p>All public methods are {@code synchronized}; the estimator and the session are not
 * thread-safe and must only be touched from one context at a time.
 *
 * <p>The current {@link EstimatorConfig} is pulled from the registry on every call. The
 * estimator adopts a new snapshot immediately, the session only at its next start.
 */
@ApplicationScoped
public class MotionMeasurementService {

    private static final Logger LOG = Logger.getLogger(MotionMeasurementService.class);

    @Inject EstimatorConfigRegistry configRegistry;

    @Inject MeterRegistry meterRegistry;

    @Inject Clock clock;

    private OrientationEstimator estimator;
    private ContinuousSession session;
    private EstimatorConfig appliedConfig;

    private volatile double currentScaleReading = Double.NaN;
    private MeasurementResult lastResult;

    private Counter samplesProcessedCounter;
    private Counter samplesIgnoredCounter;
    private Counter sessionsCompletedCounter;

    @PostConstruct
    void init() {
        if (clock == null) {
            clock = Clock.systemUTC();
        }
        appliedConfig = configRegistry.current();
        estimator = new OrientationEstimator(appliedConfig);
        session = new ContinuousSession(() -> currentScaleReading, appliedConfig, clock);
        initMetrics();
        LOG.infof("Motion measurement service initialized (alpha=%.2f, window=%.1fs)",
                appliedConfig.gravityFilterAlpha(), appliedConfig.liveWindowSeconds());
    }

    void initMetrics() {
        if (meterRegistry == null) {
            LOG.warn("MeterRegistry not available - metrics disabled");
            return;
        }

        samplesProcessedCounter =
                Counter.builder("weighing.imu.samples.processed")
                        .description("Inertial samples that produced a processed sample")
                        .register(meterRegistry);

        samplesIgnoredCounter =
                Counter.builder("weighing.imu.samples.ignored")
                        .description("Inertial samples ignored (sensor silent or seeding)")
                        .register(meterRegistry);

        sessionsCompletedCounter =
                Counter.builder("weighing.sessions.completed")
                        .description("Completed weighing sessions")
                        .tag("mode", CalculationMode.CONTINUOUS.tag())
                        .register(meterRegistry);
    }

    /**
     * Processes one raw sample and forwards the result to the continuous session when it is
     * active.
     *
     * @return processed sample and live metrics; empty for silent or seeding samples
     */
    public synchronized Optional<OrientationUpdate> ingest(RawInertialSample sample) {
        syncConfig();
        Optional<OrientationUpdate> update = estimator.process(sample);
        if (update.isEmpty()) {
            increment(samplesIgnoredCounter);
            return update;
        }
        increment(samplesProcessedCounter);
        session.addSample(update.get().sample());
        return update;
    }

    /**
     * Sets the value the continuous session polls as the live scale reading.
     */
    public void updateScaleReading(double value) {
        if (Double.isNaN(value)) {
            throw ValidationException.invalidParameter("reading", value, "a number");
        }
        currentScaleReading = value;
    }

    public synchronized LiveMetrics latestMetrics() {
        return estimator.latestMetrics();
    }

    public synchronized void startSession() {
        syncConfig();
        session.start();
        lastResult = null;
    }

    public synchronized SessionProgress progress() {
        return session.progress();
    }

    /**
     * Stops the continuous session and computes its result with the configuration the
     * session ran with.
     *
     * @param bias                    tare bias in grams
     * @param motionCorrectionEnabled apply the vertical-acceleration correction
     * @throws ValidationException if no session is active or the bias is not finite
     */
    public synchronized MeasurementResult stopSession(double bias, boolean motionCorrectionEnabled) {
        if (!session.isActive()) {
            throw ValidationException.sessionNotActive("continuous");
        }
        if (!Double.isFinite(bias)) {
            throw ValidationException.invalidParameter("bias", bias, "a finite number");
        }

        EstimatorConfig sessionConfig = session.activeConfig();
        SessionData data = session.stop();
        MeasurementResult result = new ResultAggregator(sessionConfig)
                .computeContinuous(data, bias, motionCorrectionEnabled);

        lastResult = result;
        increment(sessionsCompletedCounter);
        syncConfig();

        LOG.infof("Continuous session result: %.2f g ± %.2f g (reliable=%s)",
                result.fixedMeasurement(), result.errorBand(), result.reliable());
        return result;
    }

    public synchronized Optional<MeasurementResult> lastResult() {
        return Optional.ofNullable(lastResult);
    }

    /**
     * Drops the collected samples of the running session without stopping it.
     */
    public synchronized void resetSession() {
        session.reset();
    }

    public synchronized void resetEstimator() {
        estimator.reset();
        LOG.info("Orientation estimator reset");
    }

    public synchronized boolean isSessionActive() {
        return session.isActive();
    }

    public synchronized boolean isEstimatorInitialized() {
        return estimator.isInitialized();
    }

    public synchronized double samplingRateHz() {
        return estimator.samplingRateHz();
    }

    public synchronized EstimatorConfig estimatorConfig() {
        syncConfig();
        return estimator.config();
    }

    private void syncConfig() {
        EstimatorConfig current = configRegistry.current();
        if (current != appliedConfig) {
            estimator.updateConfig(current);
            session.updateConfig(current);
            appliedConfig = current;
            LOG.debugf("Applied estimator config %s", current);
        }
    }

    private static void increment(Counter counter) {
        if (counter != null) {
            counter.increment();
        }
    }
}
