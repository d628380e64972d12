/* (C)2026 */
package com.ammann.weighing.service;

import com.ammann.weighing.calculation.RatioAggregator;
import com.ammann.weighing.calculation.ResultAggregator;
import com.ammann.weighing.config.EstimatorConfig;
import com.ammann.weighing.config.EstimatorConfigRegistry;
import com.ammann.weighing.enumeration.CalculationMode;
import com.ammann.weighing.enumeration.SessionKind;
import com.ammann.weighing.exception.ValidationException;
import com.ammann.weighing.model.ManualMeasurement;
import com.ammann.weighing.model.QualitySnapshot;
import com.ammann.weighing.model.RatioResult;
import com.ammann.weighing.model.SessionResult;
import com.ammann.weighing.model.TareEstimate;
import com.ammann.weighing.model.TareSample;
import com.ammann.weighing.session.ManualSession;
import com.ammann.weighing.session.TareEstimator;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Manual-mode weighing: tare collection, one manual session per {@link SessionKind} and the
 * base/final ratio.
 *
 * <p>Starting a session locks the tare estimate in force at that moment (the user-entered
 * tare when present, else the sample-based one) together with the configuration snapshot
 * used when the session is stopped. Results are kept per kind until that kind
 * is started again, and the ratio is recomputed from whatever results are present.
 */
@ApplicationScoped
public class ManualWeighingService {

    private static final Logger LOG = Logger.getLogger(ManualWeighingService.class);

    @Inject EstimatorConfigRegistry configRegistry;

    @Inject MeterRegistry meterRegistry;

    @Inject Clock clock;

    private TareEstimator tareEstimator;
    private TareEstimate manualTare;
    private final Map<SessionKind, ManualSession> sessions = new EnumMap<>(SessionKind.class);
    private final Map<SessionKind, SessionResult> results = new EnumMap<>(SessionKind.class);
    private final Map<SessionKind, EstimatorConfig> sessionConfigs = new EnumMap<>(SessionKind.class);
    private final RatioAggregator ratioAggregator = new RatioAggregator();

    private Counter sessionsCompletedCounter;

    @PostConstruct
    void init() {
        if (clock == null) {
            clock = Clock.systemUTC();
        }
        tareEstimator = new TareEstimator(clock);
        for (SessionKind kind : SessionKind.values()) {
            sessions.put(kind, new ManualSession(kind, clock));
        }
        if (meterRegistry != null) {
            sessionsCompletedCounter =
                    Counter.builder("weighing.sessions.completed")
                            .description("Completed weighing sessions")
                            .tag("mode", CalculationMode.MANUAL.tag())
                            .register(meterRegistry);
        }
    }

    // Tare

    public synchronized TareEstimate addTareSample(double reading) {
        try {
            tareEstimator.addTareSample(reading);
        } catch (ValidationException e) {
            recordRejected("tare");
            throw e;
        }
        return tareEstimate();
    }

    public synchronized TareEstimate removeTareSample(int index) {
        tareEstimator.removeTareSample(index);
        return tareEstimate();
    }

    public synchronized void clearTareSamples() {
        tareEstimator.clear();
    }

    public synchronized List<TareSample> tareSamples() {
        return tareEstimator.samples();
    }

    /**
     * Current tare: the user-entered one when present, else the estimate from the samples.
     */
    public synchronized TareEstimate tareEstimate() {
        return manualTare != null ? manualTare : tareEstimator.estimate();
    }

    public synchronized TareEstimate enterManualTare(double bias, double tareUncertainty95) {
        manualTare = TareEstimator.manualEstimate(bias, tareUncertainty95);
        LOG.infof("Manual tare entered: %.3f g ± %.3f g", bias, tareUncertainty95);
        return manualTare;
    }

    public synchronized void clearManualTare() {
        manualTare = null;
    }

    // Sessions

    /**
     * Starts (or restarts) the session of {@code kind}, locking the current tare and
     * discarding the previous result of that kind.
     */
    public synchronized TareEstimate startSession(SessionKind kind) {
        TareEstimate tare = tareEstimate();
        sessions.get(kind).startSession(tare.biasMedian(), tare.tareUncertainty95());
        sessionConfigs.put(kind, configRegistry.current());
        results.remove(kind);
        LOG.infof("Manual %s session started with bias %.3f g (%s)", kind, tare.biasMedian(), tare.method());
        return tare;
    }

    public synchronized ManualMeasurement addMeasurement(SessionKind kind, double reading, QualitySnapshot quality) {
        try {
            return sessions.get(kind).addMeasurement(reading, quality);
        } catch (ValidationException e) {
            recordRejected("measurement");
            throw e;
        }
    }

    public synchronized void removeMeasurement(SessionKind kind, int index) {
        sessions.get(kind).removeMeasurement(index);
    }

    public synchronized List<ManualMeasurement> measurements(SessionKind kind) {
        return sessions.get(kind).measurements();
    }

    public synchronized boolean isSessionActive(SessionKind kind) {
        return sessions.get(kind).isActive();
    }

    /**
     * Stops the session of {@code kind} and computes its result.
     *
     * @throws ValidationException if the session is not active
     */
    public synchronized SessionResult stopSession(SessionKind kind) {
        ManualSession session = sessions.get(kind);
        if (!session.isActive()) {
            throw ValidationException.sessionNotActive(kind.name());
        }

        List<ManualMeasurement> measurements = session.stopSession();
        EstimatorConfig config = sessionConfigs.getOrDefault(kind, configRegistry.current());
        SessionResult result = new ResultAggregator(config).computeManual(kind, measurements);
        results.put(kind, result);
        if (sessionsCompletedCounter != null) {
            sessionsCompletedCounter.increment();
        }

        LOG.infof("Manual %s session stopped: %.2f g ± %.2f g from %d measurements",
                kind, result.fixedValue(), result.errorBand95(), result.nTotal());
        return result;
    }

    public synchronized Optional<SessionResult> sessionResult(SessionKind kind) {
        return Optional.ofNullable(results.get(kind));
    }

    /**
     * Ratio of the latest base and final results.
     *
     * @return empty until both sessions have been completed
     */
    public synchronized Optional<RatioResult> ratio() {
        SessionResult base = results.get(SessionKind.BASE);
        SessionResult fin = results.get(SessionKind.FINAL);
        if (base == null || fin == null) {
            return Optional.empty();
        }
        return Optional.of(ratioAggregator.compute(base, fin));
    }

    private void recordRejected(String input) {
        if (meterRegistry == null) {
            return;
        }

        Counter.builder("weighing.inputs.rejected")
                .description("Inputs rejected by validation")
                .tag("input", input)
                .register(meterRegistry)
                .increment();
    }
}
