/* (C)2026 */
package com.ammann.weighing.session;

import com.ammann.weighing.enumeration.SessionKind;
import com.ammann.weighing.exception.ValidationException;
import com.ammann.weighing.model.ManualMeasurement;
import com.ammann.weighing.model.QualitySnapshot;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Discrete operator-entered readings under a tare locked at session start.
 *
 * <p>The bias and tare uncertainty passed to {@link #startSession(double, double)} are frozen
 * into every measurement of that activation; later tare changes never touch measurements
 * already collected.
 */
public class ManualSession {

    private final SessionKind kind;
    private final Clock clock;

    private boolean active;
    private final List<ManualMeasurement> measurements = new ArrayList<>();
    private double lockedBias;
    private double lockedTareUncertainty95;

    public ManualSession(SessionKind kind, Clock clock) {
        this.kind = kind;
        this.clock = clock;
    }

    /**
     * Activates the session, discarding earlier measurements.
     *
     * @param bias              bias to lock, in grams
     * @param tareUncertainty95 95% tare uncertainty to lock, in grams
     */
    public void startSession(double bias, double tareUncertainty95) {
        active = true;
        measurements.clear();
        lockedBias = bias;
        lockedTareUncertainty95 = tareUncertainty95;
    }

    public ManualMeasurement addMeasurement(double scaleReading) {
        return addMeasurement(scaleReading, null);
    }

    /**
     * Records a reading corrected by the locked bias.
     *
     * @param scaleReading raw reading in grams
     * @param quality      live motion quality at entry time, may be {@code null}
     * @return the stored measurement
     * @throws ValidationException if the session is not active or the reading is NaN or not positive
     */
    public ManualMeasurement addMeasurement(double scaleReading, QualitySnapshot quality) {
        if (!active) {
            throw ValidationException.sessionNotActive(kind.name());
        }
        if (Double.isNaN(scaleReading) || scaleReading <= 0) {
            throw ValidationException.invalidParameter("scaleReading", scaleReading, "a positive number");
        }

        ManualMeasurement measurement = new ManualMeasurement(
                clock.millis(),
                kind,
                scaleReading,
                lockedBias,
                lockedTareUncertainty95,
                scaleReading - lockedBias,
                quality);
        measurements.add(measurement);
        return measurement;
    }

    /**
     * Removes the measurement at {@code index}; out-of-range indices are ignored.
     */
    public void removeMeasurement(int index) {
        if (index >= 0 && index < measurements.size()) {
            measurements.remove(index);
        }
    }

    /**
     * Deactivates the session.
     *
     * @return the collected measurements
     */
    public List<ManualMeasurement> stopSession() {
        active = false;
        return List.copyOf(measurements);
    }

    /**
     * Drops all measurements but stays active.
     */
    public void clear() {
        measurements.clear();
    }

    public List<ManualMeasurement> measurements() {
        return List.copyOf(measurements);
    }

    public int count() {
        return measurements.size();
    }

    public boolean canCalculate() {
        return !measurements.isEmpty();
    }

    public boolean isActive() {
        return active;
    }

    public double lockedBias() {
        return lockedBias;
    }

    public double lockedTareUncertainty95() {
        return lockedTareUncertainty95;
    }

    public SessionKind kind() {
        return kind;
    }
}
