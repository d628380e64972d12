/* (C)2026 */
package com.ammann.weighing.support;

import com.ammann.weighing.config.EstimatorConfig;
import com.ammann.weighing.enumeration.SessionKind;
import com.ammann.weighing.math.VectorMath;
import com.ammann.weighing.model.ManualMeasurement;
import com.ammann.weighing.model.ProcessedSample;
import com.ammann.weighing.model.QualitySnapshot;
import com.ammann.weighing.model.RawInertialSample;
import com.ammann.weighing.model.SessionData;
import com.ammann.weighing.model.SessionResult;
import com.ammann.weighing.model.SessionSample;
import com.ammann.weighing.model.Vector3;
import java.util.ArrayList;
import java.util.List;

public final class TestDataFactory {

    public static final double G = EstimatorConfig.STANDARD_GRAVITY;

    private TestDataFactory() {}

    /** Device lying flat, gravity along +z. */
    public static Vector3 flat() {
        return new Vector3(0.0, 0.0, G);
    }

    /** Gravity vector of a device rolled by {@code rollDeg} about the x axis. */
    public static Vector3 rolled(double rollDeg) {
        double rad = VectorMath.degToRad(rollDeg);
        return new Vector3(0.0, G * Math.sin(rad), G * Math.cos(rad));
    }

    public static RawInertialSample raw(Vector3 acceleration, long timestamp) {
        return RawInertialSample.of(acceleration, timestamp);
    }

    public static ProcessedSample processed(double az, double roll, double pitch, long timestamp) {
        Vector3 g = flat();
        return new ProcessedSample(az, roll, pitch, g, VectorMath.normalize(g), Vector3.ZERO, timestamp);
    }

    public static SessionSample sessionSample(double reading, double az, boolean good) {
        return new SessionSample(0L, az, 0.0, 0.0, reading, good);
    }

    /**
     * Session of motionless samples, all good, with the given readings.
     */
    public static SessionData quietSession(double... readings) {
        List<SessionSample> samples = new ArrayList<>();
        for (double r : readings) {
            samples.add(sessionSample(r, 0.0, true));
        }
        return sessionData(samples, 0.0);
    }

    public static SessionData sessionData(List<SessionSample> samples, double rmsAz) {
        long good = samples.stream().filter(SessionSample::good).count();
        double percentGood = samples.isEmpty() ? 0.0 : good * 100.0 / samples.size();
        return new SessionData(samples, 1_000L, 11_000L, 10.0, rmsAz, 0.0, 0.0, percentGood);
    }

    public static ManualMeasurement measurement(double corrected, double bias, double unc95) {
        return new ManualMeasurement(0L, SessionKind.BASE, corrected + bias, bias, unc95, corrected, null);
    }

    public static ManualMeasurement measurement(double corrected, double bias, double unc95, double qualityScore) {
        return new ManualMeasurement(
                0L, SessionKind.BASE, corrected + bias, bias, unc95, corrected,
                new QualitySnapshot(qualityScore, 0.1, 0.5, 0.5));
    }

    public static List<ManualMeasurement> measurements(double bias, double unc95, double... corrected) {
        List<ManualMeasurement> result = new ArrayList<>();
        for (double c : corrected) {
            result.add(measurement(c, bias, unc95));
        }
        return result;
    }

    /**
     * Minimal completed session for ratio tests.
     */
    public static SessionResult sessionResult(
            SessionKind kind, double fixedValue, double total1Sigma, int nTrim, double tareUnc95) {
        return new SessionResult(
                kind, List.of(), nTrim, nTrim, 0.1,
                0.0, tareUnc95, tareUnc95 / 2.0,
                fixedValue, fixedValue, fixedValue, fixedValue,
                0.0, 0.0, total1Sigma, 2.0 * total1Sigma, 0.0, 0.7, 2.0,
                List.of());
    }
}
