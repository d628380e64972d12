/* (C)2026 */
package com.ammann.weighing;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.weighing.config.EstimatorConfig;
import com.ammann.weighing.config.EstimatorConfigRegistry;
import com.ammann.weighing.enumeration.SessionKind;
import com.ammann.weighing.health.OrientationEstimatorHealthCheck;
import com.ammann.weighing.model.SessionResult;
import com.ammann.weighing.service.ManualWeighingService;
import com.ammann.weighing.service.MotionMeasurementService;
import io.micrometer.core.instrument.MeterRegistry;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import org.junit.jupiter.api.Test;

@QuarkusTest
class WeighingApplicationWiringTest {

    @Inject
    EstimatorConfigRegistry configRegistry;

    @Inject
    MotionMeasurementService motionService;

    @Inject
    ManualWeighingService weighingService;

    @Inject
    @Readiness
    OrientationEstimatorHealthCheck healthCheck;

    @Inject
    MeterRegistry meterRegistry;

    @Test
    void startupConfigurationMatchesDefaults() {
        assertThat(configRegistry.current()).isEqualTo(EstimatorConfig.defaults());
        assertThat(motionService.estimatorConfig()).isEqualTo(EstimatorConfig.defaults());
    }

    @Test
    void healthCheckIsUpWithDefaultAlpha() {
        assertThat(healthCheck.call().getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
    }

    @Test
    void manualSessionRunsThroughInjectedServices() {
        weighingService.startSession(SessionKind.BASE);
        weighingService.addMeasurement(SessionKind.BASE, 100.0, null);
        SessionResult result = weighingService.stopSession(SessionKind.BASE);

        assertThat(result.fixedValue()).isEqualTo(100.0);
        assertThat(meterRegistry.find("weighing.sessions.completed").tag("mode", "manual").counter())
                .isNotNull();
    }
}
