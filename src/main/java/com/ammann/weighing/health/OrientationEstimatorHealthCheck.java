/* (C)2026 */
package com.ammann.weighing.health;

import com.ammann.weighing.config.EstimatorConfig;
import com.ammann.weighing.service.MotionMeasurementService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Locale;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

/**
 * Health check for the orientation estimator.
 *
 * <p>Status semantics:
 * <ul>
 *   <li>UP: gravity-filter alpha is inside the recommended range; {@code status} reports
 *       WAITING until the first sample has seeded the gravity estimate, then TRACKING</li>
 *   <li>DOWN: alpha is outside [0.90, 0.98], so estimates are sluggish or noisy</li>
 * </ul>
 */
@Readiness
@ApplicationScoped
public class OrientationEstimatorHealthCheck implements HealthCheck {

    @Inject MotionMeasurementService motionService;

    @Override
    public HealthCheckResponse call() {
        EstimatorConfig config = motionService.estimatorConfig();
        boolean alphaInRange = config.isGravityAlphaInRecommendedRange();
        boolean initialized = motionService.isEstimatorInitialized();

        String status;
        if (!alphaInRange) {
            status = "MISCONFIGURED";
        } else {
            status = initialized ? "TRACKING" : "WAITING";
        }

        return HealthCheckResponse.named("orientation-estimator")
                .status(alphaInRange)
                .withData("initialized", initialized)
                .withData("sampling-rate-hz", String.format(Locale.ROOT, "%.1f", motionService.samplingRateHz()))
                .withData("stable", motionService.latestMetrics().stable())
                .withData("gravity-filter-alpha", String.valueOf(config.gravityFilterAlpha()))
                .withData("status", status)
                .build();
    }
}
