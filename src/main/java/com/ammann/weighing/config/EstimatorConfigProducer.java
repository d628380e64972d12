/* (C)2026 */
package com.ammann.weighing.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.time.Clock;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * CDI producer for the startup {@link EstimatorConfig} snapshot and the wall clock.
 *
 * <p>Configuration properties (defaults match the product tuning table):
 * <ul>
 *   <li>weighing.gating.az-rms / roll-rms / pitch-rms</li>
 *   <li>weighing.gating.az-instant / roll-instant / pitch-instant</li>
 *   <li>weighing.filter.gravity-alpha</li>
 *   <li>weighing.sample.mass-default</li>
 *   <li>weighing.scale.sample-rate-hz</li>
 *   <li>weighing.live.window-seconds</li>
 *   <li>weighing.uncertainty.k</li>
 *   <li>weighing.gravity.standard</li>
 *   <li>weighing.aggregation.trim-fraction</li>
 * </ul>
 */
@ApplicationScoped
public class EstimatorConfigProducer {

    private static final Logger LOG = Logger.getLogger(EstimatorConfigProducer.class);

    @ConfigProperty(name = "weighing.gating.az-rms", defaultValue = "0.35")
    double azRms;

    @ConfigProperty(name = "weighing.gating.roll-rms", defaultValue = "2.5")
    double rollRms;

    @ConfigProperty(name = "weighing.gating.pitch-rms", defaultValue = "2.5")
    double pitchRms;

    @ConfigProperty(name = "weighing.gating.az-instant", defaultValue = "0.8")
    double azInstant;

    @ConfigProperty(name = "weighing.gating.roll-instant", defaultValue = "6.0")
    double rollInstant;

    @ConfigProperty(name = "weighing.gating.pitch-instant", defaultValue = "6.0")
    double pitchInstant;

    @ConfigProperty(name = "weighing.filter.gravity-alpha", defaultValue = "0.92")
    double gravityAlpha;

    @ConfigProperty(name = "weighing.sample.mass-default", defaultValue = "150")
    double sampleMassDefault;

    @ConfigProperty(name = "weighing.scale.sample-rate-hz", defaultValue = "5")
    double scaleSampleRateHz;

    @ConfigProperty(name = "weighing.live.window-seconds", defaultValue = "5")
    double liveWindowSeconds;

    @ConfigProperty(name = "weighing.uncertainty.k", defaultValue = "2.0")
    double uncertaintyK;

    @ConfigProperty(name = "weighing.gravity.standard", defaultValue = "9.80665")
    double standardGravity;

    @ConfigProperty(name = "weighing.aggregation.trim-fraction", defaultValue = "0.10")
    double trimFraction;

    /**
     * Builds the configuration snapshot in force at startup.
     *
     * @return startup snapshot, named {@code startup-estimator-config}
     */
    @Produces
    @Singleton
    @Named("startup-estimator-config")
    public EstimatorConfig startupConfig() {
        EstimatorConfig config = new EstimatorConfig(
                azRms, rollRms, pitchRms,
                azInstant, rollInstant, pitchInstant,
                gravityAlpha, sampleMassDefault, scaleSampleRateHz, liveWindowSeconds,
                uncertaintyK, standardGravity, trimFraction);

        if (!config.isGravityAlphaInRecommendedRange()) {
            LOG.warnf("weighing.filter.gravity-alpha=%.3f is outside the recommended range [%.2f, %.2f]",
                    gravityAlpha, EstimatorConfig.MIN_RECOMMENDED_ALPHA, EstimatorConfig.MAX_RECOMMENDED_ALPHA);
        }
        LOG.infof("Estimator config: alpha=%.3f, window=%.1fs, scale rate=%.1fHz, k=%.2f",
                gravityAlpha, liveWindowSeconds, scaleSampleRateHz, uncertaintyK);
        return config;
    }

    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }
}
