/* (C)2026 */
package com.ammann.weighing.config;

import com.ammann.weighing.dto.ConfigOverrideDTO;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.jboss.logging.Logger;

/**
 * Holds the configuration snapshot currently in force.
 *
 * <p>Updates replace the snapshot atomically. Components pull {@link #current()} when they
 * need it and compare by reference to detect a swap.
 */
@ApplicationScoped
public class EstimatorConfigRegistry {

    private static final Logger LOG = Logger.getLogger(EstimatorConfigRegistry.class);

    @Inject
    @Named("startup-estimator-config")
    EstimatorConfig startupConfig;

    private volatile EstimatorConfig current;

    @PostConstruct
    void init() {
        current = startupConfig != null ? startupConfig : EstimatorConfig.defaults();
    }

    public EstimatorConfig current() {
        return current;
    }

    /**
     * Overwrites the fields present in {@code overrides}, keeping the others.
     *
     * @param overrides partial configuration
     * @return the new snapshot
     * @throws com.ammann.weighing.exception.ValidationException if the merged snapshot is invalid
     */
    public synchronized EstimatorConfig update(ConfigOverrideDTO overrides) {
        EstimatorConfig updated = overrides.applyTo(current);
        current = updated;
        LOG.infof("Estimator config updated: %s", updated);
        return updated;
    }

    /**
     * Restores the snapshot the application started with.
     */
    public synchronized EstimatorConfig reset() {
        current = startupConfig != null ? startupConfig : EstimatorConfig.defaults();
        LOG.info("Estimator config reset to startup values");
        return current;
    }
}
