/* (C)2026 */
package com.ammann.weighing.config;

/** Builds initialised registries for tests outside this package. */
public final class ConfigTestSupport {

    private ConfigTestSupport() {}

    public static EstimatorConfigRegistry defaultRegistry() {
        return registry(EstimatorConfig.defaults());
    }

    public static EstimatorConfigRegistry registry(EstimatorConfig startup) {
        EstimatorConfigRegistry registry = new EstimatorConfigRegistry();
        registry.startupConfig = startup;
        registry.init();
        return registry;
    }
}
