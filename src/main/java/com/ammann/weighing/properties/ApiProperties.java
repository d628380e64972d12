/* (C)2026 */
package com.ammann.weighing.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralized registry of REST API path constants used across all JAX-RS resources.
 *
 * <p>Organizes endpoints by functional area (inertial stream, scale, sessions, tare,
 * configuration) to keep path naming consistent.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /**
     * Inertial sample endpoints
     */
    public static final class Imu {
        private Imu() {}

        public static final String BASE = "/imu";
        public static final String SAMPLES = BASE + "/samples";
        public static final String METRICS = BASE + "/metrics";
        public static final String RESET = BASE + "/reset";
    }

    /**
     * Live scale endpoints
     */
    public static final class Scale {
        private Scale() {}

        public static final String BASE = "/scale";
        public static final String READING = BASE + "/reading";
    }

    /**
     * Continuous session endpoints
     */
    public static final class Continuous {
        private Continuous() {}

        public static final String BASE = "/sessions/continuous";
        public static final String START = BASE + "/start";
        public static final String PROGRESS = BASE + "/progress";
        public static final String STOP = BASE + "/stop";
        public static final String RESULT = BASE + "/result";
        public static final String RESET = BASE + "/reset";
    }

    /**
     * Tare endpoints
     */
    public static final class Tare {
        private Tare() {}

        public static final String BASE = "/tare";
        public static final String SAMPLES = BASE + "/samples";
        public static final String SAMPLE = SAMPLES + "/{index}";
        public static final String ESTIMATE = BASE + "/estimate";
        public static final String MANUAL = BASE + "/manual";
    }

    /**
     * Manual session endpoints, keyed by session kind (base or final)
     */
    public static final class Manual {
        private Manual() {}

        public static final String BASE = "/sessions/{kind}";
        public static final String START = BASE + "/start";
        public static final String MEASUREMENTS = BASE + "/measurements";
        public static final String MEASUREMENT = MEASUREMENTS + "/{index}";
        public static final String STOP = BASE + "/stop";
        public static final String RESULT = BASE + "/result";
        public static final String RATIO = "/ratio";
    }

    /**
     * Configuration endpoints
     */
    public static final class Config {
        private Config() {}

        public static final String BASE = "/config";
        public static final String RESET = BASE + "/reset";
    }
}
