/* (C)2026 */
package com.ammann.qkd.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralized registry of REST API path constants used across all JAX-RS resources.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /**
     * Simulation endpoints
     */
    public static final class Simulations {
        private Simulations() {}

        public static final String BASE = "/simulations";
        public static final String BATCH = BASE + "/batch";
        public static final String DEFAULTS = BASE + "/defaults";
    }

    /**
     * Health check endpoints (Quarkus defaults)
     */
    public static final class Health {
        private Health() {}

        public static final String BASE = "/q/health";
        public static final String LIVE = BASE + "/live";
        public static final String READY = BASE + "/ready";
        public static final String METRICS = "/q/metrics";
        public static final String OPENAPI = "/q/openapi";
    }
}
