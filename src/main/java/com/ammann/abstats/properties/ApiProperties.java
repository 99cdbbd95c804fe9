/* (C)2026 */
package com.ammann.abstats.properties;

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
     * A/B test endpoints
     */
    public static final class AbTests {
        private AbTests() {}

        public static final String BASE = "/ab-tests";
        public static final String PROPORTIONS = "/proportions";
        public static final String MEANS = "/means";
    }
}
