package com.faastrace.core.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Overall application configuration for the FaaS Trace Core Service.
 *
 * Contains the service toggle and feature flags.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "faas")
public class FaasTraceConfig {

    /**
     * Enable or disable record ingestion.
     */
    private boolean enabled = true;

    /**
     * Feature flags for optional capabilities.
     */
    private Features features = new Features();

    @Getter
    @Setter
    public static class Features {

        /**
         * Enable Neo4j export functionality.
         */
        private boolean neo4jExportEnabled = false;

        /**
         * Enable metrics collection.
         */
        private boolean metricsEnabled = true;

        /**
         * Accept raw records over HTTP and queue them as unprocessed.
         */
        private boolean recordUploadEnabled = true;
    }
}
