package com.faastrace.core.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * FaaS Trace Core Service Application - Entry point for the Spring Boot application.
 *
 * Reconstructs distributed traces from the records emitted by instrumented
 * serverless functions:
 * - Pulls unprocessed records from the record store
 * - Correlates inbound and outbound triggers and merges partial traces
 * - Groups completed traces into profiles per root function
 * - Serves queries for traces and profiles, and exports traces to Neo4j
 */
@SpringBootApplication
@EnableScheduling
@EnableAsync
@ConfigurationPropertiesScan("com.faastrace.core.service.config")
public class FaasTraceCoreServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(FaasTraceCoreServiceApplication.class, args);
    }
}
