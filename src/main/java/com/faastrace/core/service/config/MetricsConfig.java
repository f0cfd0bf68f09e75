package com.faastrace.core.service.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.context.annotation.Configuration;

import java.util.function.Supplier;

/**
 * Metrics configuration for the FaaS Trace Core Service.
 *
 * Provides custom metrics for ingestion runs, trace reconstruction and export.
 */
@Configuration
@Getter
public class MetricsConfig {

    private final MeterRegistry registry;

    // Counters
    private final Counter recordsProcessed;
    private final Counter recordsSkipped;
    private final Counter recordsQuarantined;
    private final Counter mergesCompleted;
    private final Counter correlationErrors;
    private final Counter tracesPersisted;
    private final Counter tracesDeferred;
    private final Counter profilesWritten;
    private final Counter exportsCompleted;

    // Timers
    private final Timer runTimer;
    private final Timer exportTimer;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;

        this.recordsProcessed = Counter.builder("faas.ingest.records.processed")
                .description("Number of records marked processed")
                .register(registry);

        this.recordsSkipped = Counter.builder("faas.ingest.records.skipped")
                .description("Number of records rejected or not fetchable")
                .register(registry);

        this.recordsQuarantined = Counter.builder("faas.ingest.records.quarantined")
                .description("Number of records moved out of the backlog as unprocessable")
                .register(registry);

        this.mergesCompleted = Counter.builder("faas.merge.count")
                .description("Number of trace merges")
                .register(registry);

        this.correlationErrors = Counter.builder("faas.correlation.errors")
                .description("Number of triggers left unresolved because of duplicate identifiers")
                .register(registry);

        this.tracesPersisted = Counter.builder("faas.traces.persisted")
                .description("Number of traces written to the record store")
                .register(registry);

        this.tracesDeferred = Counter.builder("faas.traces.deferred")
                .description("Number of traces held back because no root record was found")
                .register(registry);

        this.profilesWritten = Counter.builder("faas.profiles.written")
                .description("Number of profile writes")
                .register(registry);

        this.exportsCompleted = Counter.builder("faas.export.count")
                .description("Number of export operations completed")
                .register(registry);

        this.runTimer = Timer.builder("faas.ingest.run.duration")
                .description("Time taken for an ingestion run")
                .register(registry);

        this.exportTimer = Timer.builder("faas.export.duration")
                .description("Time taken for export operations")
                .register(registry);
    }

    /**
     * Registers a gauge for backlog monitoring.
     *
     * @param name the metric name
     * @param description the metric description
     * @param sizeSupplier supplier for the current size
     */
    public void registerBacklogGauge(String name, String description, Supplier<Number> sizeSupplier) {
        Gauge.builder(name, sizeSupplier)
                .description(description)
                .register(registry);
    }
}
