package com.faastrace.core.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the ingestion run.
 *
 * Controls batch size, fetch prefetching and the ingestion schedule.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "faas.ingest")
public class IngestionConfig {

    /**
     * Batch configuration.
     */
    private BatchConfig batch = new BatchConfig();

    /**
     * Prefetch configuration.
     */
    private PrefetchConfig prefetch = new PrefetchConfig();

    /**
     * Schedule configuration.
     */
    private ScheduleConfig schedule = new ScheduleConfig();

    @Getter
    @Setter
    public static class BatchConfig {

        /**
         * Maximum number of unprocessed records consumed by one run (default: 10,000).
         */
        private int maxRecords = 10000;

        /**
         * Runs a record may spend in a trace without root before it is quarantined.
         * Zero or less keeps such records in the backlog indefinitely.
         */
        private int maxDeferrals = 5;
    }

    @Getter
    @Setter
    public static class PrefetchConfig {

        /**
         * Fetch records concurrently ahead of the merger.
         */
        private boolean enabled = true;

        /**
         * Number of fetches in flight at once.
         */
        private int windowSize = 16;

        /**
         * Core size of the prefetch thread pool.
         */
        private int coreThreads = 4;

        /**
         * Maximum size of the prefetch thread pool.
         */
        private int maxThreads = 8;
    }

    @Getter
    @Setter
    public static class ScheduleConfig {

        /**
         * Run ingestion periodically.
         */
        private boolean enabled = false;

        /**
         * Delay between the end of one scheduled run and the start of the next.
         */
        private long intervalMs = 60000;
    }
}
