package com.faastrace.core.service.ingest;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs ingestion periodically when {@code faas.ingest.schedule.enabled} is set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "faas.ingest.schedule", name = "enabled", havingValue = "true")
public class ScheduledIngestionTrigger {

    private final RecordIngestionDriver ingestionDriver;

    @Scheduled(fixedDelayString = "${faas.ingest.schedule.interval-ms:60000}")
    void trigger() {
        try {
            ingestionDriver.run();
        } catch (IngestionException e) {
            if (IngestionException.RUN_IN_PROGRESS.equals(e.getErrorCode())) {
                log.info("Skipping scheduled ingestion, a run is already in progress");
            } else {
                log.error("Scheduled ingestion failed: {} [{}]", e.getMessage(), e.getErrorCode());
            }
        }
    }
}
