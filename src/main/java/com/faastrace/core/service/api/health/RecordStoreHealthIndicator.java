package com.faastrace.core.service.api.health;

import com.faastrace.core.service.ingest.RecordIngestionDriver;
import com.faastrace.core.service.store.RecordStore;
import com.faastrace.core.service.store.RecordStoreException;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the record store.
 *
 * Reports store availability, backlog size and whether a run is active.
 */
@Component
@RequiredArgsConstructor
public class RecordStoreHealthIndicator implements HealthIndicator {

    private final RecordStore recordStore;
    private final RecordIngestionDriver ingestionDriver;

    @Override
    public Health health() {
        if (!recordStore.isAvailable()) {
            return Health.down()
                    .withDetail("store", recordStore.getClass().getSimpleName())
                    .withDetail("reason", "Record store not available")
                    .build();
        }

        try {
            return Health.up()
                    .withDetail("store", recordStore.getClass().getSimpleName())
                    .withDetail("backlog", recordStore.countUnprocessed())
                    .withDetail("runInProgress", ingestionDriver.isRunning())
                    .build();
        } catch (RecordStoreException e) {
            return Health.down(e)
                    .withDetail("store", recordStore.getClass().getSimpleName())
                    .build();
        }
    }
}
