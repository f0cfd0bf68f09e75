package com.faastrace.core.service.ingest;

import java.time.Instant;

/**
 * Summary of one ingestion run.
 */
public record IngestionRunResult(
        String runId,
        Instant startedAt,
        long durationMs,
        int recordsListed,
        int recordsFetched,
        int recordsSkipped,
        int recordsQuarantined,
        int recordsProcessed,
        int merges,
        int correlationErrors,
        int tracesPersisted,
        int tracesDeferred,
        int tracesFailed,
        int profilesWritten,
        int pendingInbound,
        int pendingOutbound
) {
}
