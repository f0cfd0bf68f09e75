package com.faastrace.core.service.model;

/**
 * A resolved trigger between two records of the same trace.
 *
 * @param overheadMs outbound call overhead plus inbound trigger overhead, null if neither was measured
 * @param latencyMs  time from the triggering call finishing to the child being invoked, null if unknown
 */
public record TraceEdge(
        String parentRecordId,
        String childRecordId,
        String triggerType,
        TriggerSynchronicity synchronicity,
        Double overheadMs,
        Long latencyMs
) {}
