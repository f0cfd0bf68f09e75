package com.faastrace.core.service.engine;

import com.faastrace.core.service.model.Profile;
import com.faastrace.core.service.model.Trace;

import java.util.List;

/**
 * Outcome of flushing one run's traces into profiles.
 *
 * @param persistedTraces traces written to the store, their records may be marked processed
 * @param deferredTraceIds traces without a root, kept back for a later run
 * @param failedTraceIds traces the store refused to write
 * @param profiles profiles touched by the run, each written once
 * @param profilesWritten number of profiles the store accepted
 */
public record AggregationResult(
        List<Trace> persistedTraces,
        List<String> deferredTraceIds,
        List<String> failedTraceIds,
        List<Profile> profiles,
        int profilesWritten
) {
}
