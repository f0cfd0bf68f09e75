package com.faastrace.core.service.trace;

import com.faastrace.core.service.model.Trace;

import java.util.Collection;
import java.util.Optional;

/**
 * Interface for the trace cache.
 *
 * In-memory registry of the traces under reconstruction during one ingestion run.
 * Several ids may resolve to the same trace once traces have been merged; only
 * live ids are reported by {@link #allLiveTraces()}.
 */
public interface TraceCache {

    /**
     * Retrieves the trace an id currently resolves to.
     *
     * @param traceId the trace identifier, live or retired
     * @return the trace if the id is known
     */
    Optional<Trace> get(String traceId);

    /**
     * Returns the trace registered under the id, creating and registering an empty
     * one if the id is unknown.
     *
     * @param traceId the trace identifier
     * @return the existing or new trace
     */
    Trace createOrGet(String traceId);

    /**
     * Registers a trace under its own id.
     *
     * @param trace the trace to register
     */
    default void put(Trace trace) {
        put(trace, null);
    }

    /**
     * Registers a trace under the override id, or under its own id when no override
     * is given. Ids that resolved to the trace previously registered under that id
     * are re-pointed to the new trace.
     *
     * @param trace the trace to register
     * @param overrideId the id to register under, may be null
     */
    void put(Trace trace, String overrideId);

    /**
     * Removes an id from the set of live ids. The id keeps resolving.
     *
     * @param traceId the trace identifier
     */
    void retire(String traceId);

    /**
     * Checks whether an id is live.
     *
     * @param traceId the trace identifier
     * @return true if live
     */
    boolean isLive(String traceId);

    /**
     * Gets one trace per live id, without duplicates by identity.
     *
     * @return live traces in registration order
     */
    Collection<Trace> allLiveTraces();

    /**
     * Gets the number of distinct live traces.
     *
     * @return number of traces
     */
    default int liveTraceCount() {
        return allLiveTraces().size();
    }
}
