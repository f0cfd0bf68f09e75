package com.faastrace.core.service.trace;

import com.faastrace.core.service.model.Trace;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory implementation of TraceCache.
 *
 * Not thread-safe: an instance is owned by a single ingestion run.
 */
@Slf4j
public class InMemoryTraceCache implements TraceCache {

    private final Map<String, Trace> tracesById = new LinkedHashMap<>();
    private final Set<String> liveTraceIds = new LinkedHashSet<>();

    @Override
    public Optional<Trace> get(String traceId) {
        return Optional.ofNullable(tracesById.get(traceId));
    }

    @Override
    public Trace createOrGet(String traceId) {
        var existing = tracesById.get(traceId);
        if (existing != null) {
            log.debug("Found trace with ID {}", traceId);
            return existing;
        }

        log.debug("Could not find trace for ID {}. Create new trace.", traceId);
        var trace = new Trace(traceId);
        put(trace);
        return trace;
    }

    @Override
    public void put(Trace trace, String overrideId) {
        String key = overrideId != null ? overrideId : trace.getTraceId();
        var previous = tracesById.put(key, trace);
        if (previous != null && previous != trace) {
            repoint(previous, trace);
        }
        liveTraceIds.add(key);
    }

    @Override
    public void retire(String traceId) {
        if (liveTraceIds.remove(traceId)) {
            log.debug("Retired trace ID {}", traceId);
        }
    }

    @Override
    public boolean isLive(String traceId) {
        return liveTraceIds.contains(traceId);
    }

    @Override
    public Collection<Trace> allLiveTraces() {
        Set<Trace> unique = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Trace> result = new ArrayList<>();
        for (String traceId : liveTraceIds) {
            var trace = tracesById.get(traceId);
            if (trace != null && unique.add(trace)) {
                result.add(trace);
            }
        }
        return result;
    }

    // Keeps re-keying transitive: ids aliased to a superseded trace follow it.
    private void repoint(Trace from, Trace to) {
        tracesById.replaceAll((id, trace) -> trace == from ? to : trace);
    }
}
