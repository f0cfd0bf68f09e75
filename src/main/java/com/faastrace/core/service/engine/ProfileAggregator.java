package com.faastrace.core.service.engine;

import com.faastrace.core.service.model.Profile;
import com.faastrace.core.service.model.Trace;
import com.faastrace.core.service.model.TraceRecord;
import com.faastrace.core.service.store.RecordStore;
import com.faastrace.core.service.store.RecordStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Groups the traces of one run by root function and persists traces and profiles.
 *
 * An instance belongs to a single run: profiles touched by the run are collected
 * and written once, after every trace has been assigned.
 */
@Slf4j
@RequiredArgsConstructor
public class ProfileAggregator {

    private final RecordStore recordStore;

    private final Map<String, Profile> profilesByFunction = new LinkedHashMap<>();

    // ==================== Public API ====================

    public AggregationResult aggregate(Collection<Trace> traces) {
        var persisted = new ArrayList<Trace>();
        var deferred = new ArrayList<String>();
        var failed = new ArrayList<String>();

        for (var trace : traces) {
            absorbStoredRecords(trace);

            var root = trace.rootRecord().filter(record -> record.getFunctionIdentity() != null);
            if (root.isEmpty()) {
                log.info("Trace {} has no root record yet, deferring {} records",
                        trace.getTraceId(), trace.size());
                deferred.add(trace.getTraceId());
                continue;
            }

            if (persistTrace(trace)) {
                addToProfile(trace, root.get());
                persisted.add(trace);
            } else {
                failed.add(trace.getTraceId());
            }
        }

        int written = writeProfiles();
        log.info("Aggregated {} traces into {} profiles ({} deferred, {} failed)",
                persisted.size(), profilesByFunction.size(), deferred.size(), failed.size());

        return new AggregationResult(persisted, deferred, failed,
                List.copyOf(profilesByFunction.values()), written);
    }

    // ==================== Trace Handling ====================

    private void absorbStoredRecords(Trace trace) {
        Optional<Trace> stored = lookupStoredTrace(trace.getTraceId());
        stored.ifPresent(previous -> {
            int added = trace.absorb(previous.getRecords());
            if (added > 0) {
                log.debug("Extended trace {} with {} records from an earlier run", trace.getTraceId(), added);
            }
        });
    }

    private Optional<Trace> lookupStoredTrace(String traceId) {
        try {
            return recordStore.getTrace(traceId);
        } catch (RecordStoreException e) {
            log.error("Failed to load stored trace {}, continuing without it: {}", traceId, e.getMessage());
            return Optional.empty();
        }
    }

    private boolean persistTrace(Trace trace) {
        try {
            recordStore.putTrace(trace);
            log.info("Persisted trace {} with {} records", trace.getTraceId(), trace.size());
            return true;
        } catch (RecordStoreException e) {
            log.error("Failed to persist trace {}", trace.getTraceId(), e);
            return false;
        }
    }

    // ==================== Profile Handling ====================

    private void addToProfile(Trace trace, TraceRecord root) {
        var profile = profileFor(root);
        if (profile.addTrace(trace.getTraceId())) {
            log.debug("Added trace {} to profile {}", trace.getTraceId(), profile.getProfileId());
        }
    }

    private Profile profileFor(TraceRecord root) {
        var functionKey = root.functionKey();
        return profilesByFunction.computeIfAbsent(functionKey, key -> lookupStoredProfile(key)
                .orElseGet(() -> createProfile(root)));
    }

    private Optional<Profile> lookupStoredProfile(String functionKey) {
        try {
            return recordStore.findProfileByFunction(functionKey);
        } catch (RecordStoreException e) {
            log.error("Failed to look up profile for {}, creating a new one: {}", functionKey, e.getMessage());
            return Optional.empty();
        }
    }

    private Profile createProfile(TraceRecord root) {
        var profile = Profile.create(root.getFunctionIdentity());
        log.info("Created profile {} for function {}", profile.getProfileId(), root.functionKey());
        return profile;
    }

    private int writeProfiles() {
        int written = 0;
        for (var profile : profilesByFunction.values()) {
            try {
                recordStore.putProfile(profile);
                written++;
                log.info("Wrote profile {} with {} traces", profile.getProfileId(), profile.getTraceIds().size());
            } catch (RecordStoreException e) {
                log.error("Failed to write profile {}", profile.getProfileId(), e);
            }
        }
        return written;
    }
}
