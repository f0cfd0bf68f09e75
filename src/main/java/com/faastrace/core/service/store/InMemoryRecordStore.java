package com.faastrace.core.service.store;

import com.faastrace.core.service.model.Profile;
import com.faastrace.core.service.model.Trace;
import com.faastrace.core.service.model.TraceRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of RecordStore.
 *
 * Entities are held as JSON so that every read hands out a fresh copy, the same way
 * the filesystem store does. Unprocessed records are listed in upload order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "faas.storage", name = "type", havingValue = "memory")
public class InMemoryRecordStore implements RecordStore {

    private final ObjectMapper objectMapper;

    private final Map<String, String> unprocessed = new LinkedHashMap<>();
    private final Map<String, String> processed = new ConcurrentHashMap<>();
    private final Map<String, String> failed = new ConcurrentHashMap<>();
    private final Map<String, String> traces = new TreeMap<>();
    private final Map<String, String> profiles = new TreeMap<>();
    private final Map<String, String> profileIndex = new ConcurrentHashMap<>();

    // ==================== Records ====================

    @Override
    public synchronized List<String> listUnprocessed() {
        return List.copyOf(unprocessed.keySet());
    }

    @Override
    public synchronized TraceRecord fetch(String key) {
        var json = unprocessed.get(key);
        if (json == null) {
            throw RecordStoreException.notFound("Record", key);
        }
        try {
            return objectMapper.readValue(json, TraceRecord.class);
        } catch (JsonProcessingException e) {
            throw new RecordStoreException("Failed to deserialize record " + key, key,
                    RecordStoreException.Reason.DESERIALIZATION, e);
        }
    }

    @Override
    public synchronized void markProcessed(String key) {
        var json = unprocessed.remove(key);
        if (json == null) {
            throw RecordStoreException.notFound("Unprocessed record", key);
        }
        processed.put(key, json);
        log.debug("Marked record {} as processed", key);
    }

    @Override
    public synchronized void markFailed(String key) {
        var json = unprocessed.remove(key);
        if (json == null) {
            throw RecordStoreException.notFound("Unprocessed record", key);
        }
        failed.put(key, json);
        log.debug("Moved record {} to quarantine", key);
    }

    @Override
    public synchronized void putUnprocessed(TraceRecord record) {
        unprocessed.remove(record.getRecordId());
        unprocessed.put(record.getRecordId(), serialize(record.getRecordId(), record));
    }

    /**
     * Queues raw content under a key, whether or not it is a valid record.
     */
    public synchronized void putUnprocessedRaw(String key, String json) {
        unprocessed.put(key, json);
    }

    public boolean isProcessed(String key) {
        return processed.containsKey(key);
    }

    public boolean isFailed(String key) {
        return failed.containsKey(key);
    }

    @Override
    public synchronized int countUnprocessed() {
        return unprocessed.size();
    }

    // ==================== Traces ====================

    @Override
    public synchronized void putTrace(Trace trace) {
        traces.put(trace.getTraceId(), serialize(trace.getTraceId(), trace));
    }

    @Override
    public synchronized Optional<Trace> getTrace(String traceId) {
        return Optional.ofNullable(traces.get(traceId))
                .map(json -> deserialize(traceId, json, Trace.class));
    }

    @Override
    public synchronized List<String> listTraceIds() {
        return List.copyOf(traces.keySet());
    }

    // ==================== Profiles ====================

    @Override
    public synchronized void putProfile(Profile profile) {
        profiles.put(profile.getProfileId(), serialize(profile.getProfileId(), profile));
        if (profile.functionKey() != null) {
            profileIndex.put(profile.functionKey(), profile.getProfileId());
        }
    }

    @Override
    public synchronized Optional<Profile> getProfile(String profileId) {
        return Optional.ofNullable(profiles.get(profileId))
                .map(json -> deserialize(profileId, json, Profile.class));
    }

    @Override
    public synchronized Optional<Profile> findProfileByFunction(String functionKey) {
        var profileId = profileIndex.get(functionKey);
        return profileId == null ? Optional.empty() : getProfile(profileId);
    }

    @Override
    public synchronized List<Profile> listProfiles() {
        var result = new ArrayList<Profile>();
        profiles.forEach((id, json) -> result.add(deserialize(id, json, Profile.class)));
        return result;
    }

    // ==================== Health ====================

    @Override
    public boolean isAvailable() {
        return true;
    }

    /**
     * Drops every stored entity.
     */
    public synchronized void clear() {
        unprocessed.clear();
        processed.clear();
        failed.clear();
        traces.clear();
        profiles.clear();
        profileIndex.clear();
    }

    // ==================== Private Methods ====================

    private String serialize(String key, Object entity) {
        try {
            return objectMapper.writeValueAsString(entity);
        } catch (JsonProcessingException e) {
            throw new RecordStoreException("Failed to serialize " + key, key,
                    RecordStoreException.Reason.WRITE_FAILED, e);
        }
    }

    private <T> T deserialize(String key, String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new RecordStoreException("Failed to deserialize " + key, key,
                    RecordStoreException.Reason.DESERIALIZATION, e);
        }
    }
}
