package com.faastrace.core.service.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Causal tree of records sharing one root invocation.
 *
 * Records are kept in insertion order and are unique by record id. Every record held
 * by a trace carries that trace's id.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Trace {

    /**
     * Earliest invocation first, unknown invocation time last, then record id.
     */
    private static final Comparator<TraceRecord> ROOT_ORDER = Comparator
            .comparing(TraceRecord::getInvokedAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
            .thenComparing(TraceRecord::getRecordId, Comparator.nullsLast(Comparator.<String>naturalOrder()));

    private final String traceId;
    private final Map<String, TraceRecord> records = new LinkedHashMap<>();

    public Trace(String traceId) {
        this.traceId = Objects.requireNonNull(traceId, "traceId");
    }

    @JsonCreator
    public Trace(@JsonProperty("traceId") String traceId,
                 @JsonProperty("records") List<TraceRecord> records) {
        this(traceId);
        if (records != null) {
            records.forEach(this::addRecord);
        }
    }

    @JsonProperty("traceId")
    public String getTraceId() {
        return traceId;
    }

    @JsonProperty("records")
    public List<TraceRecord> getRecords() {
        return List.copyOf(records.values());
    }

    /**
     * Adds a record and rewrites its trace id to this trace's id.
     *
     * @return false if a record with the same id is already present
     */
    public boolean addRecord(TraceRecord record) {
        if (records.containsKey(record.getRecordId())) {
            return false;
        }
        record.setTraceId(traceId);
        records.put(record.getRecordId(), record);
        return true;
    }

    public boolean containsRecord(String recordId) {
        return records.containsKey(recordId);
    }

    public Optional<TraceRecord> findRecord(String recordId) {
        return Optional.ofNullable(records.get(recordId));
    }

    /**
     * Removes all records and returns them in insertion order.
     */
    public List<TraceRecord> drainRecords() {
        var drained = new ArrayList<>(records.values());
        records.clear();
        return drained;
    }

    @JsonIgnore
    public int size() {
        return records.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * The earliest-invoked record without a parent. Empty when every record has a
     * parent (a cycle, or the true root has not arrived yet).
     */
    public Optional<TraceRecord> rootRecord() {
        return records.values().stream()
                .filter(record -> !record.hasParent())
                .min(ROOT_ORDER);
    }

    @JsonProperty(value = "rootRecordId", access = JsonProperty.Access.READ_ONLY)
    public String rootRecordId() {
        return rootRecord().map(TraceRecord::getRecordId).orElse(null);
    }

    @JsonProperty(value = "involvedFunctions", access = JsonProperty.Access.READ_ONLY)
    public Set<String> involvedFunctions() {
        var functions = new LinkedHashSet<String>();
        for (var record : records.values()) {
            if (record.functionKey() != null) {
                functions.add(record.functionKey());
            }
        }
        return functions;
    }

    /**
     * Copies in records from another snapshot of this trace that are not held yet.
     *
     * @return number of records added
     */
    public int absorb(Collection<TraceRecord> snapshot) {
        int added = 0;
        for (var record : snapshot) {
            if (addRecord(record)) {
                added++;
            }
        }
        return added;
    }

    @Override
    public String toString() {
        return "Trace{traceId=" + traceId + ", records=" + records.size() + "}";
    }
}
