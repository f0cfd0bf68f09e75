package com.faastrace.core.service.ingest;

import com.faastrace.core.service.config.FaasTraceConfig;
import com.faastrace.core.service.config.IngestionConfig;
import com.faastrace.core.service.config.MetricsConfig;
import com.faastrace.core.service.correlation.InMemoryRequestCorrelationCache;
import com.faastrace.core.service.engine.AggregationResult;
import com.faastrace.core.service.engine.ProfileAggregator;
import com.faastrace.core.service.engine.TraceMerger;
import com.faastrace.core.service.model.TraceRecord;
import com.faastrace.core.service.store.RecordStore;
import com.faastrace.core.service.store.RecordStoreException;
import com.faastrace.core.service.trace.InMemoryTraceCache;
import com.faastrace.core.service.trace.TraceCache;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Drives one ingestion run over the backlog of unprocessed records.
 *
 * Records are fed to a fresh {@link TraceMerger} in listing order, the resulting
 * traces are flushed into profiles, and the records of every persisted trace are
 * marked processed. Records without tracing context are quarantined at once.
 * Unreadable records and records of traces without root stay in the backlog, but when
 * the backlog exceeds the batch limit they are taken only after records not seen
 * before; a record that found no root in {@code max-deferrals} runs is quarantined.
 * At most one run executes at a time.
 */
@Slf4j
@Service
public class RecordIngestionDriver {

    private static final String BACKLOG_GAUGE = "faas.ingest.backlog";

    private final RecordStore recordStore;
    private final IngestionConfig ingestionConfig;
    private final FaasTraceConfig faasTraceConfig;
    private final MetricsConfig metricsConfig;
    private final Executor prefetchExecutor;

    private final AtomicBoolean running = new AtomicBoolean(false);

    // record key -> runs the record spent in a trace without root
    private final Map<String, Integer> deferralsByKey = new ConcurrentHashMap<>();
    private final Set<String> unreadableKeys = ConcurrentHashMap.newKeySet();

    public RecordIngestionDriver(RecordStore recordStore,
                                 IngestionConfig ingestionConfig,
                                 FaasTraceConfig faasTraceConfig,
                                 MetricsConfig metricsConfig,
                                 @Qualifier("prefetchExecutor") Executor prefetchExecutor) {
        this.recordStore = recordStore;
        this.ingestionConfig = ingestionConfig;
        this.faasTraceConfig = faasTraceConfig;
        this.metricsConfig = metricsConfig;
        this.prefetchExecutor = prefetchExecutor;
    }

    @PostConstruct
    void registerMetrics() {
        metricsConfig.registerBacklogGauge(BACKLOG_GAUGE, "Number of unprocessed records", this::backlogSize);
    }

    // ==================== Public API ====================

    /**
     * Runs ingestion over the current backlog.
     *
     * @throws IngestionException with code {@code RUN_IN_PROGRESS} when another run is active,
     *         {@code STORE_UNAVAILABLE} when the backlog cannot be listed, or
     *         {@code INGESTION_DISABLED} when ingestion is switched off
     */
    public IngestionRunResult run() {
        if (!faasTraceConfig.isEnabled()) {
            throw new IngestionException("Ingestion is disabled", null, IngestionException.INGESTION_DISABLED);
        }
        if (!running.compareAndSet(false, true)) {
            throw new IngestionException("An ingestion run is already in progress", null,
                    IngestionException.RUN_IN_PROGRESS);
        }
        try {
            return metricsConfig.getRunTimer().record(this::executeRun);
        } finally {
            running.set(false);
        }
    }

    /**
     * Adds a record to the backlog.
     *
     * @throws IngestionException with code {@code MISSING_TRACING_CONTEXT} if the record
     *         carries no record or trace id, {@code INVALID_RECORD_ID} if an id does not
     *         match {@link TraceRecord#ID_PATTERN}
     */
    public void submit(TraceRecord record) {
        if (!record.hasTracingContext()) {
            throw new IngestionException("Cannot accept record without tracing context",
                    record.getRecordId(), IngestionException.MISSING_TRACING_CONTEXT);
        }
        if (!record.hasUploadableIds()) {
            throw new IngestionException(
                    "Record and trace ids may only contain letters, digits, '.', '_' or '-'",
                    null, IngestionException.INVALID_RECORD_ID);
        }
        recordStore.putUnprocessed(record);
        log.debug("Queued record {} of trace {}", record.getRecordId(), record.getTraceId());
    }

    public boolean isRunning() {
        return running.get();
    }

    // ==================== Run Execution ====================

    private IngestionRunResult executeRun() {
        var runId = UUID.randomUUID().toString();
        var startedAt = Instant.now();
        long startTime = System.currentTimeMillis();

        var keys = listBacklog();
        log.info("Ingestion run {} started with {} unprocessed records", runId, keys.size());

        var traceCache = new InMemoryTraceCache();
        var correlationCache = new InMemoryRequestCorrelationCache();
        var run = new RunState(new TraceMerger(traceCache, correlationCache));

        fetchInOrder(keys, fetched -> consume(fetched, run));

        var aggregation = new ProfileAggregator(recordStore).aggregate(traceCache.allLiveTraces());
        int processed = markProcessed(aggregation, run.keysByRecordId);
        trackDeferredRecords(aggregation, traceCache, run);
        recordMetrics(run, aggregation, processed);

        long duration = System.currentTimeMillis() - startTime;
        var result = new IngestionRunResult(
                runId, startedAt, duration,
                keys.size(), run.fetched, run.skipped, run.quarantined, processed,
                run.merges, run.correlationErrors,
                aggregation.persistedTraces().size(),
                aggregation.deferredTraceIds().size(),
                aggregation.failedTraceIds().size(),
                aggregation.profilesWritten(),
                correlationCache.pendingInboundCount(),
                correlationCache.pendingOutboundCount()
        );
        logRunFinished(result);
        return result;
    }

    private List<String> listBacklog() {
        List<String> keys;
        try {
            keys = recordStore.listUnprocessed();
        } catch (RecordStoreException e) {
            throw new IngestionException("Record store unavailable: " + e.getMessage(), e.getKey(),
                    IngestionException.STORE_UNAVAILABLE, e);
        }
        var listed = new HashSet<>(keys);
        deferralsByKey.keySet().retainAll(listed);
        unreadableKeys.retainAll(listed);

        int maxRecords = ingestionConfig.getBatch().getMaxRecords();
        if (maxRecords > 0 && keys.size() > maxRecords) {
            log.info("Backlog holds {} records, limiting run to {} with unseen records first",
                    keys.size(), maxRecords);
            return freshFirst(keys).subList(0, maxRecords);
        }
        return keys;
    }

    private List<String> freshFirst(List<String> keys) {
        var ordered = new ArrayList<String>(keys.size());
        keys.stream().filter(key -> !isRetry(key)).forEach(ordered::add);
        keys.stream().filter(this::isRetry).forEach(ordered::add);
        return ordered;
    }

    private boolean isRetry(String key) {
        return deferralsByKey.containsKey(key) || unreadableKeys.contains(key);
    }

    // ==================== Fetching ====================

    private void fetchInOrder(List<String> keys, Consumer<FetchResult> consumer) {
        var prefetch = ingestionConfig.getPrefetch();
        if (!prefetch.isEnabled() || prefetch.getWindowSize() <= 1) {
            keys.forEach(key -> consumer.accept(fetchSafely(key)));
            return;
        }

        int windowSize = prefetch.getWindowSize();
        for (int from = 0; from < keys.size(); from += windowSize) {
            var window = keys.subList(from, Math.min(from + windowSize, keys.size()));
            var futures = new ArrayList<CompletableFuture<FetchResult>>(window.size());
            for (var key : window) {
                futures.add(CompletableFuture.supplyAsync(() -> fetchSafely(key), prefetchExecutor));
            }
            futures.forEach(future -> consumer.accept(future.join()));
        }
    }

    private FetchResult fetchSafely(String key) {
        try {
            return FetchResult.success(key, recordStore.fetch(key));
        } catch (RecordStoreException e) {
            return FetchResult.failure(key, e);
        }
    }

    // ==================== Record Processing ====================

    private void consume(FetchResult fetched, RunState run) {
        if (fetched.error() != null) {
            log.error("Failed to fetch record {}: {} [{}]",
                    fetched.key(), fetched.error().getMessage(), fetched.error().getReason());
            run.skipped++;
            if (fetched.error().getReason() == RecordStoreException.Reason.DESERIALIZATION) {
                unreadableKeys.add(fetched.key());
            }
            return;
        }
        run.fetched++;
        unreadableKeys.remove(fetched.key());

        var record = fetched.record();
        try {
            var outcome = run.merger.process(record);
            run.keysByRecordId.computeIfAbsent(record.getRecordId(), id -> new ArrayList<>()).add(fetched.key());
            run.merges += outcome.merges();
            run.correlationErrors += outcome.correlationErrors();
        } catch (IngestionException e) {
            log.error("Skipping record {}: {} [{}]", fetched.key(), e.getMessage(), e.getErrorCode());
            run.skipped++;
            quarantine(fetched.key(), run);
        }
    }

    private int markProcessed(AggregationResult aggregation, Map<String, List<String>> keysByRecordId) {
        int processed = 0;
        for (var trace : aggregation.persistedTraces()) {
            for (var record : trace.getRecords()) {
                for (var key : keysByRecordId.getOrDefault(record.getRecordId(), List.of())) {
                    if (markProcessedSafely(key)) {
                        processed++;
                    }
                }
            }
        }
        return processed;
    }

    private boolean markProcessedSafely(String key) {
        deferralsByKey.remove(key);
        try {
            recordStore.markProcessed(key);
            return true;
        } catch (RecordStoreException e) {
            log.error("Failed to mark record {} as processed: {}", key, e.getMessage());
            return false;
        }
    }

    private void trackDeferredRecords(AggregationResult aggregation, TraceCache traceCache, RunState run) {
        int maxDeferrals = ingestionConfig.getBatch().getMaxDeferrals();
        for (var traceId : aggregation.deferredTraceIds()) {
            var trace = traceCache.get(traceId);
            if (trace.isEmpty()) continue;
            for (var record : trace.get().getRecords()) {
                for (var key : run.keysByRecordId.getOrDefault(record.getRecordId(), List.of())) {
                    int deferrals = deferralsByKey.merge(key, 1, Integer::sum);
                    if (maxDeferrals > 0 && deferrals >= maxDeferrals) {
                        log.warn("Record {} found no root in {} runs, quarantining it", key, deferrals);
                        deferralsByKey.remove(key);
                        quarantine(key, run);
                    }
                }
            }
        }
    }

    private void quarantine(String key, RunState run) {
        try {
            recordStore.markFailed(key);
            run.quarantined++;
            log.warn("Quarantined record {}", key);
        } catch (RecordStoreException e) {
            log.error("Failed to quarantine record {}: {}", key, e.getMessage());
        }
    }

    // ==================== Monitoring ====================

    private Number backlogSize() {
        try {
            return recordStore.countUnprocessed();
        } catch (RecordStoreException e) {
            return Double.NaN;
        }
    }

    private void recordMetrics(RunState run, AggregationResult aggregation, int processed) {
        metricsConfig.getRecordsProcessed().increment(processed);
        metricsConfig.getRecordsSkipped().increment(run.skipped);
        metricsConfig.getRecordsQuarantined().increment(run.quarantined);
        metricsConfig.getMergesCompleted().increment(run.merges);
        metricsConfig.getCorrelationErrors().increment(run.correlationErrors);
        metricsConfig.getTracesPersisted().increment(aggregation.persistedTraces().size());
        metricsConfig.getTracesDeferred().increment(aggregation.deferredTraceIds().size());
        metricsConfig.getProfilesWritten().increment(aggregation.profilesWritten());
    }

    private void logRunFinished(IngestionRunResult result) {
        log.info("Ingestion run {} finished in {}ms: {} listed, {} processed, {} skipped, {} quarantined, "
                        + "{} merges, {} traces persisted, {} deferred, {} profiles written",
                result.runId(), result.durationMs(), result.recordsListed(), result.recordsProcessed(),
                result.recordsSkipped(), result.recordsQuarantined(), result.merges(), result.tracesPersisted(),
                result.tracesDeferred(), result.profilesWritten());
        if (result.pendingInbound() > 0 || result.pendingOutbound() > 0) {
            log.debug("Run {} left {} inbound and {} outbound requests unresolved",
                    result.runId(), result.pendingInbound(), result.pendingOutbound());
        }
    }

    // ==================== Inner Types ====================

    private record FetchResult(String key, TraceRecord record, RecordStoreException error) {

        static FetchResult success(String key, TraceRecord record) {
            return new FetchResult(key, record, null);
        }

        static FetchResult failure(String key, RecordStoreException error) {
            return new FetchResult(key, null, error);
        }
    }

    /**
     * Mutable state of a single run, confined to the thread executing it.
     */
    private static final class RunState {
        final TraceMerger merger;
        final Map<String, List<String>> keysByRecordId = new HashMap<>();
        int fetched;
        int skipped;
        int quarantined;
        int merges;
        int correlationErrors;

        RunState(TraceMerger merger) {
            this.merger = merger;
        }
    }
}
