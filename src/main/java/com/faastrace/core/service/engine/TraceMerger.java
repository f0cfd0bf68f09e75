package com.faastrace.core.service.engine;

import com.faastrace.core.service.correlation.DuplicateCorrelationException;
import com.faastrace.core.service.correlation.IdentifierNormalizer;
import com.faastrace.core.service.correlation.PendingRequest;
import com.faastrace.core.service.correlation.RequestCorrelationCache;
import com.faastrace.core.service.ingest.IngestionException;
import com.faastrace.core.service.model.InboundContext;
import com.faastrace.core.service.model.OutboundContext;
import com.faastrace.core.service.model.Trace;
import com.faastrace.core.service.model.TraceRecord;
import com.faastrace.core.service.trace.TraceCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Reconstructs traces from records arriving in any order.
 *
 * Each record is attached to its trace, then its inbound trigger is matched against
 * cached outbound calls and each outbound call against cached inbound requests.
 * Whenever a match is found the two trace fragments are merged. Unmatched triggers
 * are cached for records that arrive later.
 *
 * Records must be processed one at a time: every lookup depends on cache state left
 * behind by the records before it.
 */
@Slf4j
@RequiredArgsConstructor
public class TraceMerger {

    private final TraceCache traceCache;
    private final RequestCorrelationCache correlationCache;

    // ==================== Public API ====================

    /**
     * Processes one record.
     *
     * @throws IngestionException with code {@code MISSING_TRACING_CONTEXT} if the record
     *         carries no record or trace id
     */
    public RecordOutcome process(TraceRecord record) {
        validateTracingContext(record);
        log.debug("Processing record {} (trace {})", record.getRecordId(), record.getTraceId());

        if (!attachToTrace(record)) {
            return RecordOutcome.duplicate(record.getRecordId());
        }

        var tally = new Tally();
        if (shouldResolveInbound(record)) {
            resolveInbound(record, tally);
        } else {
            log.debug("Skipping inbound resolving for record {}: parent set or inbound not resolvable",
                    record.getRecordId());
        }
        resolveOutbounds(record, tally);

        return tally.toOutcome(record.getRecordId());
    }

    /**
     * Moves every record of the child trace into the parent trace.
     *
     * The matched child record gets the parent id, if one is given. Afterwards the
     * child is empty and its id resolves to the parent but is no longer live.
     * Merging an empty trace changes nothing.
     */
    public void merge(Trace parent, Trace child, String parentId, String matchedChildRecordId) {
        if (parent == child) {
            assignParent(parent, parentId, matchedChildRecordId);
            return;
        }
        if (child.isEmpty()) {
            log.debug("Skipping merge of empty trace {} into {}", child.getTraceId(), parent.getTraceId());
            return;
        }

        var moved = child.drainRecords();
        for (var record : moved) {
            moveRecord(parent, record, parentId, matchedChildRecordId);
        }
        rekey(parent, child);

        log.debug("Merged trace {} into {} ({} records moved, {} total)",
                child.getTraceId(), parent.getTraceId(), moved.size(), parent.size());
    }

    // ==================== Trace Attachment ====================

    private void validateTracingContext(TraceRecord record) {
        if (!record.hasTracingContext()) {
            throw new IngestionException(
                    "Cannot process record without tracing context",
                    record.getRecordId(),
                    IngestionException.MISSING_TRACING_CONTEXT
            );
        }
    }

    private boolean attachToTrace(TraceRecord record) {
        var trace = traceCache.createOrGet(record.getTraceId());
        if (!trace.addRecord(record)) {
            log.warn("Record {} already part of trace {}, ignoring", record.getRecordId(), trace.getTraceId());
            return false;
        }
        return true;
    }

    private Trace currentTrace(TraceRecord record) {
        return traceCache.createOrGet(record.getTraceId());
    }

    // ==================== Inbound Resolution ====================

    private boolean shouldResolveInbound(TraceRecord record) {
        return record.hasResolvableInbound() && !record.hasParent();
    }

    private void resolveInbound(TraceRecord record, Tally tally) {
        var inbound = record.getInboundContext();
        String identifier = IdentifierNormalizer.canonicalize(inbound.getIdentifier());

        Optional<PendingRequest<OutboundContext>> match = correlationCache.findOutboundForInbound(identifier);
        if (match.isEmpty()) {
            log.debug("Cannot find outbound request for inbound identifier {}", identifier);
            deferInbound(record, identifier, tally);
            return;
        }

        var pending = match.get();
        var parentTrace = traceCache.get(pending.traceId());
        if (parentTrace.isEmpty()) {
            log.debug("Cannot find parent trace {} for inbound identifier {}", pending.traceId(), identifier);
            deferInbound(record, identifier, tally);
            return;
        }

        log.debug("Found outbound request of record {} for inbound identifier {}", pending.recordId(), identifier);
        merge(parentTrace.get(), currentTrace(record), pending.recordId(), record.getRecordId());
        inbound.setTriggerFinishedAt(pending.context().getFinishedAt());
        correlationCache.removeOutbound(identifier);
        tally.inboundResolved = true;
    }

    private void deferInbound(TraceRecord record, String identifier, Tally tally) {
        try {
            correlationCache.cacheInbound(identifier, record.getTraceId(), record.getRecordId(),
                    record.getInboundContext());
            tally.deferred++;
        } catch (DuplicateCorrelationException e) {
            logCorrelationConflict(e);
            tally.correlationErrors++;
        }
    }

    // ==================== Outbound Resolution ====================

    private void resolveOutbounds(TraceRecord record, Tally tally) {
        List<OutboundContext> outbounds = record.getOutboundContexts();
        if (outbounds == null || outbounds.isEmpty()) {
            return;
        }
        log.debug("Resolving {} outbound contexts of record {}", outbounds.size(), record.getRecordId());
        for (var outbound : outbounds) {
            resolveOutbound(record, outbound, tally);
        }
    }

    private void resolveOutbound(TraceRecord record, OutboundContext outbound, Tally tally) {
        String identifier = IdentifierNormalizer.canonicalize(outbound.getIdentifier());

        Optional<PendingRequest<InboundContext>> match = correlationCache.findInboundForOutbound(identifier);
        if (match.isPresent()) {
            var pending = match.get();
            var childTrace = traceCache.get(pending.traceId());
            if (childTrace.isPresent()) {
                log.debug("Found inbound request of record {} for outbound identifier {}",
                        pending.recordId(), identifier);
                merge(currentTrace(record), childTrace.get(), record.getRecordId(), pending.recordId());
                pending.context().setTriggerFinishedAt(outbound.getFinishedAt());
                correlationCache.removeInbound(identifier);
                tally.outboundResolved++;
                return;
            }
            log.debug("Cannot find child trace {} for outbound identifier {}", pending.traceId(), identifier);
        } else {
            log.debug("Cannot find inbound request for outbound identifier {}", identifier);
        }
        deferOutbound(record, identifier, outbound, tally);
    }

    private void deferOutbound(TraceRecord record, String identifier, OutboundContext outbound, Tally tally) {
        try {
            correlationCache.cacheOutbound(identifier, record.getTraceId(), record.getRecordId(), outbound);
            tally.deferred++;
        } catch (DuplicateCorrelationException e) {
            logCorrelationConflict(e);
            tally.correlationErrors++;
        }
    }

    // ==================== Merge Helpers ====================

    private void moveRecord(Trace parent, TraceRecord record, String parentId, String matchedChildRecordId) {
        record.setTraceId(parent.getTraceId());
        if (parentId != null && record.getRecordId().equals(matchedChildRecordId)) {
            record.setParentId(parentId);
        }
        if (!parent.addRecord(record)) {
            log.warn("Record {} exists in both trace {} and the trace merged into it, keeping the first",
                    record.getRecordId(), parent.getTraceId());
        }
    }

    private void assignParent(Trace trace, String parentId, String matchedChildRecordId) {
        if (parentId == null) return;
        trace.findRecord(matchedChildRecordId)
                .ifPresent(record -> record.setParentId(parentId));
    }

    private void rekey(Trace parent, Trace child) {
        traceCache.put(parent);
        traceCache.put(parent, child.getTraceId());
        traceCache.retire(child.getTraceId());
    }

    private void logCorrelationConflict(DuplicateCorrelationException e) {
        log.warn("Correlation conflict, trigger left unresolved: {}", e.getMessage());
    }

    // ==================== Inner Types ====================

    private static final class Tally {
        boolean inboundResolved;
        int outboundResolved;
        int deferred;
        int correlationErrors;

        RecordOutcome toOutcome(String recordId) {
            return new RecordOutcome(recordId, false, inboundResolved, outboundResolved, deferred, correlationErrors);
        }
    }
}
