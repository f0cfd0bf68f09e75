package com.faastrace.core.service.correlation;

import com.faastrace.core.service.correlation.DuplicateCorrelationException.Side;
import com.faastrace.core.service.model.InboundContext;
import com.faastrace.core.service.model.OutboundContext;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory implementation of RequestCorrelationCache.
 *
 * One instance lives for one ingestion run and is confined to the thread driving it.
 */
@Slf4j
public class InMemoryRequestCorrelationCache implements RequestCorrelationCache {

    private final Map<String, PendingRequest<InboundContext>> pendingInbound = new LinkedHashMap<>();
    private final Map<String, PendingRequest<OutboundContext>> pendingOutbound = new LinkedHashMap<>();

    @Override
    public void cacheOutbound(String identifier, String traceId, String recordId, OutboundContext context) {
        if (pendingOutbound.containsKey(identifier)) {
            throw new DuplicateCorrelationException(identifier, Side.OUTBOUND, recordId);
        }
        pendingOutbound.put(identifier, new PendingRequest<>(identifier, traceId, recordId, context));
        log.debug("Cached outbound request: identifier={}, recordId={}", identifier, recordId);
    }

    @Override
    public void cacheInbound(String identifier, String traceId, String recordId, InboundContext context) {
        if (pendingInbound.containsKey(identifier)) {
            throw new DuplicateCorrelationException(identifier, Side.INBOUND, recordId);
        }
        pendingInbound.put(identifier, new PendingRequest<>(identifier, traceId, recordId, context));
        log.debug("Cached inbound request: identifier={}, recordId={}", identifier, recordId);
    }

    @Override
    public Optional<PendingRequest<OutboundContext>> findOutboundForInbound(String identifier) {
        return Optional.ofNullable(pendingOutbound.get(identifier));
    }

    @Override
    public Optional<PendingRequest<InboundContext>> findInboundForOutbound(String identifier) {
        return Optional.ofNullable(pendingInbound.get(identifier));
    }

    @Override
    public void removeOutbound(String identifier) {
        pendingOutbound.remove(identifier);
    }

    @Override
    public void removeInbound(String identifier) {
        pendingInbound.remove(identifier);
    }

    @Override
    public int pendingInboundCount() {
        return pendingInbound.size();
    }

    @Override
    public int pendingOutboundCount() {
        return pendingOutbound.size();
    }
}
