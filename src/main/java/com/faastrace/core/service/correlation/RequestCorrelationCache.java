package com.faastrace.core.service.correlation;

import com.faastrace.core.service.model.InboundContext;
import com.faastrace.core.service.model.OutboundContext;

import java.util.Optional;

/**
 * Pending inbound and outbound requests, keyed by canonical identifier.
 *
 * Lookups never remove entries. The caller removes an entry once it has processed
 * the match, so a failed merge can be retried against the same entry.
 */
public interface RequestCorrelationCache {

    /**
     * Caches an outbound request for later resolution.
     *
     * @throws DuplicateCorrelationException if the identifier is already pending outbound
     */
    void cacheOutbound(String identifier, String traceId, String recordId, OutboundContext context);

    /**
     * Caches an inbound request for later resolution.
     *
     * @throws DuplicateCorrelationException if the identifier is already pending inbound
     */
    void cacheInbound(String identifier, String traceId, String recordId, InboundContext context);

    /**
     * Finds the outbound call that may have triggered an inbound request.
     */
    Optional<PendingRequest<OutboundContext>> findOutboundForInbound(String identifier);

    /**
     * Finds the inbound request that an outbound call may have triggered.
     */
    Optional<PendingRequest<InboundContext>> findInboundForOutbound(String identifier);

    void removeOutbound(String identifier);

    void removeInbound(String identifier);

    int pendingInboundCount();

    int pendingOutboundCount();
}
