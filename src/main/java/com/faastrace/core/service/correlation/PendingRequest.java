package com.faastrace.core.service.correlation;

/**
 * A trigger waiting for its counterpart on the other side.
 *
 * @param identifier canonical identifier the request is keyed by
 * @param traceId    trace the owning record belonged to when it was cached
 * @param recordId   owning record
 * @param context    inbound or outbound context that was cached
 * @param <C>        context type
 */
public record PendingRequest<C>(
        String identifier,
        String traceId,
        String recordId,
        C context
) {}
