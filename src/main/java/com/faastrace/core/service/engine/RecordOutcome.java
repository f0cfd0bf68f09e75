package com.faastrace.core.service.engine;

/**
 * What happened to a single record inside the merger.
 *
 * @param duplicate         the record id was already part of its trace, nothing was resolved
 * @param inboundResolved   the inbound trigger was matched to a cached outbound call
 * @param outboundResolved  number of outbound calls matched to cached inbound requests
 * @param deferred          number of triggers cached for later resolution
 * @param correlationErrors number of triggers that could not be cached because of a duplicate identifier
 */
public record RecordOutcome(
        String recordId,
        boolean duplicate,
        boolean inboundResolved,
        int outboundResolved,
        int deferred,
        int correlationErrors
) {

    public static RecordOutcome duplicate(String recordId) {
        return new RecordOutcome(recordId, true, false, 0, 0, 0);
    }

    public int merges() {
        return (inboundResolved ? 1 : 0) + outboundResolved;
    }
}
