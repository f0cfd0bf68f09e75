package com.faastrace.core.service.engine;

import com.faastrace.core.service.correlation.IdentifierNormalizer;
import com.faastrace.core.service.model.InboundContext;
import com.faastrace.core.service.model.OutboundContext;
import com.faastrace.core.service.model.Trace;
import com.faastrace.core.service.model.TraceEdge;
import com.faastrace.core.service.model.TraceRecord;
import com.faastrace.core.service.model.TriggerSynchronicity;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Derives the parent/child edges of a trace.
 */
@Component
public class TraceGraphBuilder {

    /**
     * One edge per record whose parent is part of the same trace, in record order.
     */
    public List<TraceEdge> buildEdges(Trace trace) {
        var edges = new ArrayList<TraceEdge>();
        for (var child : trace.getRecords()) {
            if (!child.hasParent()) continue;
            trace.findRecord(child.getParentId())
                    .map(parent -> buildEdge(parent, child))
                    .ifPresent(edges::add);
        }
        return edges;
    }

    // ==================== Private Methods ====================

    private TraceEdge buildEdge(TraceRecord parent, TraceRecord child) {
        var inbound = child.getInboundContext();
        var outbound = matchingOutbound(parent, inbound).orElse(null);

        return new TraceEdge(
                parent.getRecordId(),
                child.getRecordId(),
                triggerType(inbound, outbound),
                synchronicity(inbound, outbound),
                overhead(inbound, outbound),
                latency(child, inbound)
        );
    }

    private Optional<OutboundContext> matchingOutbound(TraceRecord parent, InboundContext inbound) {
        if (inbound == null || parent.getOutboundContexts() == null) {
            return Optional.empty();
        }
        var identifier = IdentifierNormalizer.canonicalize(inbound.getIdentifier());
        return parent.getOutboundContexts().stream()
                .filter(outbound -> identifier.equals(IdentifierNormalizer.canonicalize(outbound.getIdentifier())))
                .findFirst();
    }

    private String triggerType(InboundContext inbound, OutboundContext outbound) {
        if (inbound != null && inbound.getTriggerType() != null) return inbound.getTriggerType();
        return outbound != null ? outbound.getTriggerType() : null;
    }

    private TriggerSynchronicity synchronicity(InboundContext inbound, OutboundContext outbound) {
        if (outbound != null && outbound.getTriggerSynchronicity() != TriggerSynchronicity.UNIDENTIFIED
                && outbound.getTriggerSynchronicity() != null) {
            return outbound.getTriggerSynchronicity();
        }
        if (inbound != null && inbound.getTriggerSynchronicity() != null) {
            return inbound.getTriggerSynchronicity();
        }
        return TriggerSynchronicity.UNIDENTIFIED;
    }

    private Double overhead(InboundContext inbound, OutboundContext outbound) {
        Double outboundOverhead = outbound != null ? outbound.getOverheadTime() : null;
        Double inboundOverhead = inbound != null ? inbound.getOverheadTime() : null;
        if (outboundOverhead == null && inboundOverhead == null) return null;
        return (outboundOverhead != null ? outboundOverhead : 0.0)
                + (inboundOverhead != null ? inboundOverhead : 0.0);
    }

    private Long latency(TraceRecord child, InboundContext inbound) {
        if (inbound == null || inbound.getTriggerFinishedAt() == null || child.getInvokedAt() == null) {
            return null;
        }
        return Duration.between(inbound.getTriggerFinishedAt(), child.getInvokedAt()).toMillis();
    }
}
