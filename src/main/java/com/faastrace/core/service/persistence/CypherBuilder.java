package com.faastrace.core.service.persistence;

import com.faastrace.core.service.engine.TraceGraphBuilder;
import com.faastrace.core.service.model.Trace;
import com.faastrace.core.service.model.TraceEdge;
import com.faastrace.core.service.model.TraceRecord;
import com.faastrace.core.service.store.RecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds Cypher statements for stored traces.
 *
 * Every record becomes a {@code FunctionNode}, every parent/child link a
 * {@code TRIGGERED} relationship. Statements use MERGE so a trace can be pushed twice.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CypherBuilder {

    static final String NODE_LABEL = "FunctionNode";
    static final String EDGE_TYPE = "TRIGGERED";

    private final RecordStore recordStore;
    private final TraceGraphBuilder traceGraphBuilder;

    // ==================== Public API ====================

    /**
     * Builds Cypher statements for a stored trace.
     *
     * @return the statements, empty if the trace is not stored
     */
    public List<String> buildCypher(String traceId) {
        return recordStore.getTrace(traceId)
                .map(this::buildStatementsForTrace)
                .orElseGet(() -> handleTraceNotFound(traceId));
    }

    /**
     * Builds Cypher statements for a trace: metadata first, then nodes, then edges.
     */
    public List<String> buildStatementsForTrace(Trace trace) {
        return buildGraph(trace).statements();
    }

    /**
     * Builds the statements of a trace together with the number of nodes and edges they write.
     */
    public TraceStatements buildGraph(Trace trace) {
        var edges = traceGraphBuilder.buildEdges(trace);
        var statements = new ArrayList<String>(1 + trace.size() + edges.size());
        statements.add(buildTraceMetadataStatement(trace));
        trace.getRecords().forEach(record -> statements.add(buildNodeStatement(trace.getTraceId(), record)));
        edges.forEach(edge -> statements.add(buildEdgeStatement(trace.getTraceId(), edge)));
        log.debug("Generated {} Cypher statements for trace: {}", statements.size(), trace.getTraceId());
        return new TraceStatements(List.copyOf(statements), trace.size(), edges.size());
    }

    private List<String> handleTraceNotFound(String traceId) {
        log.warn("Trace not found for Cypher generation: {}", traceId);
        return List.of();
    }

    // ==================== Statement Building ====================

    private String buildTraceMetadataStatement(Trace trace) {
        return """
            MERGE (t:FaasTrace {traceId: '%s'}) \
            SET t.recordCount = %d, t.rootRecordId = '%s', t.updatedAt = timestamp()"""
                .formatted(
                        escape(trace.getTraceId()),
                        trace.size(),
                        escape(nullToEmpty(trace.rootRecordId()))
                );
    }

    private String buildNodeStatement(String traceId, TraceRecord record) {
        var identity = record.getFunctionIdentity();
        var props = new StringBuilder();
        props.append("n.traceId = '%s'".formatted(escape(traceId)));
        props.append(", n.functionKey = '%s'".formatted(escape(nullToEmpty(record.functionKey()))));
        if (identity != null) {
            props.append(", n.provider = '%s'".formatted(identity.provider() != null ? identity.provider().value() : ""));
            props.append(", n.functionName = '%s'".formatted(escape(nullToEmpty(identity.functionName()))));
            props.append(", n.handler = '%s'".formatted(escape(nullToEmpty(identity.handler()))));
        }
        appendInstant(props, "invokedAt", record.getInvokedAt());
        appendInstant(props, "finishedAt", record.getFinishedAt());
        if (record.executionTimeMs() != null) {
            props.append(", n.executionTimeMs = %d".formatted(record.executionTimeMs()));
        }
        return "MERGE (n:%s {recordId: '%s'}) SET %s".formatted(NODE_LABEL, escape(record.getRecordId()), props);
    }

    private String buildEdgeStatement(String traceId, TraceEdge edge) {
        var props = new StringBuilder();
        props.append("e.traceId = '%s'".formatted(escape(traceId)));
        props.append(", e.triggerType = '%s'".formatted(escape(nullToEmpty(edge.triggerType()))));
        props.append(", e.synchronicity = '%s'".formatted(edge.synchronicity().value()));
        if (edge.overheadMs() != null) {
            props.append(", e.overheadMs = %s".formatted(edge.overheadMs()));
        }
        if (edge.latencyMs() != null) {
            props.append(", e.latencyMs = %d".formatted(edge.latencyMs()));
        }
        return """
            MATCH (p:%s {recordId: '%s'}), (c:%s {recordId: '%s'}) \
            MERGE (p)-[e:%s]->(c) \
            SET %s"""
                .formatted(
                        NODE_LABEL, escape(edge.parentRecordId()),
                        NODE_LABEL, escape(edge.childRecordId()),
                        EDGE_TYPE,
                        props
                );
    }

    // ==================== Utility Methods ====================

    private void appendInstant(StringBuilder props, String name, Instant value) {
        if (value != null) {
            props.append(", n.%s = datetime('%s')".formatted(name, value));
        }
    }

    private String escape(String value) {
        return value == null ? "" : value.replace("\\", "\\\\").replace("'", "\\'");
    }

    private String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    /**
     * Statements of one trace with the number of function nodes and edges they merge.
     */
    public record TraceStatements(List<String> statements, int nodeCount, int edgeCount) {}
}
