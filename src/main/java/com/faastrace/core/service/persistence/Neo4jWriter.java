package com.faastrace.core.service.persistence;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Writes stored traces into Neo4j as a call graph.
 *
 * A trace becomes one {@code FaasTrace} node, one {@code FunctionNode} per record and a
 * {@code TRIGGERED} relationship from every parent record to each child it triggered.
 * All writes are MERGEs keyed by trace and record id, so pushing a trace again after
 * later records joined it only adds what is new.
 */
public interface Neo4jWriter {

    /**
     * Renders the statements a push of the stored trace would run, without touching Neo4j.
     *
     * @return trace metadata, then function nodes, then edges; empty if the trace is not stored
     */
    List<String> generateCypher(String traceId);

    /**
     * Pushes the stored trace in a single write transaction.
     *
     * A missing trace, a store read failure or a statement rejected by Neo4j completes the
     * future normally with an unsuccessful {@link ExportResult}.
     */
    CompletableFuture<ExportResult> pushToNeo4j(String traceId);

    /**
     * Whether export is enabled and the database answered at startup.
     */
    boolean isConnected();

    /**
     * Outcome of one trace push.
     *
     * @param nodesExported number of function nodes merged, one per record of the trace
     * @param edgesExported number of parent/child relationships merged
     * @param errorMessage  why the push failed, null on success
     */
    record ExportResult(
            String traceId,
            boolean success,
            int nodesExported,
            int edgesExported,
            long durationMs,
            String errorMessage
    ) {
        public static ExportResult success(String traceId, int functionNodes, int edges, long durationMs) {
            return new ExportResult(traceId, true, functionNodes, edges, durationMs, null);
        }

        public static ExportResult failure(String traceId, String reason) {
            return new ExportResult(traceId, false, 0, 0, 0, reason);
        }
    }
}
