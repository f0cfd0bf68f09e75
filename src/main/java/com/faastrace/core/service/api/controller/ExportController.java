package com.faastrace.core.service.api.controller;

import com.faastrace.core.service.api.dto.ApiResponse;
import com.faastrace.core.service.persistence.Neo4jWriter;
import com.faastrace.core.service.store.RecordStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Controller for trace export operations.
 *
 * Handles GET /export/neo4j/{traceId} for Neo4j exports.
 */
@Slf4j
@RestController
@RequestMapping("/export")
@Tag(name = "Trace Export", description = "Endpoints for exporting traces to external systems")
@RequiredArgsConstructor
public class ExportController {

    private final RecordStore recordStore;
    private final Neo4jWriter neo4jWriter;

    /**
     * Exports a trace to Neo4j.
     *
     * @param traceId the trace to export
     * @param mode "cypher" to return Cypher statements, "push" to push directly to Neo4j
     */
    @GetMapping("/neo4j/{traceId}")
    @Operation(
            summary = "Export trace to Neo4j",
            description = "Generates Cypher statements or pushes the trace directly to Neo4j"
    )
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Cypher statements returned"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Push to Neo4j initiated"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Trace not found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Neo4j not connected")
    })
    public ResponseEntity<ApiResponse<Object>> exportToNeo4j(
            @Parameter(description = "Trace ID") @PathVariable String traceId,
            @Parameter(description = "Export mode: 'cypher' or 'push'")
            @RequestParam(defaultValue = "cypher") String mode) {

        log.debug("Export request: traceId={}, mode={}", traceId, mode);

        if (recordStore.getTrace(traceId).isEmpty()) {
            log.warn("Trace not found for export: {}", traceId);
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ApiResponse.error("Trace not found", "NOT_FOUND"));
        }

        return "push".equalsIgnoreCase(mode) ? handlePushMode(traceId) : handleCypherMode(traceId);
    }

    private ResponseEntity<ApiResponse<Object>> handleCypherMode(String traceId) {
        List<String> statements = neo4jWriter.generateCypher(traceId);
        log.info("Generated {} Cypher statements for trace: {}", statements.size(), traceId);
        return ResponseEntity.ok(ApiResponse.success(new CypherExportResponse(traceId, statements)));
    }

    private ResponseEntity<ApiResponse<Object>> handlePushMode(String traceId) {
        if (!neo4jWriter.isConnected()) {
            log.warn("Neo4j not connected, cannot push trace: {}", traceId);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(ApiResponse.error("Neo4j not connected", "NEO4J_UNAVAILABLE"));
        }

        neo4jWriter.pushToNeo4j(traceId)
                .thenAccept(result -> {
                    if (result.success()) {
                        log.info("Neo4j push completed: {} (nodes={}, edges={})",
                                traceId, result.nodesExported(), result.edgesExported());
                    } else {
                        log.error("Neo4j push failed: {} - {}", traceId, result.errorMessage());
                    }
                });

        return ResponseEntity.accepted()
                .body(ApiResponse.success(new PushExportResponse(traceId, "Export to Neo4j initiated")));
    }

    record CypherExportResponse(
            String traceId,
            List<String> cypherStatements
    ) {}

    record PushExportResponse(
            String traceId,
            String message
    ) {}
}
