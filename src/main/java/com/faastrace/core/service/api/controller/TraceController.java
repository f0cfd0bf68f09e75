package com.faastrace.core.service.api.controller;

import com.faastrace.core.service.api.dto.ApiResponse;
import com.faastrace.core.service.api.dto.TraceDetailResponse;
import com.faastrace.core.service.engine.TraceGraphBuilder;
import com.faastrace.core.service.model.Trace;
import com.faastrace.core.service.model.TraceRecord;
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
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Controller for trace queries.
 *
 * Handles GET /traces and GET /traces/{traceId}.
 */
@Slf4j
@RestController
@RequestMapping("/traces")
@Tag(name = "Trace Queries", description = "Endpoints for querying reconstructed traces")
@RequiredArgsConstructor
public class TraceController {

    private final RecordStore recordStore;
    private final TraceGraphBuilder traceGraphBuilder;

    @GetMapping
    @Operation(summary = "List traces", description = "Returns the ids of all stored traces")
    public ResponseEntity<ApiResponse<List<String>>> listTraces() {
        return ResponseEntity.ok(ApiResponse.success(recordStore.listTraceIds()));
    }

    @GetMapping("/{traceId}")
    @Operation(
            summary = "Get trace details",
            description = "Returns the records of a trace with its root record and parent/child edges"
    )
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Trace found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Trace not found")
    })
    public ResponseEntity<ApiResponse<TraceDetailResponse>> getTraceDetails(
            @Parameter(description = "Trace ID") @PathVariable String traceId) {

        log.debug("Getting trace details: {}", traceId);

        return recordStore.getTrace(traceId)
                .map(trace -> ResponseEntity.ok(ApiResponse.success(toDetailResponse(trace))))
                .orElseGet(() -> {
                    log.warn("Trace not found: {}", traceId);
                    return ResponseEntity.status(HttpStatus.NOT_FOUND)
                            .body(ApiResponse.error("Trace not found", "NOT_FOUND"));
                });
    }

    // --- Private helpers ---

    private TraceDetailResponse toDetailResponse(Trace trace) {
        return TraceDetailResponse.builder()
                .traceId(trace.getTraceId())
                .rootRecordId(trace.rootRecordId())
                .recordCount(trace.size())
                .durationMs(durationMs(trace.getRecords()))
                .involvedFunctions(trace.involvedFunctions())
                .records(trace.getRecords().stream()
                        .map(this::toRecordResponse)
                        .toList())
                .edges(traceGraphBuilder.buildEdges(trace))
                .build();
    }

    private TraceDetailResponse.RecordResponse toRecordResponse(TraceRecord record) {
        return TraceDetailResponse.RecordResponse.builder()
                .recordId(record.getRecordId())
                .parentId(record.getParentId())
                .functionKey(record.functionKey())
                .triggerType(record.getInboundContext() != null
                        ? record.getInboundContext().getTriggerType() : null)
                .invokedAt(record.getInvokedAt())
                .finishedAt(record.getFinishedAt())
                .executionTimeMs(record.executionTimeMs())
                .outboundCount(record.getOutboundContexts() != null ? record.getOutboundContexts().size() : 0)
                .build();
    }

    private Long durationMs(List<TraceRecord> records) {
        var start = records.stream().map(TraceRecord::getInvokedAt)
                .filter(Objects::nonNull).min(Comparator.naturalOrder());
        var end = records.stream().map(TraceRecord::getFinishedAt)
                .filter(Objects::nonNull).max(Comparator.<Instant>naturalOrder());
        if (start.isEmpty() || end.isEmpty()) return null;
        return Duration.between(start.get(), end.get()).toMillis();
    }
}
