package com.faastrace.core.service.api.controller;

import com.faastrace.core.service.api.dto.ApiResponse;
import com.faastrace.core.service.config.FaasTraceConfig;
import com.faastrace.core.service.ingest.IngestionRunResult;
import com.faastrace.core.service.ingest.RecordIngestionDriver;
import com.faastrace.core.service.model.TraceRecord;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Controller for ingestion.
 *
 * Handles POST /ingest/runs to process the backlog and POST /ingest/records to
 * add a record to it.
 */
@Slf4j
@RestController
@RequestMapping("/ingest")
@Tag(name = "Ingestion", description = "Endpoints for running ingestion and uploading records")
@RequiredArgsConstructor
public class IngestionController {

    private final RecordIngestionDriver ingestionDriver;
    private final FaasTraceConfig faasTraceConfig;

    @PostMapping("/runs")
    @Operation(
            summary = "Run ingestion",
            description = "Processes the backlog of unprocessed records and returns the run summary"
    )
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Run completed"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Another run is in progress"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Record store unavailable")
    })
    public ResponseEntity<ApiResponse<IngestionRunResult>> runIngestion() {
        log.debug("Ingestion run requested");
        return ResponseEntity.ok(ApiResponse.success(ingestionDriver.run()));
    }

    @PostMapping("/records")
    @Operation(
            summary = "Upload record",
            description = "Adds a raw invocation record to the backlog of unprocessed records"
    )
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Record queued"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Record without tracing context"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "403", description = "Record upload disabled")
    })
    public ResponseEntity<ApiResponse<RecordAcceptedResponse>> uploadRecord(
            @Valid @RequestBody TraceRecord record) {

        if (!faasTraceConfig.getFeatures().isRecordUploadEnabled()) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN)
                    .body(ApiResponse.error("Record upload is disabled", "RECORD_UPLOAD_DISABLED"));
        }

        ingestionDriver.submit(record);
        log.info("Accepted record {} of trace {}", record.getRecordId(), record.getTraceId());

        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ApiResponse.success(new RecordAcceptedResponse(record.getRecordId(), record.getTraceId())));
    }

    /**
     * Response for an accepted record upload.
     */
    record RecordAcceptedResponse(
            String recordId,
            String traceId
    ) {}
}
