package com.faastrace.core.service.api.advice;

import com.faastrace.core.service.api.dto.ApiResponse;
import com.faastrace.core.service.ingest.IngestionException;
import com.faastrace.core.service.store.RecordStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

/**
 * Global exception handler for REST controllers.
 *
 * Maps domain exceptions to HTTP statuses inside the standard response envelope.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidationException(
            MethodArgumentNotValidException ex) {

        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));

        log.warn("Validation error: {}", details);

        return ResponseEntity.badRequest()
                .body(ApiResponse.error("Validation failed", "VALIDATION_ERROR", details));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());

        return ResponseEntity.badRequest()
                .body(ApiResponse.error("Malformed request body", "MALFORMED_REQUEST"));
    }

    @ExceptionHandler(IngestionException.class)
    public ResponseEntity<ApiResponse<Void>> handleIngestionException(IngestionException ex) {
        HttpStatus status = switch (ex.getErrorCode()) {
            case IngestionException.RUN_IN_PROGRESS -> HttpStatus.CONFLICT;
            case IngestionException.STORE_UNAVAILABLE,
                    IngestionException.INGESTION_DISABLED -> HttpStatus.SERVICE_UNAVAILABLE;
            case IngestionException.MISSING_TRACING_CONTEXT,
                    IngestionException.INVALID_RECORD_ID -> HttpStatus.BAD_REQUEST;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };

        if (status.is5xxServerError()) {
            log.error("Ingestion error: {} [{}]", ex.getMessage(), ex.getErrorCode());
        } else {
            log.warn("Ingestion request rejected: {} [{}]", ex.getMessage(), ex.getErrorCode());
        }

        return ResponseEntity.status(status)
                .body(ApiResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(RecordStoreException.class)
    public ResponseEntity<ApiResponse<Void>> handleRecordStoreException(RecordStoreException ex) {
        HttpStatus status = switch (ex.getReason()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_KEY -> HttpStatus.BAD_REQUEST;
            case UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case DESERIALIZATION, WRITE_FAILED -> HttpStatus.INTERNAL_SERVER_ERROR;
        };

        if (status.is5xxServerError()) {
            log.error("Record store error for {}: {} [{}]", ex.getKey(), ex.getMessage(), ex.getReason());
        } else {
            log.debug("Record store refused {}: {} [{}]", ex.getKey(), ex.getMessage(), ex.getReason());
        }

        return ResponseEntity.status(status)
                .body(ApiResponse.error(ex.getMessage(), ex.getReason().name()));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnknownPath(NoResourceFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error("No endpoint at /" + ex.getResourcePath(), "NOT_FOUND"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Void>> handleIllegalArgumentException(
            IllegalArgumentException ex) {
        log.warn("Illegal argument: {}", ex.getMessage());

        return ResponseEntity.badRequest()
                .body(ApiResponse.error(ex.getMessage(), "INVALID_ARGUMENT"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleUnexpected(Exception ex) {
        log.error("Unhandled error while serving request", ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error("Internal error", "INTERNAL_ERROR", ex.getMessage()));
    }
}
