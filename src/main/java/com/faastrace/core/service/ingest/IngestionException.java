package com.faastrace.core.service.ingest;

/**
 * Raised when a record or a whole ingestion run cannot be processed.
 *
 * The error code tells callers whether only one record was affected
 * ({@link #MISSING_TRACING_CONTEXT}, {@link #INVALID_RECORD_ID}) or the run itself was refused.
 */
public class IngestionException extends RuntimeException {

    public static final String MISSING_TRACING_CONTEXT = "MISSING_TRACING_CONTEXT";
    public static final String INVALID_RECORD_ID = "INVALID_RECORD_ID";
    public static final String STORE_UNAVAILABLE = "STORE_UNAVAILABLE";
    public static final String RUN_IN_PROGRESS = "RUN_IN_PROGRESS";
    public static final String INGESTION_DISABLED = "INGESTION_DISABLED";

    private final String recordKey;
    private final String errorCode;

    public IngestionException(String message, String recordKey, String errorCode) {
        this(message, recordKey, errorCode, null);
    }

    public IngestionException(String message, String recordKey, String errorCode, Throwable cause) {
        super(message, cause);
        this.recordKey = recordKey;
        this.errorCode = errorCode;
    }

    /**
     * Key or id of the offending record, null for run-level failures.
     */
    public String getRecordKey() {
        return recordKey;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
