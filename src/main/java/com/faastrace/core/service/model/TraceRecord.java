package com.faastrace.core.service.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One observed function invocation, as emitted by the in-function profiler.
 *
 * The trace id is rewritten while traces are merged. The parent id is only ever
 * assigned by correlation and, once assigned, cannot be cleared.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TraceRecord {

    /**
     * Ids accepted from uploads: letters, digits, dots, underscores and dashes, not starting with a dot.
     */
    public static final String ID_PATTERN = "[A-Za-z0-9_-][A-Za-z0-9._-]{0,254}";

    private static final java.util.regex.Pattern ID_MATCHER = java.util.regex.Pattern.compile(ID_PATTERN);

    @NotBlank
    @Pattern(regexp = ID_PATTERN, message = "must only contain letters, digits, '.', '_' or '-'")
    private String recordId;

    @NotBlank
    @Pattern(regexp = ID_PATTERN, message = "must only contain letters, digits, '.', '_' or '-'")
    private String traceId;

    private String parentId;

    private FunctionIdentity functionIdentity;

    private Instant invokedAt;

    private Instant finishedAt;

    private InboundContext inboundContext;

    @Builder.Default
    private List<OutboundContext> outboundContexts = new ArrayList<>();

    @Builder.Default
    private List<RecordData> data = new ArrayList<>();

    public void setParentId(String parentId) {
        if (parentId == null && this.parentId != null) {
            return;
        }
        this.parentId = parentId;
    }

    public boolean hasUploadableIds() {
        return recordId != null && ID_MATCHER.matcher(recordId).matches()
                && traceId != null && ID_MATCHER.matcher(traceId).matches();
    }

    public boolean hasTracingContext() {
        return recordId != null && !recordId.isBlank()
                && traceId != null && !traceId.isBlank();
    }

    public boolean hasResolvableInbound() {
        return inboundContext != null && inboundContext.isResolvable();
    }

    public boolean hasParent() {
        return parentId != null;
    }

    /**
     * Wall clock execution time in milliseconds, null when either timestamp is missing.
     */
    public Long executionTimeMs() {
        if (invokedAt == null || finishedAt == null) return null;
        return Duration.between(invokedAt, finishedAt).toMillis();
    }

    public String functionKey() {
        return functionIdentity != null ? functionIdentity.key() : null;
    }
}
