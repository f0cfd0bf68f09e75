package com.faastrace.core.service.api.dto;

import com.faastrace.core.service.model.TraceEdge;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Response DTO for trace details.
 *
 * Contains the records of a reconstructed trace, its root and the parent/child edges.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TraceDetailResponse {

    private String traceId;

    private String rootRecordId;

    private int recordCount;

    /**
     * Wall clock span from the earliest invocation to the latest finish.
     */
    private Long durationMs;

    private Set<String> involvedFunctions;

    private List<RecordResponse> records;

    private List<TraceEdge> edges;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class RecordResponse {
        private String recordId;
        private String parentId;
        private String functionKey;
        private String triggerType;
        private Instant invokedAt;
        private Instant finishedAt;
        private Long executionTimeMs;
        private int outboundCount;
    }
}
