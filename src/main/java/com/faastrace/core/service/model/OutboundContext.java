package com.faastrace.core.service.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An outgoing call made by a function that may have triggered a downstream invocation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OutboundContext {

    private Provider provider;

    private String triggerType;

    @Builder.Default
    private Map<String, Object> identifier = new LinkedHashMap<>();

    @Builder.Default
    private TriggerSynchronicity triggerSynchronicity = TriggerSynchronicity.UNIDENTIFIED;

    private Instant invokedAt;

    private Instant finishedAt;

    /**
     * Time the call itself added to the caller, in milliseconds.
     */
    private Double overheadTime;
}
