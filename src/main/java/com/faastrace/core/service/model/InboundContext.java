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
 * The event that triggered an invocation, as observed by the invoked function.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InboundContext {

    private Provider provider;

    /**
     * Trigger kind, e.g. {@code queue}, {@code storage}, {@code http}.
     */
    private String triggerType;

    /**
     * Free-form attributes that must match the identifier of the triggering outbound call.
     */
    @Builder.Default
    private Map<String, Object> identifier = new LinkedHashMap<>();

    /**
     * False when the trigger cannot be correlated (manual or console invocations).
     */
    @Builder.Default
    private boolean resolvable = true;

    @Builder.Default
    private TriggerSynchronicity triggerSynchronicity = TriggerSynchronicity.UNIDENTIFIED;

    /**
     * Time spent between the event arriving and the handler starting, in milliseconds.
     */
    private Double overheadTime;

    /**
     * Set once the triggering outbound call has been correlated.
     */
    private Instant triggerFinishedAt;
}
