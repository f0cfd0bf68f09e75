package com.faastrace.core.service.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * All traces whose root invocation ran the same function.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Profile {

    private String profileId;

    private FunctionIdentity functionIdentity;

    @Builder.Default
    @JsonDeserialize(as = LinkedHashSet.class)
    private Set<String> traceIds = new LinkedHashSet<>();

    private Instant createdAt;

    private Instant updatedAt;

    public static Profile create(FunctionIdentity functionIdentity) {
        var now = Instant.now();
        return Profile.builder()
                .profileId(UUID.randomUUID().toString())
                .functionIdentity(functionIdentity)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * @return false if the trace was already part of this profile
     */
    public boolean addTrace(String traceId) {
        if (traceId == null) {
            throw new IllegalArgumentException("Cannot add trace to profile without trace ID");
        }
        boolean added = traceIds.add(traceId);
        if (added) {
            updatedAt = Instant.now();
        }
        return added;
    }

    public String functionKey() {
        return functionIdentity != null ? functionIdentity.key() : null;
    }
}
