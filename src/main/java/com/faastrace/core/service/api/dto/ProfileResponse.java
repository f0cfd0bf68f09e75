package com.faastrace.core.service.api.dto;

import com.faastrace.core.service.model.FunctionIdentity;
import com.faastrace.core.service.model.Profile;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for a profile.
 */
public record ProfileResponse(
        String profileId,
        String functionKey,
        FunctionIdentity functionIdentity,
        int traceCount,
        List<String> traceIds,
        Instant createdAt,
        Instant updatedAt
) {

    public static ProfileResponse from(Profile profile) {
        return new ProfileResponse(
                profile.getProfileId(),
                profile.functionKey(),
                profile.getFunctionIdentity(),
                profile.getTraceIds().size(),
                List.copyOf(profile.getTraceIds()),
                profile.getCreatedAt(),
                profile.getUpdatedAt()
        );
    }
}
