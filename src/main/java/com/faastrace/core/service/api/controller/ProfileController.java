package com.faastrace.core.service.api.controller;

import com.faastrace.core.service.api.dto.ApiResponse;
import com.faastrace.core.service.api.dto.ProfileResponse;
import com.faastrace.core.service.store.RecordStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Controller for profile queries.
 */
@Slf4j
@RestController
@RequestMapping("/profiles")
@Tag(name = "Profile Queries", description = "Endpoints for querying profiles per root function")
@RequiredArgsConstructor
public class ProfileController {

    private final RecordStore recordStore;

    @GetMapping
    @Operation(summary = "List profiles", description = "Returns all profiles with their trace ids")
    public ResponseEntity<ApiResponse<List<ProfileResponse>>> listProfiles() {
        var profiles = recordStore.listProfiles().stream()
                .map(ProfileResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(profiles));
    }

    @GetMapping("/{profileId}")
    @Operation(summary = "Get profile", description = "Returns a single profile")
    public ResponseEntity<ApiResponse<ProfileResponse>> getProfile(
            @Parameter(description = "Profile ID") @PathVariable String profileId) {

        return recordStore.getProfile(profileId)
                .map(profile -> ResponseEntity.ok(ApiResponse.success(ProfileResponse.from(profile))))
                .orElseGet(() -> {
                    log.warn("Profile not found: {}", profileId);
                    return ResponseEntity.status(HttpStatus.NOT_FOUND)
                            .body(ApiResponse.error("Profile not found", "NOT_FOUND"));
                });
    }
}
