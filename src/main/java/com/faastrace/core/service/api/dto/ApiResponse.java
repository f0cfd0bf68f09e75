package com.faastrace.core.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Envelope for every REST response of the service.
 *
 * Exactly one of {@code data} and {@code error} is set, depending on {@code success}.
 *
 * @param <T> the type of the response data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private boolean success;

    private T data;

    private ErrorInfo error;

    @Builder.Default
    private Instant timestamp = Instant.now();

    public static <T> ApiResponse<T> success(T data) {
        return ApiResponse.<T>builder()
                .success(true)
                .data(data)
                .build();
    }

    public static <T> ApiResponse<T> error(String message, String code) {
        return error(message, code, null);
    }

    public static <T> ApiResponse<T> error(String message, String code, String details) {
        return ApiResponse.<T>builder()
                .success(false)
                .error(new ErrorInfo(message, code, details))
                .build();
    }

    /**
     * Error payload; {@code code} is the machine-readable part clients should branch on.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorInfo(String message, String code, String details) {}
}
