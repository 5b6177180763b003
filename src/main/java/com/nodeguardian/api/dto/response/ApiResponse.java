package com.nodeguardian.api.dto.response;

import java.time.Instant;
import lombok.Getter;

/**
 * Success envelope of the status API: {@code {success: true, data, timestamp}}.
 * Errors use {@link ApiErrorResponse}.
 */
@Getter
public class ApiResponse<T> {

    private final boolean success = true;
    private final T data;
    private final Instant timestamp;

    private ApiResponse(T data, Instant timestamp) {
        this.data = data;
        this.timestamp = timestamp;
    }

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(data, Instant.now());
    }
}
