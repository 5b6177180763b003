package com.nodeguardian.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error categories. {@code code} prefixes the {@code lastError} of a published rule status;
 * {@code httpStatus} applies when the error surfaces through the status API.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    CONCURRENCY_CONFLICT("CONCURRENCY_CONFLICT", 409),
    SELECTOR_EMPTY("SELECTOR_EMPTY", 409),
    CONFIG_ERROR("CONFIG_ERROR", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    METRIC_UNAVAILABLE("METRIC_UNAVAILABLE", 502),
    SELECTOR_ERROR("SELECTOR_ERROR", 502),
    ACTION_EXECUTION_ERROR("ACTION_EXECUTION_ERROR", 502),
    NOTIFICATION_ERROR("NOTIFICATION_ERROR", 502);

    private final String code;
    private final int httpStatus;
}
