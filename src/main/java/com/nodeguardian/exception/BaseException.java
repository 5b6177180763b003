package com.nodeguardian.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the NodeGuardian error taxonomy. Carries an {@link ErrorCode}, used as the status
 * prefix and the HTTP status of the status API, plus structured details for logs.
 *
 * <p>Unchecked: engine boundaries (timer callbacks, batch loops, channel fan-out) catch and
 * record these, so nothing reaches a scheduler thread.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of(), null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        this(errorCode, message, details, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, Map.of(), cause);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }
}
