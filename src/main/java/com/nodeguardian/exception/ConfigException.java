package com.nodeguardian.exception;

import java.util.Map;

/** A rule or template document that cannot be turned into a valid domain object. */
public class ConfigException extends BaseException {

    public ConfigException(String message) {
        super(ErrorCode.CONFIG_ERROR, message);
    }

    public ConfigException(String message, Map<String, Object> details) {
        super(ErrorCode.CONFIG_ERROR, message, details);
    }

    public ConfigException(String message, Throwable cause) {
        super(ErrorCode.CONFIG_ERROR, message, cause);
    }
}
