package com.nodeguardian.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Alert severity levels.
 *
 * <ul>
 *   <li>CRITICAL -- node is being tainted or drained</li>
 *   <li>WARNING -- default for trigger alerts</li>
 *   <li>INFO -- recovery and informational alerts</li>
 * </ul>
 */
public enum AlertSeverity {
    CRITICAL,
    WARNING,
    INFO;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AlertSeverity fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
