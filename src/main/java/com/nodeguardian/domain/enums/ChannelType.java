package com.nodeguardian.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Notification channel kinds an alert can be delivered to. */
public enum ChannelType {
    LOG,
    WEBHOOK,
    EMAIL,
    CHAT;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ChannelType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        // "slack" is the original name of the chat channel
        if (normalized.equals("SLACK")) {
            return CHAT;
        }
        return valueOf(normalized);
    }
}
