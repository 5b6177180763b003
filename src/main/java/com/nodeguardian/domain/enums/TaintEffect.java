package com.nodeguardian.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/** Kubernetes taint effects, serialized with their API spelling. */
public enum TaintEffect {
    NO_SCHEDULE("NoSchedule"),
    PREFER_NO_SCHEDULE("PreferNoSchedule"),
    NO_EXECUTE("NoExecute");

    private final String apiName;

    TaintEffect(String apiName) {
        this.apiName = apiName;
    }

    @JsonValue
    public String getApiName() {
        return apiName;
    }

    @JsonCreator
    public static TaintEffect fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return Arrays.stream(values())
                .filter(effect -> effect.apiName.equalsIgnoreCase(value) || effect.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown taint effect: " + value));
    }
}
