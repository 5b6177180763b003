package com.nodeguardian.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/**
 * Node metrics a condition can watch. Percentages are 0-100; {@link #CPU_LOAD_RATIO} is the
 * one-minute load average divided by the node's CPU count.
 */
public enum MetricKind {
    CPU_UTILIZATION_PERCENT("cpuUtilizationPercent"),
    MEMORY_UTILIZATION_PERCENT("memoryUtilizationPercent"),
    DISK_UTILIZATION_PERCENT("diskUtilizationPercent"),
    CPU_LOAD_RATIO("cpuLoadRatio");

    private final String documentName;

    MetricKind(String documentName) {
        this.documentName = documentName;
    }

    @JsonValue
    public String getDocumentName() {
        return documentName;
    }

    @JsonCreator
    public static MetricKind fromValue(String value) {
        if (value == null) {
            return null;
        }
        return Arrays.stream(values())
                .filter(kind -> kind.documentName.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown metric: " + value));
    }
}
