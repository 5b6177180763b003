package com.nodeguardian.lifecycle;

import lombok.Builder;
import lombok.Data;

/** Summary of the startup synchronization, logged once. */
@Data
@Builder
public class StartupResult {

    private long startedAt;
    private long durationMs;
    private int cooldownEntriesLoaded;
    private int nodeStatesLoaded;
    private int rulesRegistered;
    private int rulesRejected;
    private boolean ruleSourceAvailable;
    private boolean success;
    private String error;
}
