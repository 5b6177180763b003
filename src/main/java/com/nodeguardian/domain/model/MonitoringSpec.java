package com.nodeguardian.domain.model;

import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/** Timer and cooldown periods of a rule. */
@Value
@Builder
public class MonitoringSpec {

    Duration checkInterval;
    Duration cooldownPeriod;
    Duration recoveryCooldownPeriod;
}
