package com.nodeguardian.status;

import com.nodeguardian.domain.enums.RulePhase;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Externally visible status of one rule, aggregated over its nodes.
 *
 * <p>{@code phase} is TRIGGERED while any node is triggered. {@code lastError} carries the most
 * recent ConfigError, SelectorEmpty, MetricUnavailable or partial batch failure, and is null
 * after a clean evaluation.
 */
@Value
@Builder
public class RuleStatus {

    String ruleId;
    RulePhase phase;
    Instant lastTriggeredAt;
    Instant lastRecoveredAt;

    @Builder.Default
    List<String> triggeredNodes = List.of();

    String lastError;
    Instant updatedAt;

    /** True when the rule has been deleted or disabled; consumers drop their copy. */
    boolean removed;
}
