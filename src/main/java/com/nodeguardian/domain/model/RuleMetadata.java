package com.nodeguardian.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Operator-facing metadata of a rule.
 *
 * <p>Lower {@code priority} numbers are evaluated and listed first.
 */
@Value
@Builder
public class RuleMetadata {

    public static final int DEFAULT_PRIORITY = 100;

    @Builder.Default
    boolean enabled = true;

    @Builder.Default
    int priority = DEFAULT_PRIORITY;

    String description;
}
