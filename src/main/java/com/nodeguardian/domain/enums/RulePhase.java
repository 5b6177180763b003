package com.nodeguardian.domain.enums;

/**
 * Lifecycle phase of a (rule, node) pair.
 *
 * <p>IDLE -> TRIGGERED when the trigger conditions are duration-satisfied outside cooldown and
 * the trigger batch has run. TRIGGERED -> IDLE when the recovery conditions are satisfied and
 * the recovery batch has run.
 */
public enum RulePhase {
    IDLE,
    TRIGGERED
}
