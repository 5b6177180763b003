package com.nodeguardian.domain.enums;

/**
 * How the duration-satisfied results of a rule's conditions are combined.
 *
 * <p>AND requires every condition to be satisfied at the same time (each clock runs
 * independently). OR requires at least one. An empty condition list never matches.
 */
public enum ConditionLogic {
    AND,
    OR
}
