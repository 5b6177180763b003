package com.nodeguardian.engine;

/** Result of evaluating one (rule, node) pair on one side (trigger or recovery). */
public enum EvaluationOutcome {
    /** Conditions duration-satisfied, not in cooldown: the action batch ran. */
    FIRED,
    /** Conditions not (yet) duration-satisfied. */
    NOT_SATISFIED,
    /** Satisfied but suppressed by the cooldown of the same kind. */
    COOLDOWN,
    /** Not applicable, e.g. recovery for a node that is not triggered. */
    SKIPPED
}
