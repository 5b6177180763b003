package com.nodeguardian.domain.enums;

/** Independent cooldown bookkeeping per (rule, node). */
public enum CooldownKind {
    TRIGGER,
    RECOVERY
}
