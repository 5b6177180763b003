package com.nodeguardian.status;

import org.springframework.context.ApplicationEvent;

/**
 * Published on every rule status change.
 *
 * <p>Consumed by {@link RuleStatusCache}, which backs the read-only status API.
 */
public class RuleStatusEvent extends ApplicationEvent {

    private final RuleStatus status;

    public RuleStatusEvent(Object source, RuleStatus status) {
        super(source);
        this.status = status;
    }

    public RuleStatus getStatus() {
        return status;
    }
}
