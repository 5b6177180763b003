package com.nodeguardian.status;

/** Fire-and-forget sink for rule status. Implementations must not block the caller. */
public interface StatusPublisher {

    void publish(RuleStatus status);
}
