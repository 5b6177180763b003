package com.nodeguardian.engine;

import com.nodeguardian.domain.model.NodeRuleKey;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import org.springframework.stereotype.Component;

/**
 * At most one in-flight evaluation or action batch per (rule, node).
 *
 * <p>A slot is claimed when work is submitted and released when it finishes; a second claim
 * for a busy key fails and the caller skips that tick instead of queueing it. Retiring a rule
 * rejects all further claims for it and returns a future that completes once its last
 * in-flight slot is released, which is when its persisted state can be purged.
 */
@Component
public class ExecutionSlots {

    private final Set<NodeRuleKey> inFlight = new HashSet<>();
    private final Map<String, Integer> inFlightPerRule = new HashMap<>();
    private final Map<String, CompletableFuture<Void>> retired = new HashMap<>();

    /** @return false when the key is already in flight or its rule is retired */
    public synchronized boolean tryClaim(NodeRuleKey key) {
        if (retired.containsKey(key.ruleId()) || !inFlight.add(key)) {
            return false;
        }
        inFlightPerRule.merge(key.ruleId(), 1, Integer::sum);
        return true;
    }

    public void release(NodeRuleKey key) {
        CompletableFuture<Void> drained = null;
        synchronized (this) {
            if (!inFlight.remove(key)) {
                return;
            }
            Integer remaining = inFlightPerRule.merge(key.ruleId(), -1, Integer::sum);
            if (remaining != null && remaining <= 0) {
                inFlightPerRule.remove(key.ruleId());
                drained = retired.get(key.ruleId());
            }
        }
        // complete outside the monitor so purge callbacks never run while holding it
        if (drained != null) {
            drained.complete(null);
        }
    }

    /**
     * Stops new claims for the rule.
     *
     * @return completes when no slot of the rule is in flight any more
     */
    public CompletableFuture<Void> retire(String ruleId) {
        CompletableFuture<Void> drained;
        boolean idle;
        synchronized (this) {
            drained = retired.computeIfAbsent(ruleId, id -> new CompletableFuture<>());
            idle = !inFlightPerRule.containsKey(ruleId);
        }
        if (idle) {
            drained.complete(null);
        }
        return drained;
    }

    /** Accepts claims for a previously retired rule again. */
    public synchronized void reinstate(String ruleId) {
        retired.remove(ruleId);
    }

    public synchronized boolean isRetired(String ruleId) {
        return retired.containsKey(ruleId);
    }

    public synchronized boolean isInFlight(NodeRuleKey key) {
        return inFlight.contains(key);
    }

    public synchronized int inFlightCount() {
        return inFlight.size();
    }
}
