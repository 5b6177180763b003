package com.nodeguardian.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.nodeguardian.domain.enums.RulePhase;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-(rule, node) state machine: phase plus the duration clocks of trigger and recovery
 * conditions, keyed by condition index.
 *
 * <p>Instances are mutated only through {@link com.nodeguardian.engine.NodeStateStore#update},
 * which serializes access per key. Persisted as JSON in Redis so that phases and clocks
 * survive a restart.
 */
@Data
@NoArgsConstructor
public class NodeRuleState {

    private String ruleId;
    private String nodeName;
    private RulePhase phase = RulePhase.IDLE;

    /** firstObservedAt per trigger-condition index. Absent means "not currently matching". */
    private Map<Integer, Instant> triggerClocks = new HashMap<>();

    /** firstObservedAt per recovery-condition index. */
    private Map<Integer, Instant> recoveryClocks = new HashMap<>();

    private Instant lastTriggeredAt;
    private Instant lastRecoveredAt;
    private String lastError;

    public NodeRuleState(String ruleId, String nodeName) {
        this.ruleId = ruleId;
        this.nodeName = nodeName;
    }

    @JsonIgnore
    public NodeRuleKey getKey() {
        return new NodeRuleKey(ruleId, nodeName);
    }

    @JsonIgnore
    public boolean isTriggered() {
        return phase == RulePhase.TRIGGERED;
    }

    public void clearClocks() {
        triggerClocks.clear();
        recoveryClocks.clear();
    }

    /** Deep copy for publishing outside the per-key lock. */
    public NodeRuleState copy() {
        NodeRuleState copy = new NodeRuleState(ruleId, nodeName);
        copy.setPhase(phase);
        copy.setTriggerClocks(new HashMap<>(triggerClocks));
        copy.setRecoveryClocks(new HashMap<>(recoveryClocks));
        copy.setLastTriggeredAt(lastTriggeredAt);
        copy.setLastRecoveredAt(lastRecoveredAt);
        copy.setLastError(lastError);
        return copy;
    }
}
