package com.nodeguardian.status;

import com.nodeguardian.domain.enums.RulePhase;
import com.nodeguardian.domain.model.NodeRuleState;
import com.nodeguardian.engine.NodeStateStore;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds a rule's {@link RuleStatus} from its node states and hands it to every
 * {@link StatusPublisher}. A publishing failure is logged and never reaches the engine or the
 * other publishers.
 */
@Component
public class RuleStatusReporter {

    private static final Logger log = LoggerFactory.getLogger(RuleStatusReporter.class);

    private final NodeStateStore nodeStateStore;
    private final List<StatusPublisher> statusPublishers;
    private final Clock clock;

    public RuleStatusReporter(NodeStateStore nodeStateStore, List<StatusPublisher> statusPublishers, Clock clock) {
        this.nodeStateStore = nodeStateStore;
        this.statusPublishers = statusPublishers;
        this.clock = clock;
    }

    /**
     * @param lastError rule-level error of this round (empty selector, rejected document), or null
     *     to report the most recent node-level error
     */
    public void report(String ruleId, String lastError) {
        List<NodeRuleState> states = nodeStateStore.findByRule(ruleId);

        List<String> triggeredNodes = states.stream()
                .filter(NodeRuleState::isTriggered)
                .map(NodeRuleState::getNodeName)
                .sorted()
                .toList();
        Instant lastTriggeredAt = states.stream()
                .map(NodeRuleState::getLastTriggeredAt)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);
        Instant lastRecoveredAt = states.stream()
                .map(NodeRuleState::getLastRecoveredAt)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);
        String error = lastError != null
                ? lastError
                : states.stream()
                        .filter(s -> s.getLastError() != null)
                        .map(s -> s.getNodeName() + ": " + s.getLastError())
                        .sorted()
                        .findFirst()
                        .orElse(null);

        publish(RuleStatus.builder()
                .ruleId(ruleId)
                .phase(triggeredNodes.isEmpty() ? RulePhase.IDLE : RulePhase.TRIGGERED)
                .lastTriggeredAt(lastTriggeredAt)
                .lastRecoveredAt(lastRecoveredAt)
                .triggeredNodes(triggeredNodes)
                .lastError(error)
                .updatedAt(clock.instant())
                .build());
    }

    public void reportRemoved(String ruleId) {
        publish(RuleStatus.builder()
                .ruleId(ruleId)
                .phase(RulePhase.IDLE)
                .updatedAt(clock.instant())
                .removed(true)
                .build());
    }

    private void publish(RuleStatus status) {
        for (StatusPublisher statusPublisher : statusPublishers) {
            try {
                statusPublisher.publish(status);
            } catch (Exception e) {
                log.warn(
                        "Status of rule {} not published via {}: {}",
                        status.getRuleId(),
                        statusPublisher.getClass().getSimpleName(),
                        e.getMessage());
            }
        }
    }
}
