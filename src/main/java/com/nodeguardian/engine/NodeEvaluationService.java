package com.nodeguardian.engine;

import com.nodeguardian.action.ActionOrchestrator;
import com.nodeguardian.action.BatchResult;
import com.nodeguardian.domain.enums.AlertType;
import com.nodeguardian.domain.enums.CooldownKind;
import com.nodeguardian.domain.enums.MetricKind;
import com.nodeguardian.domain.enums.RulePhase;
import com.nodeguardian.domain.model.Condition;
import com.nodeguardian.domain.model.NodeRuleKey;
import com.nodeguardian.domain.model.Rule;
import com.nodeguardian.exception.ErrorCode;
import com.nodeguardian.exception.MetricUnavailableException;
import com.nodeguardian.gateway.MetricsGateway;
import com.nodeguardian.observability.GuardianMetricsService;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Evaluates a rule's trigger side for one node and fires its action batch.
 *
 * <p>The caller holds the (rule, node) execution slot, so there is at most one evaluation or
 * batch per key in flight. Duration clocks are updated under the state store's per-key lock;
 * the batch itself runs outside it.
 *
 * <p>After a trigger batch, regardless of individual action outcomes, the trigger cooldown is
 * recorded and the node moves to TRIGGERED. A node that is already TRIGGERED keeps being
 * evaluated, so a condition that stays satisfied fires again once the cooldown has elapsed.
 */
@Service
public class NodeEvaluationService {

    private static final Logger log = LoggerFactory.getLogger(NodeEvaluationService.class);

    private final MetricsGateway metricsGateway;
    private final ExternalCallExecutor externalCallExecutor;
    private final ConditionEvaluator conditionEvaluator;
    private final CooldownLedger cooldownLedger;
    private final NodeStateStore nodeStateStore;
    private final ActionOrchestrator actionOrchestrator;
    private final GuardianMetricsService guardianMetricsService;

    public NodeEvaluationService(
            MetricsGateway metricsGateway,
            ExternalCallExecutor externalCallExecutor,
            ConditionEvaluator conditionEvaluator,
            CooldownLedger cooldownLedger,
            NodeStateStore nodeStateStore,
            ActionOrchestrator actionOrchestrator,
            GuardianMetricsService guardianMetricsService) {
        this.metricsGateway = metricsGateway;
        this.externalCallExecutor = externalCallExecutor;
        this.conditionEvaluator = conditionEvaluator;
        this.cooldownLedger = cooldownLedger;
        this.nodeStateStore = nodeStateStore;
        this.actionOrchestrator = actionOrchestrator;
        this.guardianMetricsService = guardianMetricsService;
    }

    public EvaluationOutcome evaluateTrigger(Rule rule, String nodeName, Instant now) {
        NodeRuleKey key = new NodeRuleKey(rule.getId(), nodeName);
        MetricSnapshot metrics = fetchMetrics(nodeName, rule.getConditions());

        boolean satisfied = nodeStateStore.update(key, state -> {
            state.setLastError(metrics.errorSummary());
            return conditionEvaluator.evaluate(
                    state.getTriggerClocks(), rule.getConditions(), rule.getConditionLogic(), metrics.values(), now);
        });
        if (!satisfied) {
            return EvaluationOutcome.NOT_SATISFIED;
        }

        if (cooldownLedger.inCooldown(
                key, CooldownKind.TRIGGER, rule.getMonitoring().getCooldownPeriod(), now)) {
            log.debug("Trigger of {} suppressed by cooldown", key);
            return EvaluationOutcome.COOLDOWN;
        }

        log.info("Rule {} triggered on node {} ({})", rule.getId(), nodeName, describe(rule.getConditions()));
        BatchResult batch = actionOrchestrator.execute(rule, nodeName, rule.getActions(), AlertType.TRIGGER, now);

        cooldownLedger.markFired(key, CooldownKind.TRIGGER, now);
        nodeStateStore.update(key, state -> {
            state.setPhase(RulePhase.TRIGGERED);
            state.setLastTriggeredAt(now);
            state.getRecoveryClocks().clear();
            if (batch.statusError() != null) {
                state.setLastError(batch.statusError());
            }
            return null;
        });
        guardianMetricsService.recordTrigger(rule.getId());
        return EvaluationOutcome.FIRED;
    }

    /**
     * Fetches every metric the conditions reference, once per metric kind. A metric that cannot
     * be fetched within the external call timeout is left out of the values, which the
     * evaluator treats as a non-match.
     */
    public MetricSnapshot fetchMetrics(String nodeName, Collection<Condition> conditions) {
        Set<MetricKind> kinds = new LinkedHashSet<>();
        conditions.forEach(condition -> kinds.add(condition.getMetric()));

        Map<MetricKind, BigDecimal> values = new EnumMap<>(MetricKind.class);
        List<String> errors = new ArrayList<>();
        for (MetricKind kind : kinds) {
            try {
                BigDecimal value = externalCallExecutor.call(
                        () -> metricsGateway.get(nodeName, kind),
                        e -> e instanceof MetricUnavailableException mue
                                ? mue
                                : new MetricUnavailableException(nodeName, kind, e));
                if (value != null) {
                    values.put(kind, value);
                } else {
                    errors.add(kind.getDocumentName() + ": no value");
                    guardianMetricsService.recordMetricUnavailable(kind);
                }
            } catch (MetricUnavailableException e) {
                log.warn(e.getMessage());
                errors.add(kind.getDocumentName() + ": " + e.getMessage());
                guardianMetricsService.recordMetricUnavailable(kind);
            }
        }
        return new MetricSnapshot(values, errors);
    }

    private static String describe(List<Condition> conditions) {
        return String.join(", ", conditions.stream().map(Condition::describe).toList());
    }

    /** Metric values of one node, plus the reasons for any that are missing. */
    public record MetricSnapshot(Map<MetricKind, BigDecimal> values, List<String> errors) {

        /** Null when every metric was fetched. */
        public String errorSummary() {
            return errors.isEmpty() ? null : ErrorCode.METRIC_UNAVAILABLE.getCode() + ": " + String.join("; ", errors);
        }
    }
}
