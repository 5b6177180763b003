package com.nodeguardian.recovery;

import com.nodeguardian.action.ActionOrchestrator;
import com.nodeguardian.action.BatchResult;
import com.nodeguardian.domain.enums.AlertType;
import com.nodeguardian.domain.enums.CooldownKind;
import com.nodeguardian.domain.enums.RulePhase;
import com.nodeguardian.domain.model.NodeRuleKey;
import com.nodeguardian.domain.model.NodeRuleState;
import com.nodeguardian.domain.model.Rule;
import com.nodeguardian.engine.ConditionEvaluator;
import com.nodeguardian.engine.CooldownLedger;
import com.nodeguardian.engine.EvaluationOutcome;
import com.nodeguardian.engine.EvaluationScheduler;
import com.nodeguardian.engine.NodeEvaluationService;
import com.nodeguardian.engine.NodeEvaluationService.MetricSnapshot;
import com.nodeguardian.engine.NodeStateStore;
import com.nodeguardian.engine.SlotTaskRunner;
import com.nodeguardian.observability.GuardianMetricsService;
import com.nodeguardian.rule.RuleRegistry;
import com.nodeguardian.status.RuleStatusReporter;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Detects recovery of triggered nodes and reverses the trigger.
 *
 * <p>A periodic sweep visits every (rule, node) state in phase TRIGGERED and submits a
 * recovery evaluation under the same execution slot the trigger side uses. Recovery
 * conditions are evaluated with their own duration clocks and combined with the rule's
 * {@code recoveryConditionLogic}, gated by the recovery cooldown. On success the recovery
 * actions run best-effort, the recovery cooldown is recorded, all duration clocks are cleared
 * so the next trigger cycle starts from a clean window, and the node returns to IDLE.
 *
 * <p>Rules without recovery conditions never recover automatically.
 */
@Service
public class RecoveryEngine {

    private static final Logger log = LoggerFactory.getLogger(RecoveryEngine.class);

    private final NodeStateStore nodeStateStore;
    private final RuleRegistry ruleRegistry;
    private final NodeEvaluationService nodeEvaluationService;
    private final ConditionEvaluator conditionEvaluator;
    private final CooldownLedger cooldownLedger;
    private final ActionOrchestrator actionOrchestrator;
    private final SlotTaskRunner slotTaskRunner;
    private final EvaluationScheduler evaluationScheduler;
    private final RuleStatusReporter ruleStatusReporter;
    private final GuardianMetricsService guardianMetricsService;
    private final Clock clock;

    public RecoveryEngine(
            NodeStateStore nodeStateStore,
            RuleRegistry ruleRegistry,
            NodeEvaluationService nodeEvaluationService,
            ConditionEvaluator conditionEvaluator,
            CooldownLedger cooldownLedger,
            ActionOrchestrator actionOrchestrator,
            SlotTaskRunner slotTaskRunner,
            EvaluationScheduler evaluationScheduler,
            RuleStatusReporter ruleStatusReporter,
            GuardianMetricsService guardianMetricsService,
            Clock clock) {
        this.nodeStateStore = nodeStateStore;
        this.ruleRegistry = ruleRegistry;
        this.nodeEvaluationService = nodeEvaluationService;
        this.conditionEvaluator = conditionEvaluator;
        this.cooldownLedger = cooldownLedger;
        this.actionOrchestrator = actionOrchestrator;
        this.slotTaskRunner = slotTaskRunner;
        this.evaluationScheduler = evaluationScheduler;
        this.ruleStatusReporter = ruleStatusReporter;
        this.guardianMetricsService = guardianMetricsService;
        this.clock = clock;
    }

    /** Submits a recovery evaluation for every triggered node. Runs only while the scheduler does. */
    @Scheduled(
            fixedDelayString = "${nodeguardian.engine.recovery-check-interval-ms:30000}",
            initialDelayString = "${nodeguardian.engine.recovery-check-interval-ms:30000}")
    public void sweep() {
        if (!evaluationScheduler.isRunning()) {
            return;
        }
        try {
            List<NodeRuleState> triggered = nodeStateStore.findTriggered();
            int submitted = 0;
            for (NodeRuleState state : triggered) {
                Optional<Rule> rule = ruleRegistry.get(state.getRuleId());
                if (rule.isEmpty() || !rule.get().hasRecovery()) {
                    continue;
                }
                String ruleId = state.getRuleId();
                String node = state.getNodeName();
                if (slotTaskRunner.submit(state.getKey(), "recovery", () -> {
                    try {
                        evaluateRecovery(rule.get(), node, clock.instant());
                    } finally {
                        ruleStatusReporter.report(ruleId, null);
                    }
                })) {
                    submitted++;
                }
            }
            log.debug("Recovery sweep: {} triggered, {} submitted", triggered.size(), submitted);
        } catch (Exception e) {
            log.error("Recovery sweep failed", e);
        }
    }

    /**
     * Evaluates the recovery side of one (rule, node) pair. The caller holds its execution slot.
     */
    public EvaluationOutcome evaluateRecovery(Rule rule, String nodeName, Instant now) {
        NodeRuleKey key = new NodeRuleKey(rule.getId(), nodeName);
        boolean triggered = nodeStateStore.find(key).map(NodeRuleState::isTriggered).orElse(false);
        if (!triggered || !rule.hasRecovery()) {
            return EvaluationOutcome.SKIPPED;
        }

        MetricSnapshot metrics = nodeEvaluationService.fetchMetrics(nodeName, rule.getRecoveryConditions());
        boolean satisfied = nodeStateStore.update(key, state -> {
            if (!state.isTriggered()) {
                return false;
            }
            if (metrics.errorSummary() != null) {
                state.setLastError(metrics.errorSummary());
            }
            return conditionEvaluator.evaluate(
                    state.getRecoveryClocks(),
                    rule.getRecoveryConditions(),
                    rule.getRecoveryConditionLogic(),
                    metrics.values(),
                    now);
        });
        if (!satisfied) {
            return EvaluationOutcome.NOT_SATISFIED;
        }

        if (cooldownLedger.inCooldown(
                key, CooldownKind.RECOVERY, rule.getMonitoring().getRecoveryCooldownPeriod(), now)) {
            log.debug("Recovery of {} suppressed by cooldown", key);
            return EvaluationOutcome.COOLDOWN;
        }

        log.info("Rule {} recovered on node {}", rule.getId(), nodeName);
        BatchResult batch =
                actionOrchestrator.execute(rule, nodeName, rule.getRecoveryActions(), AlertType.RECOVERY, now);

        cooldownLedger.markFired(key, CooldownKind.RECOVERY, now);
        nodeStateStore.update(key, state -> {
            state.setPhase(RulePhase.IDLE);
            state.clearClocks();
            state.setLastRecoveredAt(now);
            state.setLastError(batch.statusError());
            return null;
        });
        guardianMetricsService.recordRecovery(rule.getId());
        return EvaluationOutcome.FIRED;
    }
}
