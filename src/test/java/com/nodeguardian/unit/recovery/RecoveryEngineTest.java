package com.nodeguardian.unit.recovery;

import static com.nodeguardian.unit.support.RuleFixtures.NODE;
import static com.nodeguardian.unit.support.RuleFixtures.condition;
import static com.nodeguardian.unit.support.RuleFixtures.highCpuRule;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.nodeguardian.action.ActionOrchestrator;
import com.nodeguardian.action.BatchResult;
import com.nodeguardian.action.NodeAction;
import com.nodeguardian.action.UntaintAction;
import com.nodeguardian.domain.enums.AlertType;
import com.nodeguardian.domain.enums.ComparisonOperator;
import com.nodeguardian.domain.enums.CooldownKind;
import com.nodeguardian.domain.enums.MetricKind;
import com.nodeguardian.domain.enums.RulePhase;
import com.nodeguardian.domain.model.NodeRuleKey;
import com.nodeguardian.domain.model.NodeRuleState;
import com.nodeguardian.domain.model.Rule;
import com.nodeguardian.engine.ConditionEvaluator;
import com.nodeguardian.engine.CooldownLedger;
import com.nodeguardian.engine.DurationTracker;
import com.nodeguardian.engine.EvaluationOutcome;
import com.nodeguardian.engine.EvaluationScheduler;
import com.nodeguardian.engine.ExecutionSlots;
import com.nodeguardian.engine.ExternalCallExecutor;
import com.nodeguardian.engine.NodeEvaluationService;
import com.nodeguardian.engine.NodeStateStore;
import com.nodeguardian.engine.SlotTaskRunner;
import com.nodeguardian.gateway.MetricsGateway;
import com.nodeguardian.observability.GuardianMetricsService;
import com.nodeguardian.recovery.RecoveryEngine;
import com.nodeguardian.repository.redis.CooldownRedisRepository;
import com.nodeguardian.repository.redis.NodeStateRedisRepository;
import com.nodeguardian.rule.RuleRegistry;
import com.nodeguardian.status.RuleStatusReporter;
import com.nodeguardian.unit.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

/**
 * Tests for the recovery side: only TRIGGERED nodes are considered, recovery conditions need
 * their own continuous duration, and a recovery returns the node to IDLE with clean clocks.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RecoveryEngineTest {

    private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");
    private static final NodeRuleKey KEY = new NodeRuleKey("high-cpu", NODE);
    private static final List<NodeAction> RECOVERY_ACTIONS =
            List.of(UntaintAction.builder().key("nodeguardian.io/status").build());

    @Mock
    private MetricsGateway metricsGateway;

    @Mock
    private ActionOrchestrator actionOrchestrator;

    @Mock
    private GuardianMetricsService guardianMetricsService;

    @Mock
    private RuleRegistry ruleRegistry;

    @Mock
    private EvaluationScheduler evaluationScheduler;

    @Mock
    private RuleStatusReporter ruleStatusReporter;

    @Mock
    private CooldownRedisRepository cooldownRedisRepository;

    @Mock
    private NodeStateRedisRepository nodeStateRedisRepository;

    private NodeStateStore nodeStateStore;
    private CooldownLedger cooldownLedger;
    private ExecutionSlots executionSlots;
    private MutableClock clock;
    private RecoveryEngine recoveryEngine;
    private Rule rule;

    @BeforeEach
    void setUp() {
        nodeStateStore = new NodeStateStore(nodeStateRedisRepository);
        cooldownLedger = new CooldownLedger(cooldownRedisRepository);
        executionSlots = new ExecutionSlots();
        clock = new MutableClock(T0);
        ConditionEvaluator conditionEvaluator = new ConditionEvaluator(new DurationTracker());
        NodeEvaluationService nodeEvaluationService = new NodeEvaluationService(
                metricsGateway,
                new ExternalCallExecutor(Runnable::run, Duration.ofSeconds(1)),
                conditionEvaluator,
                cooldownLedger,
                nodeStateStore,
                actionOrchestrator,
                guardianMetricsService);
        when(guardianMetricsService.getEvaluationTimer())
                .thenReturn(new SimpleMeterRegistry().timer("nodeguardian.evaluation.duration"));

        recoveryEngine = new RecoveryEngine(
                nodeStateStore,
                ruleRegistry,
                nodeEvaluationService,
                conditionEvaluator,
                cooldownLedger,
                actionOrchestrator,
                new SlotTaskRunner(executionSlots, Runnable::run, guardianMetricsService, ruleStatusReporter),
                evaluationScheduler,
                ruleStatusReporter,
                guardianMetricsService,
                clock);

        rule = highCpuRule(List.of(), RECOVERY_ACTIONS)
                .recoveryConditions(List.of(condition(
                        MetricKind.MEMORY_UTILIZATION_PERCENT, ComparisonOperator.LESS_THAN, 70, Duration.ofMinutes(2))))
                .build();
        when(ruleRegistry.get(rule.getId())).thenReturn(Optional.of(rule));
        when(evaluationScheduler.isRunning()).thenReturn(true);
        when(actionOrchestrator.execute(any(), any(), anyList(), eq(AlertType.RECOVERY), any()))
                .thenReturn(BatchResult.builder().build());
    }

    private void triggeredAt(Instant at) {
        nodeStateStore.update(KEY, state -> {
            state.setPhase(RulePhase.TRIGGERED);
            state.setLastTriggeredAt(at);
            state.getTriggerClocks().put(0, at.minus(Duration.ofMinutes(5)));
            return null;
        });
    }

    private void memoryIs(double value) {
        when(metricsGateway.get(NODE, MetricKind.MEMORY_UTILIZATION_PERCENT)).thenReturn(BigDecimal.valueOf(value));
    }

    private NodeRuleState state() {
        return nodeStateStore.find(KEY).orElseThrow();
    }

    @Nested
    @DisplayName("Recovery evaluation")
    class RecoveryEvaluation {

        @Test
        @DisplayName("recovery fires after the recovery duration, not on the first matching sample")
        void recoveryRespectsDuration() {
            triggeredAt(T0);
            memoryIs(65);

            assertThat(recoveryEngine.evaluateRecovery(rule, NODE, T0.plus(Duration.ofMinutes(1))))
                    .isEqualTo(EvaluationOutcome.NOT_SATISFIED);
            assertThat(recoveryEngine.evaluateRecovery(rule, NODE, T0.plus(Duration.ofMinutes(2))))
                    .isEqualTo(EvaluationOutcome.NOT_SATISFIED);
            assertThat(recoveryEngine.evaluateRecovery(rule, NODE, T0.plus(Duration.ofMinutes(3))))
                    .isEqualTo(EvaluationOutcome.FIRED);

            verify(actionOrchestrator)
                    .execute(rule, NODE, RECOVERY_ACTIONS, AlertType.RECOVERY, T0.plus(Duration.ofMinutes(3)));
        }

        @Test
        @DisplayName("recovery returns the node to IDLE with clean clocks and records the cooldown")
        void recoveryTransitionsToIdle() {
            triggeredAt(T0);
            memoryIs(40);
            recoveryEngine.evaluateRecovery(rule, NODE, T0.plus(Duration.ofMinutes(1)));

            Instant recoveredAt = T0.plus(Duration.ofMinutes(3));
            recoveryEngine.evaluateRecovery(rule, NODE, recoveredAt);

            NodeRuleState state = state();
            assertThat(state.getPhase()).isEqualTo(RulePhase.IDLE);
            assertThat(state.getLastRecoveredAt()).isEqualTo(recoveredAt);
            assertThat(state.getTriggerClocks()).isEmpty();
            assertThat(state.getRecoveryClocks()).isEmpty();
            assertThat(cooldownLedger.lastFired(KEY, CooldownKind.RECOVERY)).contains(recoveredAt);
            verify(guardianMetricsService).recordRecovery(rule.getId());
        }

        @Test
        @DisplayName("recovery alert that missed a channel leaves a notification error on the state")
        void recoveryKeepsNotificationError() {
            triggeredAt(T0);
            memoryIs(40);
            BatchResult partial = BatchResult.builder().build();
            partial.getNotificationErrors().add("email(ops@example.com): SMTP timeout");
            when(actionOrchestrator.execute(any(), any(), anyList(), eq(AlertType.RECOVERY), any()))
                    .thenReturn(partial);

            recoveryEngine.evaluateRecovery(rule, NODE, T0.plus(Duration.ofMinutes(1)));
            recoveryEngine.evaluateRecovery(rule, NODE, T0.plus(Duration.ofMinutes(3)));

            assertThat(state().getPhase()).isEqualTo(RulePhase.IDLE);
            assertThat(state().getLastError()).isEqualTo("NOTIFICATION_ERROR: email(ops@example.com): SMTP timeout");
        }

        @Test
        @DisplayName("IDLE node is never recovered")
        void idleNodeSkipped() {
            memoryIs(10);

            assertThat(recoveryEngine.evaluateRecovery(rule, NODE, T0)).isEqualTo(EvaluationOutcome.SKIPPED);
            verify(actionOrchestrator, never()).execute(any(), anyString(), anyList(), any(), any());
        }

        @Test
        @DisplayName("rule without recovery conditions never recovers automatically")
        void noRecoveryConditions() {
            Rule withoutRecovery = rule.toBuilder().recoveryConditions(List.of()).build();
            triggeredAt(T0);

            assertThat(recoveryEngine.evaluateRecovery(withoutRecovery, NODE, T0.plus(Duration.ofHours(1))))
                    .isEqualTo(EvaluationOutcome.SKIPPED);
            assertThat(state().getPhase()).isEqualTo(RulePhase.TRIGGERED);
        }

        @Test
        @DisplayName("recovery cooldown suppresses a second recovery batch")
        void recoveryCooldown() {
            triggeredAt(T0);
            cooldownLedger.markFired(KEY, CooldownKind.RECOVERY, T0);
            Rule instantRecovery = rule.toBuilder()
                    .recoveryConditions(List.of(condition(
                            MetricKind.MEMORY_UTILIZATION_PERCENT, ComparisonOperator.LESS_THAN, 70, Duration.ZERO)))
                    .build();
            memoryIs(40);

            assertThat(recoveryEngine.evaluateRecovery(instantRecovery, NODE, T0.plus(Duration.ofMinutes(1))))
                    .isEqualTo(EvaluationOutcome.COOLDOWN);
            assertThat(state().getPhase()).isEqualTo(RulePhase.TRIGGERED);
        }
    }

    @Nested
    @DisplayName("Sweep")
    class Sweep {

        @Test
        @DisplayName("sweep evaluates triggered nodes and reports the rule status")
        void sweepEvaluatesTriggered() {
            triggeredAt(T0);
            memoryIs(40);
            clock.advance(Duration.ofMinutes(1));
            recoveryEngine.sweep();
            clock.advance(Duration.ofMinutes(2));

            recoveryEngine.sweep();

            assertThat(state().getPhase()).isEqualTo(RulePhase.IDLE);
            verify(ruleStatusReporter, times(2)).report(rule.getId(), null);
        }

        @Test
        @DisplayName("sweep does nothing while the scheduler is stopped")
        void sweepIdleWhenStopped() {
            when(evaluationScheduler.isRunning()).thenReturn(false);
            triggeredAt(T0);

            recoveryEngine.sweep();

            verify(metricsGateway, never()).get(anyString(), any());
        }

        @Test
        @DisplayName("sweep skips a node whose slot is busy")
        void sweepSkipsBusyNode() {
            triggeredAt(T0);
            executionSlots.tryClaim(KEY);

            recoveryEngine.sweep();

            verify(metricsGateway, never()).get(anyString(), any());
            verify(guardianMetricsService).recordSkippedEvaluation("in_flight");
            verify(ruleStatusReporter).report(eq(rule.getId()), startsWith("CONCURRENCY_CONFLICT: recovery"));
        }
    }
}
