package com.nodeguardian.unit.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.nodeguardian.domain.model.NodeRuleKey;
import com.nodeguardian.engine.ExecutionSlots;
import com.nodeguardian.engine.SlotTaskRunner;
import com.nodeguardian.observability.GuardianMetricsService;
import com.nodeguardian.status.RuleStatusReporter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SlotTaskRunnerTest {

    private static final NodeRuleKey KEY = new NodeRuleKey("high-cpu", "node-a");

    @Mock
    private GuardianMetricsService guardianMetricsService;

    @Mock
    private RuleStatusReporter ruleStatusReporter;

    private ExecutionSlots executionSlots;
    private SlotTaskRunner slotTaskRunner;

    @BeforeEach
    void setUp() {
        executionSlots = new ExecutionSlots();
        when(guardianMetricsService.getEvaluationTimer())
                .thenReturn(new SimpleMeterRegistry().timer("nodeguardian.evaluation.duration"));
        slotTaskRunner = new SlotTaskRunner(executionSlots, Runnable::run, guardianMetricsService, ruleStatusReporter);
    }

    @Test
    @DisplayName("task runs under the slot and releases it afterwards")
    void runsAndReleases() {
        AtomicInteger runs = new AtomicInteger();

        boolean submitted = slotTaskRunner.submit(KEY, "trigger", () -> {
            assertThat(executionSlots.isInFlight(KEY)).isTrue();
            runs.incrementAndGet();
        });

        assertThat(submitted).isTrue();
        assertThat(runs).hasValue(1);
        assertThat(executionSlots.isInFlight(KEY)).isFalse();
    }

    @Test
    @DisplayName("failing task still releases its slot")
    void failureReleasesSlot() {
        slotTaskRunner.submit(KEY, "trigger", () -> {
            throw new IllegalStateException("boom");
        });

        assertThat(executionSlots.inFlightCount()).isZero();
    }

    @Test
    @DisplayName("busy key is skipped and the conflict is reported as the rule's status error")
    void busyKeyReportsConflict() {
        executionSlots.tryClaim(KEY);
        AtomicInteger runs = new AtomicInteger();

        boolean submitted = slotTaskRunner.submit(KEY, "recovery", runs::incrementAndGet);

        assertThat(submitted).isFalse();
        assertThat(runs).hasValue(0);
        verify(guardianMetricsService).recordSkippedEvaluation("in_flight");
        verify(ruleStatusReporter)
                .report(
                        "high-cpu",
                        "CONCURRENCY_CONFLICT: recovery of node node-a skipped, previous evaluation still in flight");
    }

    @Test
    @DisplayName("busy key of a retired rule is skipped without a status report")
    void retiredKeyNotReported() {
        executionSlots.tryClaim(KEY);
        executionSlots.retire("high-cpu");

        assertThat(slotTaskRunner.submit(KEY, "trigger", () -> {})).isFalse();

        verify(guardianMetricsService).recordSkippedEvaluation("retired");
        verify(ruleStatusReporter, never()).report(anyString(), anyString());
    }

    @Test
    @DisplayName("saturated executor releases the claimed slot and counts the skip")
    void saturatedExecutor() {
        Executor saturated = task -> {
            throw new RejectedExecutionException("queue full");
        };
        SlotTaskRunner runner =
                new SlotTaskRunner(executionSlots, saturated, guardianMetricsService, ruleStatusReporter);

        assertThat(runner.submit(KEY, "trigger", () -> {})).isFalse();
        assertThat(executionSlots.isInFlight(KEY)).isFalse();
        verify(guardianMetricsService).recordSkippedEvaluation("saturated");
    }

    @Test
    @DisplayName("no submissions after stopAccepting")
    void stopAccepting() {
        slotTaskRunner.stopAccepting();

        assertThat(slotTaskRunner.submit(KEY, "trigger", () -> {})).isFalse();
        verify(guardianMetricsService).recordSkippedEvaluation("shutdown");
    }

    @Test
    @DisplayName("awaitIdle returns false while work is in flight past the timeout")
    void awaitIdleTimesOut() {
        executionSlots.tryClaim(KEY);

        assertThat(slotTaskRunner.awaitIdle(Duration.ofMillis(150))).isFalse();

        executionSlots.release(KEY);
        assertThat(slotTaskRunner.awaitIdle(Duration.ofMillis(150))).isTrue();
    }
}
