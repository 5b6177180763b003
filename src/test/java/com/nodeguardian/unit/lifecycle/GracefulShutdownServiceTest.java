package com.nodeguardian.unit.lifecycle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.nodeguardian.engine.EvaluationScheduler;
import com.nodeguardian.engine.ExecutionSlots;
import com.nodeguardian.engine.GuardianEngineConfig;
import com.nodeguardian.engine.SlotTaskRunner;
import com.nodeguardian.lifecycle.GracefulShutdownService;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class GracefulShutdownServiceTest {

    @Mock
    private EvaluationScheduler evaluationScheduler;

    @Mock
    private SlotTaskRunner slotTaskRunner;

    @Mock
    private ExecutionSlots executionSlots;

    private GuardianEngineConfig guardianEngineConfig;
    private GracefulShutdownService gracefulShutdownService;

    @BeforeEach
    void setUp() {
        guardianEngineConfig = new GuardianEngineConfig();
        guardianEngineConfig.setShutdownDrainTimeout(Duration.ofSeconds(5));
        gracefulShutdownService =
                new GracefulShutdownService(evaluationScheduler, slotTaskRunner, executionSlots, guardianEngineConfig);
        gracefulShutdownService.start();
    }

    @Test
    void stop_cancelsTimersThenDrains() {
        when(slotTaskRunner.awaitIdle(Duration.ofSeconds(5))).thenReturn(true);

        gracefulShutdownService.stop();

        InOrder order = inOrder(evaluationScheduler, slotTaskRunner);
        order.verify(evaluationScheduler).stop();
        order.verify(slotTaskRunner).stopAccepting();
        order.verify(slotTaskRunner).awaitIdle(Duration.ofSeconds(5));
        verify(executionSlots, never()).inFlightCount();
        assertThat(gracefulShutdownService.isRunning()).isFalse();
    }

    @Test
    void stop_drainTimeout_reportsStragglersAndStops() {
        when(slotTaskRunner.awaitIdle(any())).thenReturn(false);
        when(executionSlots.inFlightCount()).thenReturn(2);

        gracefulShutdownService.stop();

        verify(executionSlots).inFlightCount();
        assertThat(gracefulShutdownService.isRunning()).isFalse();
    }

    @Test
    void stop_schedulerFailure_stillMarksStopped() {
        doThrow(new IllegalStateException("boom")).when(evaluationScheduler).stop();

        gracefulShutdownService.stop();

        assertThat(gracefulShutdownService.isRunning()).isFalse();
    }

    @Test
    void getPhase_stopsBeforeDefaultPhase() {
        assertThat(gracefulShutdownService.getPhase()).isGreaterThan(0);
    }
}
