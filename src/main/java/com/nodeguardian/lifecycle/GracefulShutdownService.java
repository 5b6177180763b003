package com.nodeguardian.lifecycle;

import com.nodeguardian.engine.EvaluationScheduler;
import com.nodeguardian.engine.ExecutionSlots;
import com.nodeguardian.engine.GuardianEngineConfig;
import com.nodeguardian.engine.SlotTaskRunner;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

/**
 * Orderly shutdown of the control loop.
 *
 * <p>Runs in a high {@link SmartLifecycle} phase, before the executors are shut down:
 * <ol>
 *   <li>Cancel all rule timers (the recovery sweep stops with them)</li>
 *   <li>Refuse new evaluations</li>
 *   <li>Wait, bounded by {@code nodeguardian.engine.shutdown-drain-timeout}, for in-flight
 *       batches so their cooldowns and phases are persisted</li>
 * </ol>
 */
@Service
public class GracefulShutdownService implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownService.class);

    private final EvaluationScheduler evaluationScheduler;
    private final SlotTaskRunner slotTaskRunner;
    private final ExecutionSlots executionSlots;
    private final GuardianEngineConfig guardianEngineConfig;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public GracefulShutdownService(
            EvaluationScheduler evaluationScheduler,
            SlotTaskRunner slotTaskRunner,
            ExecutionSlots executionSlots,
            GuardianEngineConfig guardianEngineConfig) {
        this.evaluationScheduler = evaluationScheduler;
        this.slotTaskRunner = slotTaskRunner;
        this.executionSlots = executionSlots;
        this.guardianEngineConfig = guardianEngineConfig;
    }

    @Override
    public void start() {
        running.set(true);
    }

    @Override
    public void stop() {
        log.info("Graceful shutdown initiated...");
        try {
            evaluationScheduler.stop();
            slotTaskRunner.stopAccepting();

            if (slotTaskRunner.awaitIdle(guardianEngineConfig.getShutdownDrainTimeout())) {
                log.info("All in-flight evaluations finished");
            } else {
                log.warn(
                        "{} evaluations still in flight after {}, shutting down anyway",
                        executionSlots.inFlightCount(),
                        guardianEngineConfig.getShutdownDrainTimeout());
            }
        } catch (Exception e) {
            log.error("Error during graceful shutdown", e);
        } finally {
            running.set(false);
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // higher phase stops earlier
        return Integer.MAX_VALUE - 1;
    }
}
