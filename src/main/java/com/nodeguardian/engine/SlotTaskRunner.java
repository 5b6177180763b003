package com.nodeguardian.engine;

import com.nodeguardian.domain.model.NodeRuleKey;
import com.nodeguardian.exception.ErrorCode;
import com.nodeguardian.observability.GuardianMetricsService;
import com.nodeguardian.status.RuleStatusReporter;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs per-(rule, node) work on the {@code evaluationExecutor} under an {@link ExecutionSlots}
 * claim.
 *
 * <p>The slot is claimed before submission, so an overlapping tick for a busy key is skipped
 * rather than queued, and the conflict is reported as the rule's status error. A key whose rule
 * is retired is skipped silently. The executor's pool size is the global concurrency cap. A task
 * never lets an exception escape; failures are logged with their key.
 */
@Component
public class SlotTaskRunner {

    private static final Logger log = LoggerFactory.getLogger(SlotTaskRunner.class);

    private final ExecutionSlots executionSlots;
    private final Executor evaluationExecutor;
    private final GuardianMetricsService guardianMetricsService;
    private final RuleStatusReporter ruleStatusReporter;

    private volatile boolean accepting = true;

    public SlotTaskRunner(
            ExecutionSlots executionSlots,
            @Qualifier("evaluationExecutor") Executor evaluationExecutor,
            GuardianMetricsService guardianMetricsService,
            RuleStatusReporter ruleStatusReporter) {
        this.executionSlots = executionSlots;
        this.evaluationExecutor = evaluationExecutor;
        this.guardianMetricsService = guardianMetricsService;
        this.ruleStatusReporter = ruleStatusReporter;
    }

    /**
     * @param purpose short label for logs ({@code trigger}, {@code recovery}, {@code prune})
     * @return true if the task was submitted
     */
    public boolean submit(NodeRuleKey key, String purpose, Runnable task) {
        if (!accepting) {
            guardianMetricsService.recordSkippedEvaluation("shutdown");
            return false;
        }
        if (!executionSlots.tryClaim(key)) {
            if (executionSlots.isRetired(key.ruleId())) {
                log.debug("Skipping {} of {}, rule retired", purpose, key);
                guardianMetricsService.recordSkippedEvaluation("retired");
                return false;
            }
            String conflict = ErrorCode.CONCURRENCY_CONFLICT.getCode() + ": " + purpose + " of node "
                    + key.nodeName() + " skipped, previous evaluation still in flight";
            log.info("Rule {}: {}", key.ruleId(), conflict);
            guardianMetricsService.recordSkippedEvaluation("in_flight");
            ruleStatusReporter.report(key.ruleId(), conflict);
            return false;
        }

        try {
            evaluationExecutor.execute(() -> {
                try {
                    guardianMetricsService.getEvaluationTimer().record(task);
                } catch (Exception e) {
                    log.error("Unexpected failure in {} of {}", purpose, key, e);
                } finally {
                    executionSlots.release(key);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            executionSlots.release(key);
            guardianMetricsService.recordSkippedEvaluation("saturated");
            log.warn("Skipping {} of {}: evaluation executor saturated", purpose, key);
            return false;
        }
    }

    /** Refuses all further submissions. In-flight work continues. */
    public void stopAccepting() {
        accepting = false;
    }

    public boolean isAccepting() {
        return accepting;
    }

    /**
     * Waits until no slot is in flight.
     *
     * @return false if work was still in flight when {@code timeout} elapsed
     */
    public boolean awaitIdle(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (executionSlots.inFlightCount() > 0) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return executionSlots.inFlightCount() == 0;
            }
        }
        return true;
    }
}
