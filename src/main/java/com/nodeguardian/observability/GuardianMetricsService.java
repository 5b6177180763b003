package com.nodeguardian.observability;

import com.nodeguardian.domain.enums.ChannelType;
import com.nodeguardian.domain.enums.MetricKind;
import com.nodeguardian.engine.NodeStateStore;
import com.nodeguardian.rule.RuleRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import org.springframework.stereotype.Service;

/**
 * Custom Micrometer meters of the control loop.
 *
 * <ul>
 *   <li><b>nodeguardian.triggers</b> (counter, tag rule): trigger batches executed</li>
 *   <li><b>nodeguardian.recoveries</b> (counter, tag rule): recovery batches executed</li>
 *   <li><b>nodeguardian.action.failures</b> (counter, tag action): individual actions that failed</li>
 *   <li><b>nodeguardian.notification.failures</b> (counter, tag channel): channel deliveries that failed</li>
 *   <li><b>nodeguardian.evaluations.skipped</b> (counter, tag reason): ticks skipped for a busy key
 *       or a saturated executor</li>
 *   <li><b>nodeguardian.metric.unavailable</b> (counter, tag metric): metric fetches that failed</li>
 *   <li><b>nodeguardian.evaluation.duration</b> (timer): one (rule, node) evaluation end to end</li>
 *   <li><b>nodeguardian.rules.active</b> / <b>nodeguardian.nodes.triggered</b> (gauges)</li>
 * </ul>
 *
 * <p>Gauges are evaluated lazily by Micrometer on scrape.
 */
@Service
public class GuardianMetricsService {

    private final MeterRegistry meterRegistry;
    private final Timer evaluationTimer;

    public GuardianMetricsService(
            MeterRegistry meterRegistry, RuleRegistry ruleRegistry, NodeStateStore nodeStateStore) {
        this.meterRegistry = meterRegistry;

        this.evaluationTimer = Timer.builder("nodeguardian.evaluation.duration")
                .description("Duration of one (rule, node) evaluation including actions")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofMinutes(1))
                .register(meterRegistry);

        meterRegistry.gauge("nodeguardian.rules.active", ruleRegistry, RuleRegistry::size);
        meterRegistry.gauge("nodeguardian.nodes.triggered", nodeStateStore, NodeStateStore::countTriggered);
    }

    public void recordTrigger(String ruleId) {
        counter("nodeguardian.triggers", "Trigger action batches executed", "rule", ruleId).increment();
    }

    public void recordRecovery(String ruleId) {
        counter("nodeguardian.recoveries", "Recovery action batches executed", "rule", ruleId).increment();
    }

    public void recordActionFailure(String actionType) {
        counter("nodeguardian.action.failures", "Actions that failed inside a batch", "action", actionType)
                .increment();
    }

    public void recordNotificationFailure(ChannelType channel) {
        counter(
                        "nodeguardian.notification.failures",
                        "Alert deliveries that failed",
                        "channel",
                        channel != null ? channel.toValue() : "unknown")
                .increment();
    }

    public void recordSkippedEvaluation(String reason) {
        counter("nodeguardian.evaluations.skipped", "Evaluations skipped instead of queued", "reason", reason)
                .increment();
    }

    public void recordMetricUnavailable(MetricKind metric) {
        counter(
                        "nodeguardian.metric.unavailable",
                        "Metric fetches treated as non-match",
                        "metric",
                        metric.getDocumentName())
                .increment();
    }

    public Timer getEvaluationTimer() {
        return evaluationTimer;
    }

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        return Counter.builder(name)
                .description(description)
                .tag(tagKey, tagValue)
                .register(meterRegistry);
    }
}
