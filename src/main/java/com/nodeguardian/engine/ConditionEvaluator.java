package com.nodeguardian.engine;

import com.nodeguardian.domain.enums.ConditionLogic;
import com.nodeguardian.domain.enums.MetricKind;
import com.nodeguardian.domain.model.Condition;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Combines the duration-satisfied results of a condition list with AND/OR logic.
 *
 * <p>Every condition is observed on every evaluation, with no short-circuit, so each clock
 * keeps running (or resets) regardless of the others. An empty list never matches.
 */
@Component
public class ConditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ConditionEvaluator.class);

    private final DurationTracker durationTracker;

    public ConditionEvaluator(DurationTracker durationTracker) {
        this.durationTracker = durationTracker;
    }

    /**
     * @param values metric values fetched for this node; a missing entry means the metric was unavailable
     */
    public boolean evaluate(
            Map<Integer, Instant> clocks,
            List<Condition> conditions,
            ConditionLogic logic,
            Map<MetricKind, BigDecimal> values,
            Instant now) {
        if (conditions == null || conditions.isEmpty()) {
            return false;
        }

        int satisfied = 0;
        for (int i = 0; i < conditions.size(); i++) {
            Condition condition = conditions.get(i);
            BigDecimal value = values.get(condition.getMetric());
            boolean result = durationTracker.track(clocks, i, condition, value, now);
            log.debug("Condition #{} {} with value {} -> {}", i, condition.describe(), value, result);
            if (result) {
                satisfied++;
            }
        }

        return switch (logic == null ? ConditionLogic.AND : logic) {
            case AND -> satisfied == conditions.size();
            case OR -> satisfied > 0;
        };
    }
}
