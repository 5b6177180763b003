package com.nodeguardian.unit.support;

import com.nodeguardian.action.NodeAction;
import com.nodeguardian.domain.enums.ComparisonOperator;
import com.nodeguardian.domain.enums.ConditionLogic;
import com.nodeguardian.domain.enums.MetricKind;
import com.nodeguardian.domain.model.Condition;
import com.nodeguardian.domain.model.MonitoringSpec;
import com.nodeguardian.domain.model.NodeSelectorSpec;
import com.nodeguardian.domain.model.Rule;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

/** Builders for rules and conditions shared by the unit tests. */
public final class RuleFixtures {

    public static final String RULE_ID = "high-cpu";
    public static final String NODE = "node-a";

    private RuleFixtures() {}

    public static Condition cpuAbove(double threshold, Duration duration) {
        return condition(MetricKind.CPU_UTILIZATION_PERCENT, ComparisonOperator.GREATER_THAN, threshold, duration);
    }

    public static Condition cpuBelow(double threshold, Duration duration) {
        return condition(MetricKind.CPU_UTILIZATION_PERCENT, ComparisonOperator.LESS_THAN, threshold, duration);
    }

    public static Condition memoryAbove(double threshold, Duration duration) {
        return condition(MetricKind.MEMORY_UTILIZATION_PERCENT, ComparisonOperator.GREATER_THAN, threshold, duration);
    }

    public static Condition condition(
            MetricKind metric, ComparisonOperator operator, double threshold, Duration duration) {
        return Condition.builder()
                .metric(metric)
                .operator(operator)
                .threshold(BigDecimal.valueOf(threshold))
                .duration(duration)
                .build();
    }

    public static MonitoringSpec monitoring(Duration cooldown, Duration recoveryCooldown) {
        return MonitoringSpec.builder()
                .checkInterval(Duration.ofSeconds(30))
                .cooldownPeriod(cooldown)
                .recoveryCooldownPeriod(recoveryCooldown)
                .build();
    }

    /** cpu > 80 for 5m, cooldown 10m, recovery cooldown 2m, recovery when cpu < 60 for 1m. */
    public static Rule.RuleBuilder highCpuRule(List<NodeAction> actions, List<NodeAction> recoveryActions) {
        return Rule.builder()
                .id(RULE_ID)
                .conditions(List.of(cpuAbove(80, Duration.ofMinutes(5))))
                .conditionLogic(ConditionLogic.AND)
                .nodeSelector(NodeSelectorSpec.builder().nodeNames(List.of(NODE)).build())
                .actions(actions)
                .recoveryConditions(List.of(cpuBelow(60, Duration.ofMinutes(1))))
                .recoveryActions(recoveryActions)
                .monitoring(monitoring(Duration.ofMinutes(10), Duration.ofMinutes(2)));
    }
}
