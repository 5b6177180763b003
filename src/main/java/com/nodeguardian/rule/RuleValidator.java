package com.nodeguardian.rule;

import com.nodeguardian.action.NodeAction;
import com.nodeguardian.domain.model.Condition;
import com.nodeguardian.domain.model.MonitoringSpec;
import com.nodeguardian.domain.model.Rule;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Structural checks of a mapped {@link Rule}. All checks run; the result lists every violation.
 */
@Component
public class RuleValidator {

    // Kubernetes object name (DNS subdomain)
    private static final Pattern RULE_ID = Pattern.compile("^[a-z0-9]([-a-z0-9.]{0,251}[a-z0-9])?$");

    public List<String> validate(Rule rule) {
        List<String> violations = new ArrayList<>();

        if (rule.getId() == null || rule.getId().isBlank()) {
            violations.add("metadata.name is required");
        } else if (!RULE_ID.matcher(rule.getId()).matches()) {
            violations.add("metadata.name '" + rule.getId() + "' is not a valid resource name");
        }

        if (rule.getConditions() == null || rule.getConditions().isEmpty()) {
            violations.add("spec.conditions must not be empty");
        } else {
            validateConditions("spec.conditions", rule.getConditions(), violations);
        }
        if (rule.getRecoveryConditions() != null) {
            validateConditions("spec.recoveryConditions", rule.getRecoveryConditions(), violations);
        }

        validateActions("spec.actions", rule.getActions(), violations);
        validateActions("spec.recoveryActions", rule.getRecoveryActions(), violations);

        MonitoringSpec monitoring = rule.getMonitoring();
        if (monitoring == null) {
            violations.add("spec.monitoring is required");
        } else {
            if (!isPositive(monitoring.getCheckInterval())) {
                violations.add("spec.monitoring.checkInterval must be positive");
            }
            if (isNegative(monitoring.getCooldownPeriod())) {
                violations.add("spec.monitoring.cooldownPeriod must not be negative");
            }
            if (isNegative(monitoring.getRecoveryCooldownPeriod())) {
                violations.add("spec.monitoring.recoveryCooldownPeriod must not be negative");
            }
        }

        if (rule.getNodeSelector() == null) {
            violations.add("spec.nodeSelector must not be null");
        }
        return violations;
    }

    private static void validateConditions(String path, List<Condition> conditions, List<String> violations) {
        for (int i = 0; i < conditions.size(); i++) {
            Condition condition = conditions.get(i);
            String at = path + "[" + i + "]";
            if (condition.getMetric() == null) {
                violations.add(at + ".metric is required");
            }
            if (condition.getOperator() == null) {
                violations.add(at + ".operator is required");
            }
            if (condition.getThreshold() == null) {
                violations.add(at + ".value is required");
            }
            if (isNegative(condition.getDuration())) {
                violations.add(at + ".duration must not be negative");
            }
        }
    }

    private static void validateActions(String path, List<NodeAction> actions, List<String> violations) {
        if (actions == null) {
            return;
        }
        for (int i = 0; i < actions.size(); i++) {
            if (actions.get(i) == null) {
                violations.add(path + "[" + i + "] is empty");
            }
        }
    }

    private static boolean isPositive(Duration duration) {
        return duration != null && !duration.isZero() && !duration.isNegative();
    }

    private static boolean isNegative(Duration duration) {
        return duration != null && duration.isNegative();
    }
}
