package com.nodeguardian.action;

import com.nodeguardian.domain.enums.AlertType;
import com.nodeguardian.domain.model.Rule;
import com.nodeguardian.engine.ExternalCallExecutor;
import com.nodeguardian.exception.ActionExecutionException;
import com.nodeguardian.gateway.KubernetesConfig;
import com.nodeguardian.gateway.NodeControlClient;
import com.nodeguardian.notification.AlertDispatcher;
import com.nodeguardian.observability.GuardianMetricsService;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Executes a rule's action list against one node, in declared order.
 *
 * <p>Each action runs through the {@link ExternalCallExecutor} so a hung Kubernetes call is
 * abandoned after the configured timeout. A failing action is logged, counted and recorded in
 * the {@link BatchResult}; the remaining actions still run. Alert actions are not wrapped
 * because the dispatcher bounds each channel itself.
 *
 * <p>Cooldown bookkeeping and the phase transition are the caller's job and happen regardless
 * of individual outcomes.
 */
@Service
public class ActionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ActionOrchestrator.class);

    private final NodeControlClient nodeControlClient;
    private final AlertDispatcher alertDispatcher;
    private final ExternalCallExecutor externalCallExecutor;
    private final KubernetesConfig kubernetesConfig;
    private final GuardianMetricsService guardianMetricsService;

    public ActionOrchestrator(
            NodeControlClient nodeControlClient,
            AlertDispatcher alertDispatcher,
            ExternalCallExecutor externalCallExecutor,
            KubernetesConfig kubernetesConfig,
            GuardianMetricsService guardianMetricsService) {
        this.nodeControlClient = nodeControlClient;
        this.alertDispatcher = alertDispatcher;
        this.externalCallExecutor = externalCallExecutor;
        this.kubernetesConfig = kubernetesConfig;
        this.guardianMetricsService = guardianMetricsService;
    }

    public BatchResult execute(Rule rule, String nodeName, List<NodeAction> actions, AlertType kind, Instant now) {
        BatchResult result = BatchResult.builder()
                .ruleId(rule.getId())
                .nodeName(nodeName)
                .kind(kind)
                .executedAt(now)
                .build();

        ActionContext context = new ActionContext(
                rule,
                nodeName,
                kind,
                now,
                nodeControlClient,
                alertDispatcher,
                List.copyOf(kubernetesConfig.getDefaultExcludeNamespaces()),
                result.getNotificationErrors()::add);

        for (int i = 0; i < actions.size(); i++) {
            NodeAction action = actions.get(i);
            String label = "#" + i + " " + action.getTypeName();
            try {
                if (action instanceof AlertAction) {
                    action.execute(context);
                } else {
                    externalCallExecutor.run(() -> action.execute(context), e -> e instanceof ActionExecutionException ae
                            ? ae
                            : new ActionExecutionException(action.getTypeName() + " failed: " + e.getMessage(), e));
                }
                result.getSucceeded().add(label);
                log.debug("Action {} succeeded for rule {} on node {}", label, rule.getId(), nodeName);
            } catch (Exception e) {
                log.error(
                        "Action {} failed for rule {} on node {} ({}): {}",
                        label,
                        rule.getId(),
                        nodeName,
                        kind.toValue(),
                        e.getMessage());
                result.getErrors().add(label + ": " + e.getMessage());
                guardianMetricsService.recordActionFailure(action.getTypeName());
            }
        }

        if (result.hasErrors()) {
            log.warn(
                    "{} batch for rule {} on node {} finished with {} failed action(s) of {}",
                    kind.toValue(),
                    rule.getId(),
                    nodeName,
                    result.getErrors().size(),
                    actions.size());
        }
        if (result.hasNotificationErrors()) {
            log.warn(
                    "{} batch for rule {} on node {}: alert not delivered to {}",
                    kind.toValue(),
                    rule.getId(),
                    nodeName,
                    result.getNotificationErrors());
        }
        return result;
    }
}
