package com.nodeguardian.domain.model;

import com.nodeguardian.action.NodeAction;
import com.nodeguardian.domain.enums.ConditionLogic;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * A declarative node-health rule: conditions over node metrics, the nodes they apply to,
 * the actions to run when they hold, and the symmetric recovery side.
 *
 * <p>A rule is an immutable value per version. An update replaces the whole rule in the
 * {@link com.nodeguardian.rule.RuleRegistry}; fields are never patched in place.
 */
@Value
@Builder(toBuilder = true)
public class Rule {

    String id;

    @Builder.Default
    List<Condition> conditions = List.of();

    @Builder.Default
    ConditionLogic conditionLogic = ConditionLogic.AND;

    @Builder.Default
    NodeSelectorSpec nodeSelector = NodeSelectorSpec.all();

    @Builder.Default
    List<NodeAction> actions = List.of();

    @Builder.Default
    List<Condition> recoveryConditions = List.of();

    @Builder.Default
    ConditionLogic recoveryConditionLogic = ConditionLogic.AND;

    @Builder.Default
    List<NodeAction> recoveryActions = List.of();

    MonitoringSpec monitoring;

    @Builder.Default
    RuleMetadata metadata = RuleMetadata.builder().build();

    public boolean isEnabled() {
        return metadata.isEnabled();
    }

    public int getPriority() {
        return metadata.getPriority();
    }

    public String getDescription() {
        return metadata.getDescription();
    }

    /** Rules without recovery conditions never recover automatically. */
    public boolean hasRecovery() {
        return recoveryConditions != null && !recoveryConditions.isEmpty();
    }
}
