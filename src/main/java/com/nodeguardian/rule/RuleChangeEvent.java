package com.nodeguardian.rule;

import com.nodeguardian.domain.model.Rule;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the {@link RuleRegistry} whenever its active rule set changes.
 *
 * <p>The {@link com.nodeguardian.engine.EvaluationScheduler} listens to (re)schedule or
 * retire the rule's timer. For {@link ChangeType#DELETED} {@code rule} is null and
 * {@code previous} holds the removed version, if any.
 */
public class RuleChangeEvent extends ApplicationEvent {

    public enum ChangeType {
        ADDED,
        MODIFIED,
        DELETED
    }

    private final ChangeType changeType;
    private final String ruleId;
    private final Rule rule;
    private final Rule previous;

    public RuleChangeEvent(Object source, ChangeType changeType, String ruleId, Rule rule, Rule previous) {
        super(source);
        this.changeType = changeType;
        this.ruleId = ruleId;
        this.rule = rule;
        this.previous = previous;
    }

    public ChangeType getChangeType() {
        return changeType;
    }

    public String getRuleId() {
        return ruleId;
    }

    public Rule getRule() {
        return rule;
    }

    public Rule getPrevious() {
        return previous;
    }
}
