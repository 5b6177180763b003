package com.nodeguardian.rule;

import com.nodeguardian.domain.model.Rule;
import com.nodeguardian.rule.RuleChangeEvent.ChangeType;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * The active set of enabled rules, keyed by rule id.
 *
 * <p>Registering replaces the whole rule; a disabled rule is treated as an unregister. Every
 * effective change is published as a {@link RuleChangeEvent}, synchronously, so listeners
 * see changes in the order they were made. Re-registering an identical rule publishes nothing.
 *
 * <p>Mutations are serialized on the registry so that the map update and the event publication
 * of one change never interleave with another change.
 */
@Service
public class RuleRegistry {

    private static final Logger log = LoggerFactory.getLogger(RuleRegistry.class);

    private static final Comparator<Rule> EVALUATION_ORDER =
            Comparator.comparingInt(Rule::getPriority).thenComparing(Rule::getId);

    private final ApplicationEventPublisher applicationEventPublisher;

    private final Map<String, Rule> rules = new ConcurrentHashMap<>();

    public RuleRegistry(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    /**
     * Inserts or fully replaces the rule with the same id.
     *
     * @return the effective change, or empty when the rule was already registered unchanged
     */
    public synchronized Optional<ChangeType> register(Rule rule) {
        if (!rule.isEnabled()) {
            log.info("Rule {} is disabled, unregistering", rule.getId());
            return unregister(rule.getId()) ? Optional.of(ChangeType.DELETED) : Optional.empty();
        }

        Rule previous = rules.put(rule.getId(), rule);
        if (rule.equals(previous)) {
            return Optional.empty();
        }

        ChangeType changeType = previous == null ? ChangeType.ADDED : ChangeType.MODIFIED;
        log.info(
                "Rule {} {} (priority={}, conditions={}, actions={}, recoveryConditions={})",
                rule.getId(),
                changeType == ChangeType.ADDED ? "registered" : "replaced",
                rule.getPriority(),
                rule.getConditions().size(),
                rule.getActions().size(),
                rule.getRecoveryConditions().size());
        applicationEventPublisher.publishEvent(new RuleChangeEvent(this, changeType, rule.getId(), rule, previous));
        return Optional.of(changeType);
    }

    /**
     * Removes the rule. Listeners purge its node states and cooldown entries.
     *
     * @return true if the rule was registered
     */
    public synchronized boolean unregister(String ruleId) {
        Rule previous = rules.remove(ruleId);
        if (previous == null) {
            return false;
        }
        log.info("Rule {} unregistered", ruleId);
        applicationEventPublisher.publishEvent(
                new RuleChangeEvent(this, ChangeType.DELETED, ruleId, null, previous));
        return true;
    }

    /**
     * Applies a pushed change from a rule store. DELETED carries only the id.
     */
    public void apply(RuleChangeEvent.ChangeType changeType, String ruleId, Rule rule) {
        if (changeType == ChangeType.DELETED) {
            unregister(ruleId);
        } else {
            register(rule);
        }
    }

    public Optional<Rule> get(String ruleId) {
        return Optional.ofNullable(rules.get(ruleId));
    }

    public boolean contains(String ruleId) {
        return rules.containsKey(ruleId);
    }

    /** Enabled rules ordered by ascending priority, ties broken by id. */
    public List<Rule> list() {
        return rules.values().stream().sorted(EVALUATION_ORDER).toList();
    }

    public Set<String> ids() {
        return Set.copyOf(rules.keySet());
    }

    public int size() {
        return rules.size();
    }
}
