package com.nodeguardian.engine;

import com.nodeguardian.domain.model.NodeRuleKey;
import com.nodeguardian.domain.model.Rule;
import com.nodeguardian.exception.ErrorCode;
import com.nodeguardian.exception.NodeSelectorException;
import com.nodeguardian.gateway.NodeSelectorClient;
import com.nodeguardian.rule.RuleChangeEvent;
import com.nodeguardian.rule.RuleRegistry;
import com.nodeguardian.status.RuleStatusReporter;
import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Owns one timer per enabled rule.
 *
 * <p>Each timer runs once immediately when the rule is scheduled and then every
 * {@code monitoring.checkInterval} (fixed delay). A tick resolves the rule's nodes, drops the
 * state of nodes that left the selector and submits one trigger evaluation per node through
 * the {@link SlotTaskRunner}.
 *
 * <p>Deleting or disabling a rule cancels its timer and retires its execution slots: running
 * batches finish, new ones are refused, and once the last one is released the rule's node
 * states, cooldown entries and status are purged. A rule re-added while it is still draining is
 * scheduled right after the purge.
 */
@Service
public class EvaluationScheduler {

    private static final Logger log = LoggerFactory.getLogger(EvaluationScheduler.class);

    private final RuleRegistry ruleRegistry;
    private final NodeSelectorClient nodeSelectorClient;
    private final ExternalCallExecutor externalCallExecutor;
    private final NodeEvaluationService nodeEvaluationService;
    private final NodeStateStore nodeStateStore;
    private final CooldownLedger cooldownLedger;
    private final ExecutionSlots executionSlots;
    private final SlotTaskRunner slotTaskRunner;
    private final RuleStatusReporter ruleStatusReporter;
    private final GuardianEngineConfig guardianEngineConfig;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    private final Map<String, ScheduledFuture<?>> timers = new ConcurrentHashMap<>();
    private final Set<String> draining = new HashSet<>();

    private volatile boolean running;

    public EvaluationScheduler(
            RuleRegistry ruleRegistry,
            NodeSelectorClient nodeSelectorClient,
            ExternalCallExecutor externalCallExecutor,
            NodeEvaluationService nodeEvaluationService,
            NodeStateStore nodeStateStore,
            CooldownLedger cooldownLedger,
            ExecutionSlots executionSlots,
            SlotTaskRunner slotTaskRunner,
            RuleStatusReporter ruleStatusReporter,
            GuardianEngineConfig guardianEngineConfig,
            @Qualifier("guardianTaskScheduler") TaskScheduler taskScheduler,
            Clock clock) {
        this.ruleRegistry = ruleRegistry;
        this.nodeSelectorClient = nodeSelectorClient;
        this.externalCallExecutor = externalCallExecutor;
        this.nodeEvaluationService = nodeEvaluationService;
        this.nodeStateStore = nodeStateStore;
        this.cooldownLedger = cooldownLedger;
        this.executionSlots = executionSlots;
        this.slotTaskRunner = slotTaskRunner;
        this.ruleStatusReporter = ruleStatusReporter;
        this.guardianEngineConfig = guardianEngineConfig;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    /** Schedules every registered rule. Called once the startup snapshot is loaded. */
    public synchronized void start() {
        if (!guardianEngineConfig.isEnabled()) {
            log.warn("Evaluation engine disabled (nodeguardian.engine.enabled=false), no timers started");
            return;
        }
        running = true;
        List<Rule> rules = ruleRegistry.list();
        rules.forEach(this::schedule);
        log.info("Evaluation scheduler started with {} rules", rules.size());
    }

    /** Cancels all timers. Running evaluations are not interrupted. */
    public synchronized void stop() {
        running = false;
        timers.values().forEach(timer -> timer.cancel(false));
        timers.clear();
        log.info("Evaluation scheduler stopped");
    }

    public boolean isRunning() {
        return running;
    }

    @EventListener
    public synchronized void onRuleChange(RuleChangeEvent event) {
        switch (event.getChangeType()) {
            case ADDED -> {
                if (draining.contains(event.getRuleId())) {
                    log.info("Rule {} re-added while draining, scheduling after purge", event.getRuleId());
                    return;
                }
                schedule(event.getRule());
            }
            case MODIFIED -> {
                resetChangedClocks(event.getPrevious(), event.getRule());
                if (!draining.contains(event.getRuleId())) {
                    schedule(event.getRule());
                }
            }
            case DELETED -> retire(event.getRuleId());
        }
    }

    /** One evaluation round of a rule. Never throws. */
    void tick(String ruleId) {
        try {
            if (!running) {
                return;
            }
            Rule rule = ruleRegistry.get(ruleId).orElse(null);
            if (rule == null) {
                return;
            }

            List<String> nodes;
            try {
                nodes = resolveNodes(rule);
            } catch (NodeSelectorException e) {
                log.warn("Skipping tick of rule {}: {}", ruleId, e.getMessage());
                ruleStatusReporter.report(ruleId, e.getErrorCode().getCode() + ": " + e.getMessage());
                return;
            }

            pruneDepartedNodes(ruleId, nodes);

            for (String node : nodes) {
                slotTaskRunner.submit(new NodeRuleKey(ruleId, node), "trigger", () -> {
                    try {
                        nodeEvaluationService.evaluateTrigger(rule, node, clock.instant());
                    } finally {
                        ruleStatusReporter.report(ruleId, null);
                    }
                });
            }
        } catch (Exception e) {
            log.error("Tick of rule {} failed", ruleId, e);
            ruleStatusReporter.report(ruleId, ErrorCode.INTERNAL_ERROR.getCode() + ": " + e.getMessage());
        }
    }

    private List<String> resolveNodes(Rule rule) {
        List<String> nodes = externalCallExecutor.call(
                () -> nodeSelectorClient.resolve(rule.getNodeSelector()),
                e -> e instanceof NodeSelectorException nse
                        ? nse
                        : new NodeSelectorException("Node selector of rule " + rule.getId() + " failed: "
                                + e.getMessage(), e));
        List<String> distinct = nodes == null
                ? List.of()
                : nodes.stream().filter(Objects::nonNull).distinct().toList();
        if (distinct.isEmpty()) {
            throw new NodeSelectorException(
                    ErrorCode.SELECTOR_EMPTY, "no nodes match the selector");
        }
        return distinct;
    }

    /** Removes the state of nodes the selector no longer returns. Cooldown entries are kept. */
    private void pruneDepartedNodes(String ruleId, List<String> nodes) {
        Set<String> current = new HashSet<>(nodes);
        for (String known : nodeStateStore.nodesOf(ruleId)) {
            if (current.contains(known)) {
                continue;
            }
            NodeRuleKey key = new NodeRuleKey(ruleId, known);
            boolean submitted = slotTaskRunner.submit(key, "prune", () -> {
                nodeStateStore.remove(key);
                log.info("Node {} left the selector of rule {}, state removed", known, ruleId);
            });
            if (!submitted) {
                log.debug("State of {} kept until its slot is free", key);
            }
        }
    }

    private void schedule(Rule rule) {
        if (!running) {
            return;
        }
        cancelTimer(rule.getId());
        Duration interval = rule.getMonitoring().getCheckInterval();
        ScheduledFuture<?> timer =
                taskScheduler.scheduleWithFixedDelay(() -> tick(rule.getId()), clock.instant(), interval);
        timers.put(rule.getId(), timer);
        log.debug("Rule {} scheduled every {}", rule.getId(), interval);
    }

    private void retire(String ruleId) {
        cancelTimer(ruleId);
        draining.add(ruleId);
        executionSlots.retire(ruleId).thenRun(() -> finishRetire(ruleId));
    }

    private synchronized void finishRetire(String ruleId) {
        try {
            nodeStateStore.purgeRule(ruleId);
            cooldownLedger.purgeRule(ruleId);
            ruleStatusReporter.reportRemoved(ruleId);
            log.info("Purged node states and cooldowns of rule {}", ruleId);
        } catch (Exception e) {
            log.error("Purge of rule {} failed", ruleId, e);
        } finally {
            draining.remove(ruleId);
            executionSlots.reinstate(ruleId);
        }
        ruleRegistry.get(ruleId).ifPresent(this::schedule);
    }

    /**
     * A modified rule keeps phases and timestamps. Clocks of a side whose conditions changed no
     * longer describe the new conditions and restart.
     */
    private void resetChangedClocks(Rule previous, Rule rule) {
        if (previous == null) {
            return;
        }
        boolean triggerChanged = !Objects.equals(previous.getConditions(), rule.getConditions())
                || previous.getConditionLogic() != rule.getConditionLogic();
        boolean recoveryChanged = !Objects.equals(previous.getRecoveryConditions(), rule.getRecoveryConditions())
                || previous.getRecoveryConditionLogic() != rule.getRecoveryConditionLogic();
        if (!triggerChanged && !recoveryChanged) {
            return;
        }
        for (String node : nodeStateStore.nodesOf(rule.getId())) {
            nodeStateStore.update(new NodeRuleKey(rule.getId(), node), state -> {
                if (triggerChanged) {
                    state.getTriggerClocks().clear();
                }
                if (recoveryChanged) {
                    state.getRecoveryClocks().clear();
                }
                return null;
            });
        }
        log.info("Rule {} conditions changed, duration clocks restarted", rule.getId());
    }

    private void cancelTimer(String ruleId) {
        ScheduledFuture<?> timer = timers.remove(ruleId);
        if (timer != null) {
            timer.cancel(false);
        }
    }

    public Set<String> scheduledRuleIds() {
        return Set.copyOf(timers.keySet());
    }
}
