package com.nodeguardian.lifecycle;

import com.nodeguardian.engine.CooldownLedger;
import com.nodeguardian.engine.EvaluationScheduler;
import com.nodeguardian.engine.NodeStateStore;
import com.nodeguardian.rule.RuleRegistry;
import com.nodeguardian.rule.RuleSyncService;
import com.nodeguardian.rule.SyncResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Brings the control loop up once the application is ready.
 *
 * <ol>
 *   <li>Rehydrate the cooldown ledger and node states from Redis</li>
 *   <li>Load the full rule snapshot into the registry</li>
 *   <li>Start the per-rule timers</li>
 * </ol>
 *
 * <p>Timers start only after the snapshot is registered, so the first tick of every rule
 * already sees its persisted cooldowns and phases. A Redis failure during rehydration is
 * logged and startup continues with empty state.
 */
@Service
public class StartupSynchronizationService {

    private static final Logger log = LoggerFactory.getLogger(StartupSynchronizationService.class);

    private final CooldownLedger cooldownLedger;
    private final NodeStateStore nodeStateStore;
    private final RuleSyncService ruleSyncService;
    private final RuleRegistry ruleRegistry;
    private final EvaluationScheduler evaluationScheduler;

    public StartupSynchronizationService(
            CooldownLedger cooldownLedger,
            NodeStateStore nodeStateStore,
            RuleSyncService ruleSyncService,
            RuleRegistry ruleRegistry,
            EvaluationScheduler evaluationScheduler) {
        this.cooldownLedger = cooldownLedger;
        this.nodeStateStore = nodeStateStore;
        this.ruleSyncService = ruleSyncService;
        this.ruleRegistry = ruleRegistry;
        this.evaluationScheduler = evaluationScheduler;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        StartupResult result = synchronize();
        if (result.isSuccess()) {
            log.info(
                    "Startup synchronization completed in {}ms: {} rules ({} rejected), {} node states, {} cooldowns",
                    result.getDurationMs(),
                    result.getRulesRegistered(),
                    result.getRulesRejected(),
                    result.getNodeStatesLoaded(),
                    result.getCooldownEntriesLoaded());
        } else {
            log.error("Startup synchronization failed: {}", result.getError());
        }
    }

    public StartupResult synchronize() {
        StartupResult result =
                StartupResult.builder().startedAt(System.currentTimeMillis()).build();
        try {
            rehydrate(result);

            SyncResult sync = ruleSyncService.initialSync();
            result.setRuleSourceAvailable(sync.isSourceAvailable());
            result.setRulesRegistered(ruleRegistry.size());
            result.setRulesRejected(sync.getRejected().size());
            if (!sync.isSourceAvailable()) {
                log.warn("Rule source unavailable at startup, periodic resync will retry");
            }

            evaluationScheduler.start();
            result.setSuccess(true);
        } catch (Exception e) {
            result.setSuccess(false);
            result.setError(e.getMessage());
            log.error("Startup synchronization failed", e);
        }
        result.setDurationMs(System.currentTimeMillis() - result.getStartedAt());
        return result;
    }

    private void rehydrate(StartupResult result) {
        try {
            result.setCooldownEntriesLoaded(cooldownLedger.rehydrate());
        } catch (Exception e) {
            log.warn("Cooldown entries not rehydrated, starting empty: {}", e.getMessage());
        }
        try {
            result.setNodeStatesLoaded(nodeStateStore.rehydrate());
        } catch (Exception e) {
            log.warn("Node states not rehydrated, starting empty: {}", e.getMessage());
        }
    }
}
