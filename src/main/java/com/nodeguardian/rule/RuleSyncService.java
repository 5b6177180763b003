package com.nodeguardian.rule;

import com.nodeguardian.domain.model.Rule;
import com.nodeguardian.engine.CooldownLedger;
import com.nodeguardian.engine.NodeStateStore;
import com.nodeguardian.exception.ConfigException;
import com.nodeguardian.exception.ErrorCode;
import com.nodeguardian.rule.DocumentReader.SourcedDocument;
import com.nodeguardian.rule.RuleChangeEvent.ChangeType;
import com.nodeguardian.status.RuleStatusReporter;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Reconciles the {@link RuleRegistry} with the {@link RuleSource}.
 *
 * <p>Every run lists the full snapshot and diffs it against the registry: new ids are added,
 * changed rules replaced, ids that disappeared (or became disabled) removed. A document that
 * fails mapping or validation is rejected and the previously registered version of that rule
 * stays active; the rejection is logged and published as the rule's status. When the source
 * cannot be listed at all the registry is left untouched.
 *
 * <p>The first run happens at startup from
 * {@link com.nodeguardian.lifecycle.StartupSynchronizationService}; periodic runs are no-ops
 * until then.
 */
@Service
public class RuleSyncService {

    private static final Logger log = LoggerFactory.getLogger(RuleSyncService.class);

    private final RuleSource ruleSource;
    private final RuleDocumentMapper ruleDocumentMapper;
    private final RuleRegistry ruleRegistry;
    private final RuleStatusReporter ruleStatusReporter;
    private final NodeStateStore nodeStateStore;
    private final CooldownLedger cooldownLedger;

    private final AtomicBoolean started = new AtomicBoolean(false);

    public RuleSyncService(
            RuleSource ruleSource,
            RuleDocumentMapper ruleDocumentMapper,
            RuleRegistry ruleRegistry,
            RuleStatusReporter ruleStatusReporter,
            NodeStateStore nodeStateStore,
            CooldownLedger cooldownLedger) {
        this.ruleSource = ruleSource;
        this.ruleDocumentMapper = ruleDocumentMapper;
        this.ruleRegistry = ruleRegistry;
        this.ruleStatusReporter = ruleStatusReporter;
        this.nodeStateStore = nodeStateStore;
        this.cooldownLedger = cooldownLedger;
    }

    /**
     * Initial snapshot. Also purges persisted state of rules that no longer exist, which can
     * only be detected once the full snapshot is known.
     */
    public SyncResult initialSync() {
        SyncResult result = synchronize();
        if (result.isSourceAvailable()) {
            purgeOrphanedState(result);
        }
        started.set(true);
        return result;
    }

    @Scheduled(
            fixedDelayString = "${nodeguardian.rules.resync-interval-ms:60000}",
            initialDelayString = "${nodeguardian.rules.resync-interval-ms:60000}")
    public void resync() {
        if (!started.get()) {
            return;
        }
        SyncResult result = synchronize();
        if (result.hasChanges()) {
            log.info(
                    "Rule resync: added={}, modified={}, removed={}, rejected={}",
                    result.getAdded(),
                    result.getModified(),
                    result.getRemoved(),
                    result.getRejected());
        }
    }

    public SyncResult synchronize() {
        List<SourcedDocument> documents;
        try {
            documents = ruleSource.listDocuments();
        } catch (Exception e) {
            log.error("Cannot list rules from {}, keeping current rules: {}", ruleSource.describe(), e.getMessage());
            return SyncResult.builder().sourceAvailable(false).build();
        }

        SyncResult result = SyncResult.builder().sourceAvailable(true).build();
        Map<String, Rule> desired = new LinkedHashMap<>();
        Set<String> rejected = new HashSet<>();

        for (SourcedDocument document : documents) {
            String name = RuleDocumentMapper.ruleName(document.content());
            try {
                Rule rule = ruleDocumentMapper.toRule(document.content());
                if (desired.containsKey(rule.getId())) {
                    log.warn("Rule {} defined more than once, {} wins", rule.getId(), document.source());
                }
                if (rule.isEnabled()) {
                    desired.put(rule.getId(), rule);
                } else {
                    desired.remove(rule.getId());
                }
            } catch (ConfigException e) {
                String label = name != null ? name : document.source();
                log.warn("Rejected rule document {} from {}: {}", label, document.source(), e.getMessage());
                result.getRejected().add(label);
                if (name != null) {
                    rejected.add(name);
                    ruleStatusReporter.report(name, ErrorCode.CONFIG_ERROR.getCode() + ": " + e.getMessage());
                }
            }
        }

        for (Rule rule : desired.values()) {
            Optional<ChangeType> change = ruleRegistry.register(rule);
            if (change.isEmpty()) {
                result.getUnchanged().add(rule.getId());
            } else if (change.get() == ChangeType.ADDED) {
                result.getAdded().add(rule.getId());
            } else {
                result.getModified().add(rule.getId());
            }
        }

        for (String ruleId : ruleRegistry.ids()) {
            // a rejected document keeps its previous version active
            if (!desired.containsKey(ruleId) && !rejected.contains(ruleId) && ruleRegistry.unregister(ruleId)) {
                result.getRemoved().add(ruleId);
            }
        }
        return result;
    }

    private void purgeOrphanedState(SyncResult result) {
        Set<String> known = new HashSet<>(nodeStateStore.knownRuleIds());
        known.addAll(cooldownLedger.knownRuleIds());
        for (String ruleId : known) {
            if (!ruleRegistry.contains(ruleId) && !result.getRejected().contains(ruleId)) {
                log.info("Purging persisted state of removed rule {}", ruleId);
                nodeStateStore.purgeRule(ruleId);
                cooldownLedger.purgeRule(ruleId);
            }
        }
    }

    public boolean isStarted() {
        return started.get();
    }
}
