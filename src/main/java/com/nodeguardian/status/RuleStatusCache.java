package com.nodeguardian.status;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Latest {@link RuleStatus} per rule.
 *
 * <p>Events arrive asynchronously and may be applied out of order. A removal is remembered with
 * its {@code updatedAt}; a status that is not newer than the removal is dropped so a deleted rule
 * does not reappear.
 */
@Component
public class RuleStatusCache {

    private final Map<String, RuleStatus> statuses = new ConcurrentHashMap<>();
    private final Map<String, Instant> removedAt = new ConcurrentHashMap<>();

    @Async("eventExecutor")
    @EventListener
    public void onRuleStatus(RuleStatusEvent event) {
        apply(event.getStatus());
    }

    public synchronized void apply(RuleStatus status) {
        String ruleId = status.getRuleId();
        if (status.isRemoved()) {
            statuses.remove(ruleId);
            if (status.getUpdatedAt() != null) {
                removedAt.merge(ruleId, status.getUpdatedAt(), (a, b) -> a.isAfter(b) ? a : b);
            }
            return;
        }
        Instant removal = removedAt.get(ruleId);
        if (removal != null) {
            if (status.getUpdatedAt() == null || !status.getUpdatedAt().isAfter(removal)) {
                return;
            }
            removedAt.remove(ruleId);
        }
        statuses.merge(status.getRuleId(), status, (existing, incoming) ->
                existing.getUpdatedAt() != null
                                && incoming.getUpdatedAt() != null
                                && incoming.getUpdatedAt().isBefore(existing.getUpdatedAt())
                        ? existing
                        : incoming);
    }

    public Optional<RuleStatus> find(String ruleId) {
        return Optional.ofNullable(statuses.get(ruleId));
    }

    public List<RuleStatus> findAll() {
        return statuses.values().stream()
                .sorted(Comparator.comparing(RuleStatus::getRuleId))
                .toList();
    }
}
