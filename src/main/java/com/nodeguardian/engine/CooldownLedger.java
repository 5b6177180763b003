package com.nodeguardian.engine;

import com.nodeguardian.domain.enums.CooldownKind;
import com.nodeguardian.domain.model.NodeRuleKey;
import com.nodeguardian.repository.redis.CooldownRedisRepository;
import com.nodeguardian.repository.redis.CooldownRedisRepository.CooldownEntryKey;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Last-fired timestamps per (rule, node, kind).
 *
 * <p>Trigger and recovery cooldowns are independent: a node can be blocked from re-triggering
 * while eligible for recovery, and the other way round. Entries are written only after an
 * action batch completes and are written through to Redis so they survive a restart.
 */
@Service
public class CooldownLedger {

    private static final Logger log = LoggerFactory.getLogger(CooldownLedger.class);

    private final CooldownRedisRepository cooldownRedisRepository;

    private final Map<CooldownEntryKey, Instant> lastFired = new ConcurrentHashMap<>();

    public CooldownLedger(CooldownRedisRepository cooldownRedisRepository) {
        this.cooldownRedisRepository = cooldownRedisRepository;
    }

    /** True while {@code now < lastFiredAt + period}. A node that never fired is never in cooldown. */
    public boolean inCooldown(NodeRuleKey key, CooldownKind kind, Duration period, Instant now) {
        if (period == null || period.isZero() || period.isNegative()) {
            return false;
        }
        Instant last = lastFired.get(new CooldownEntryKey(key, kind));
        return last != null && now.isBefore(last.plus(period));
    }

    public void markFired(NodeRuleKey key, CooldownKind kind, Instant now) {
        lastFired.merge(new CooldownEntryKey(key, kind), now, (existing, candidate) ->
                candidate.isAfter(existing) ? candidate : existing);
        try {
            cooldownRedisRepository.save(key, kind, now);
        } catch (Exception e) {
            log.warn("Cooldown for {} ({}) not persisted: {}", key, kind, e.getMessage());
        }
    }

    public Optional<Instant> lastFired(NodeRuleKey key, CooldownKind kind) {
        return Optional.ofNullable(lastFired.get(new CooldownEntryKey(key, kind)));
    }

    /** Drops every entry of a rule, in memory and in Redis. */
    public void purgeRule(String ruleId) {
        lastFired.keySet().removeIf(entry -> entry.key().ruleId().equals(ruleId));
        try {
            cooldownRedisRepository.deleteByRule(ruleId);
        } catch (Exception e) {
            log.warn("Cooldown entries of rule {} not removed from Redis: {}", ruleId, e.getMessage());
        }
    }

    /** Loads all persisted entries. Called once at startup, before any rule is scheduled. */
    public int rehydrate() {
        int loaded = 0;
        Set<String> ruleIds = cooldownRedisRepository.findKnownRuleIds();
        for (String ruleId : ruleIds) {
            Map<CooldownEntryKey, Instant> entries = cooldownRedisRepository.findByRule(ruleId);
            entries.forEach((entryKey, instant) -> lastFired.merge(entryKey, instant, (a, b) -> a.isAfter(b) ? a : b));
            loaded += entries.size();
        }
        log.info("Rehydrated {} cooldown entries for {} rules", loaded, ruleIds.size());
        return loaded;
    }

    /** Rule ids with entries in memory or in Redis. */
    public Set<String> knownRuleIds() {
        Set<String> ids = new HashSet<>();
        lastFired.keySet().forEach(entry -> ids.add(entry.key().ruleId()));
        try {
            ids.addAll(cooldownRedisRepository.findKnownRuleIds());
        } catch (Exception e) {
            log.warn("Known rule ids not readable from Redis: {}", e.getMessage());
        }
        return ids;
    }

    public int size() {
        return lastFired.size();
    }
}
