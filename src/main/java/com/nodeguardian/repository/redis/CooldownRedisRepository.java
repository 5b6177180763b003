package com.nodeguardian.repository.redis;

import com.nodeguardian.config.RedisConfig;
import com.nodeguardian.domain.enums.CooldownKind;
import com.nodeguardian.domain.model.NodeRuleKey;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

/**
 * Durable cooldown entries: hash {@code ng:cooldown:{ruleId}}, field {@code {nodeName}|{kind}},
 * value = lastFiredAt in epoch millis.
 *
 * <p>This is what keeps a restarted process from re-firing every rule at once. The in-memory
 * {@link com.nodeguardian.engine.CooldownLedger} is the read path; this repository is written
 * through on every markFired and read once at startup.
 */
@Repository
@RequiredArgsConstructor
public class CooldownRedisRepository {

    private static final Logger log = LoggerFactory.getLogger(CooldownRedisRepository.class);

    private final StringRedisTemplate redisTemplate;

    public void save(NodeRuleKey key, CooldownKind kind, Instant lastFiredAt) {
        redisTemplate
                .opsForHash()
                .put(hashKey(key.ruleId()), field(key.nodeName(), kind), String.valueOf(lastFiredAt.toEpochMilli()));
        redisTemplate.opsForSet().add(RedisConfig.KEY_SET_RULES_KNOWN, key.ruleId());
    }

    /** All entries of one rule, keyed by (node, kind). Malformed fields are skipped. */
    public Map<CooldownEntryKey, Instant> findByRule(String ruleId) {
        Map<Object, Object> raw = redisTemplate.opsForHash().entries(hashKey(ruleId));
        Map<CooldownEntryKey, Instant> result = new HashMap<>();
        if (raw == null) {
            return result;
        }
        raw.forEach((field, value) -> {
            CooldownEntryKey entryKey = parseField(ruleId, String.valueOf(field));
            if (entryKey == null) {
                log.warn("Skipping malformed cooldown field {} in rule {}", field, ruleId);
                return;
            }
            try {
                result.put(entryKey, Instant.ofEpochMilli(Long.parseLong(String.valueOf(value))));
            } catch (NumberFormatException e) {
                log.warn("Skipping malformed cooldown value {} for {}", value, field);
            }
        });
        return result;
    }

    public Set<String> findKnownRuleIds() {
        Set<String> ids = redisTemplate.opsForSet().members(RedisConfig.KEY_SET_RULES_KNOWN);
        return ids != null ? ids : Set.of();
    }

    public void deleteByRule(String ruleId) {
        redisTemplate.delete(hashKey(ruleId));
    }

    static String hashKey(String ruleId) {
        return RedisConfig.KEY_PREFIX_COOLDOWN + ruleId;
    }

    static String field(String nodeName, CooldownKind kind) {
        return nodeName + RedisConfig.COOLDOWN_FIELD_SEPARATOR + kind.name();
    }

    private static CooldownEntryKey parseField(String ruleId, String field) {
        int separator = field.lastIndexOf(RedisConfig.COOLDOWN_FIELD_SEPARATOR);
        if (separator <= 0 || separator == field.length() - 1) {
            return null;
        }
        try {
            CooldownKind kind = CooldownKind.valueOf(field.substring(separator + 1));
            return new CooldownEntryKey(new NodeRuleKey(ruleId, field.substring(0, separator)), kind);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /** (rule, node, kind) identity of one cooldown entry. */
    public record CooldownEntryKey(NodeRuleKey key, CooldownKind kind) {}
}
