package com.nodeguardian.config;

import org.springframework.context.annotation.Configuration;

/**
 * Redis key schema for durable engine state.
 *
 * <p>All keys are prefixed with "ng:" so several clusters' guardians can share one Redis server
 * under different prefixes. Repositories use Spring Boot's auto-configured
 * {@code StringRedisTemplate}; values are plain strings (epoch millis) or JSON written with the
 * application {@code ObjectMapper}.
 *
 * <p>Key schema:
 * <pre>
 *   ng:cooldown:{ruleId}   hash: "{nodeName}|{kind}" -> lastFiredAt epoch millis
 *   ng:state:{ruleId}      hash: "{nodeName}"        -> NodeRuleState JSON
 *   ng:rules:known         set of rule ids with persisted state
 * </pre>
 */
@Configuration
public class RedisConfig {

    /** Global prefix for all keys. */
    public static final String KEY_PREFIX = "ng:";

    public static final String KEY_PREFIX_COOLDOWN = KEY_PREFIX + "cooldown:";
    public static final String KEY_PREFIX_STATE = KEY_PREFIX + "state:";

    /** Index of rule ids that have any persisted state, used for rehydration without KEYS scans. */
    public static final String KEY_SET_RULES_KNOWN = KEY_PREFIX + "rules:known";

    public static final String COOLDOWN_FIELD_SEPARATOR = "|";
}
