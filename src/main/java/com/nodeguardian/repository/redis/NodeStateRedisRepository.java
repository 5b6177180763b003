package com.nodeguardian.repository.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nodeguardian.config.RedisConfig;
import com.nodeguardian.domain.model.NodeRuleState;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

/**
 * Durable NodeRuleState: hash {@code ng:state:{ruleId}}, field {@code {nodeName}}, value = JSON.
 *
 * <p>Phases and duration clocks survive a restart so a Triggered node is still recovered and a
 * half-elapsed duration window is not lost.
 */
@Repository
@RequiredArgsConstructor
public class NodeStateRedisRepository {

    private static final Logger log = LoggerFactory.getLogger(NodeStateRedisRepository.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public void save(NodeRuleState state) {
        try {
            String json = objectMapper.writeValueAsString(state);
            redisTemplate.opsForHash().put(hashKey(state.getRuleId()), state.getNodeName(), json);
            redisTemplate.opsForSet().add(RedisConfig.KEY_SET_RULES_KNOWN, state.getRuleId());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("NodeRuleState serialization failed for " + state.getKey(), e);
        }
    }

    public List<NodeRuleState> findByRule(String ruleId) {
        Map<Object, Object> raw = redisTemplate.opsForHash().entries(hashKey(ruleId));
        List<NodeRuleState> states = new ArrayList<>();
        if (raw == null) {
            return states;
        }
        raw.forEach((node, json) -> {
            try {
                NodeRuleState state = objectMapper.readValue(String.valueOf(json), NodeRuleState.class);
                state.setRuleId(ruleId);
                state.setNodeName(String.valueOf(node));
                states.add(state);
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable state for {}/{}: {}", ruleId, node, e.getOriginalMessage());
            }
        });
        return states;
    }

    public Set<String> findKnownRuleIds() {
        Set<String> ids = redisTemplate.opsForSet().members(RedisConfig.KEY_SET_RULES_KNOWN);
        return ids != null ? ids : Set.of();
    }

    public void delete(String ruleId, String nodeName) {
        redisTemplate.opsForHash().delete(hashKey(ruleId), nodeName);
    }

    /** Removes every state of the rule and drops it from the known-rules index. */
    public void deleteByRule(String ruleId) {
        redisTemplate.delete(hashKey(ruleId));
        redisTemplate.opsForSet().remove(RedisConfig.KEY_SET_RULES_KNOWN, ruleId);
    }

    static String hashKey(String ruleId) {
        return RedisConfig.KEY_PREFIX_STATE + ruleId;
    }
}
