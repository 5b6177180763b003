package com.nodeguardian.engine;

import com.nodeguardian.domain.model.NodeRuleKey;
import com.nodeguardian.domain.model.NodeRuleState;
import com.nodeguardian.repository.redis.NodeStateRedisRepository;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Arena of {@link NodeRuleState} keyed by (rule, node).
 *
 * <p>All mutations go through {@link #update}, which runs the mutation inside
 * {@link ConcurrentHashMap#compute} so updates to one key are serialized. The resulting state
 * is written through to Redis while the key's lock is still held, so Redis sees the writes of
 * one key in the order they were applied. A Redis failure is logged and the in-memory state
 * stays authoritative.
 */
@Service
public class NodeStateStore {

    private static final Logger log = LoggerFactory.getLogger(NodeStateStore.class);

    private final NodeStateRedisRepository nodeStateRedisRepository;

    private final Map<NodeRuleKey, NodeRuleState> states = new ConcurrentHashMap<>();

    public NodeStateStore(NodeStateRedisRepository nodeStateRedisRepository) {
        this.nodeStateRedisRepository = nodeStateRedisRepository;
    }

    /**
     * Applies {@code mutation} to the state of {@code key}, creating it lazily in phase IDLE.
     *
     * @return the mutation's result
     */
    public <R> R update(NodeRuleKey key, Function<NodeRuleState, R> mutation) {
        AtomicReference<R> result = new AtomicReference<>();
        states.compute(key, (k, existing) -> {
            NodeRuleState state = existing != null ? existing : new NodeRuleState(k.ruleId(), k.nodeName());
            result.set(mutation.apply(state));
            persist(state.copy());
            return state;
        });
        return result.get();
    }

    /** Copy of the current state, if the pair has been observed. */
    public Optional<NodeRuleState> find(NodeRuleKey key) {
        return Optional.ofNullable(copyUnderLock(key));
    }

    public List<NodeRuleState> findByRule(String ruleId) {
        return states.keySet().stream()
                .filter(key -> key.ruleId().equals(ruleId))
                .map(this::find)
                .flatMap(Optional::stream)
                .toList();
    }

    /** Copies of every state currently in phase TRIGGERED. */
    public List<NodeRuleState> findTriggered() {
        return states.keySet().stream()
                .map(this::find)
                .flatMap(Optional::stream)
                .filter(NodeRuleState::isTriggered)
                .toList();
    }

    public Set<String> nodesOf(String ruleId) {
        return states.keySet().stream()
                .filter(key -> key.ruleId().equals(ruleId))
                .map(NodeRuleKey::nodeName)
                .collect(Collectors.toSet());
    }

    public long countTriggered() {
        return states.values().stream().filter(NodeRuleState::isTriggered).count();
    }

    public int size() {
        return states.size();
    }

    /** Removes one pair, e.g. when its node left the rule's selector. */
    public void remove(NodeRuleKey key) {
        states.remove(key);
        try {
            nodeStateRedisRepository.delete(key.ruleId(), key.nodeName());
        } catch (Exception e) {
            log.warn("State of {} not removed from Redis: {}", key, e.getMessage());
        }
    }

    /** Removes every pair of a rule. */
    public void purgeRule(String ruleId) {
        states.keySet().removeIf(key -> key.ruleId().equals(ruleId));
        try {
            nodeStateRedisRepository.deleteByRule(ruleId);
        } catch (Exception e) {
            log.warn("States of rule {} not removed from Redis: {}", ruleId, e.getMessage());
        }
    }

    /** Rule ids with state in memory or in Redis. */
    public Set<String> knownRuleIds() {
        Set<String> ids = states.keySet().stream().map(NodeRuleKey::ruleId).collect(Collectors.toSet());
        try {
            ids.addAll(nodeStateRedisRepository.findKnownRuleIds());
        } catch (Exception e) {
            log.warn("Known rule ids not readable from Redis: {}", e.getMessage());
        }
        return ids;
    }

    /** Loads all persisted states. Called once at startup, before any rule is scheduled. */
    public int rehydrate() {
        int loaded = 0;
        Collection<String> ruleIds = nodeStateRedisRepository.findKnownRuleIds();
        for (String ruleId : ruleIds) {
            for (NodeRuleState state : nodeStateRedisRepository.findByRule(ruleId)) {
                states.putIfAbsent(state.getKey(), state);
                loaded++;
            }
        }
        log.info("Rehydrated {} node states for {} rules ({} triggered)", loaded, ruleIds.size(), countTriggered());
        return loaded;
    }

    private NodeRuleState copyUnderLock(NodeRuleKey key) {
        NodeRuleState[] copy = new NodeRuleState[1];
        states.computeIfPresent(key, (k, state) -> {
            copy[0] = state.copy();
            return state;
        });
        return copy[0];
    }

    private void persist(NodeRuleState snapshot) {
        try {
            nodeStateRedisRepository.save(snapshot);
        } catch (Exception e) {
            log.warn("State of {} not persisted: {}", snapshot.getKey(), e.getMessage());
        }
    }
}
