package com.nodeguardian.unit.rule;

import static com.nodeguardian.unit.support.RuleFixtures.cpuAbove;
import static com.nodeguardian.unit.support.RuleFixtures.highCpuRule;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.nodeguardian.domain.model.Rule;
import com.nodeguardian.domain.model.RuleMetadata;
import com.nodeguardian.rule.RuleChangeEvent;
import com.nodeguardian.rule.RuleChangeEvent.ChangeType;
import com.nodeguardian.rule.RuleRegistry;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
class RuleRegistryTest {

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private RuleRegistry ruleRegistry;
    private Rule rule;

    @BeforeEach
    void setUp() {
        ruleRegistry = new RuleRegistry(applicationEventPublisher);
        rule = highCpuRule(List.of(), List.of()).build();
    }

    private RuleChangeEvent lastEvent() {
        ArgumentCaptor<RuleChangeEvent> captor = ArgumentCaptor.forClass(RuleChangeEvent.class);
        verify(applicationEventPublisher, atLeastOnce()).publishEvent(captor.capture());
        return captor.getValue();
    }

    @Test
    @DisplayName("new rule is ADDED and published")
    void registerNew() {
        assertThat(ruleRegistry.register(rule)).contains(ChangeType.ADDED);

        RuleChangeEvent event = lastEvent();
        assertThat(event.getChangeType()).isEqualTo(ChangeType.ADDED);
        assertThat(event.getRule()).isSameAs(rule);
        assertThat(ruleRegistry.get(rule.getId())).contains(rule);
    }

    @Test
    @DisplayName("re-registering an equal rule is a no-op")
    void registerUnchanged() {
        ruleRegistry.register(rule);

        assertThat(ruleRegistry.register(rule.toBuilder().build())).isEmpty();
        verify(applicationEventPublisher, times(1)).publishEvent(any(RuleChangeEvent.class));
    }

    @Test
    @DisplayName("changed rule replaces the old one and carries it as previous")
    void registerModified() {
        ruleRegistry.register(rule);
        Rule changed = rule.toBuilder().conditions(List.of(cpuAbove(95, Duration.ZERO))).build();

        assertThat(ruleRegistry.register(changed)).contains(ChangeType.MODIFIED);

        RuleChangeEvent event = lastEvent();
        assertThat(event.getPrevious()).isSameAs(rule);
        assertThat(ruleRegistry.get(rule.getId())).contains(changed);
    }

    @Test
    @DisplayName("disabled rule unregisters an active one")
    void registerDisabled() {
        ruleRegistry.register(rule);
        Rule disabled = rule.toBuilder()
                .metadata(RuleMetadata.builder().enabled(false).build())
                .build();

        assertThat(ruleRegistry.register(disabled)).contains(ChangeType.DELETED);
        assertThat(ruleRegistry.contains(rule.getId())).isFalse();
        assertThat(lastEvent().getChangeType()).isEqualTo(ChangeType.DELETED);
    }

    @Test
    @DisplayName("unregistering an unknown id publishes nothing")
    void unregisterUnknown() {
        assertThat(ruleRegistry.unregister("ghost")).isFalse();
        verify(applicationEventPublisher, never()).publishEvent(any(ApplicationEvent.class));
    }

    @Test
    @DisplayName("list orders by priority then id")
    void listOrder() {
        ruleRegistry.register(rule.toBuilder().id("b").metadata(RuleMetadata.builder().priority(5).build()).build());
        ruleRegistry.register(rule.toBuilder().id("a").metadata(RuleMetadata.builder().priority(5).build()).build());
        ruleRegistry.register(rule.toBuilder().id("c").metadata(RuleMetadata.builder().priority(1).build()).build());

        assertThat(ruleRegistry.list()).extracting(Rule::getId).containsExactly("c", "a", "b");
    }

    @Test
    @DisplayName("apply routes pushed changes")
    void applyPushedChanges() {
        ruleRegistry.apply(ChangeType.ADDED, rule.getId(), rule);
        assertThat(ruleRegistry.size()).isEqualTo(1);

        ruleRegistry.apply(ChangeType.DELETED, rule.getId(), null);
        assertThat(ruleRegistry.size()).isZero();
    }
}
