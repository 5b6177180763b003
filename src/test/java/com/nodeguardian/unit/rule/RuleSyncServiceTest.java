package com.nodeguardian.unit.rule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.nodeguardian.engine.CooldownLedger;
import com.nodeguardian.engine.GuardianEngineConfig;
import com.nodeguardian.engine.NodeStateStore;
import com.nodeguardian.rule.DocumentReader.SourcedDocument;
import com.nodeguardian.rule.RuleDocumentMapper;
import com.nodeguardian.rule.RuleRegistry;
import com.nodeguardian.rule.RuleSource;
import com.nodeguardian.rule.RuleSyncService;
import com.nodeguardian.rule.RuleValidator;
import com.nodeguardian.rule.SyncResult;
import com.nodeguardian.status.RuleStatusReporter;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

/**
 * Tests for snapshot synchronization: diffing against the registry, keeping the previous
 * version of a rejected document, tolerating an unavailable source and purging orphaned state.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RuleSyncServiceTest {

    private final YAMLMapper yaml = new YAMLMapper();

    @Mock
    private RuleSource ruleSource;

    @Mock
    private RuleStatusReporter ruleStatusReporter;

    @Mock
    private NodeStateStore nodeStateStore;

    @Mock
    private CooldownLedger cooldownLedger;

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private RuleRegistry ruleRegistry;
    private RuleSyncService ruleSyncService;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = Jackson2ObjectMapperBuilder.json().build();
        ruleRegistry = new RuleRegistry(applicationEventPublisher);
        ruleSyncService = new RuleSyncService(
                ruleSource,
                new RuleDocumentMapper(objectMapper, new GuardianEngineConfig(), new RuleValidator()),
                ruleRegistry,
                ruleStatusReporter,
                nodeStateStore,
                cooldownLedger);
        when(ruleSource.describe()).thenReturn("test source");
    }

    private SourcedDocument rule(String name, double threshold) throws Exception {
        JsonNode node = yaml.readTree("""
                metadata: {name: %s}
                spec:
                  conditions:
                    - {metric: cpuUtilizationPercent, operator: GreaterThan, value: %s, duration: 1m}
                  actions:
                    - {type: label, labels: {hot: "true"}}
                """.formatted(name, threshold));
        return new SourcedDocument(name + ".yaml", node);
    }

    private SourcedDocument invalid(String name) throws Exception {
        JsonNode node = yaml.readTree("metadata: {name: %s}\nspec: {conditions: []}".formatted(name));
        return new SourcedDocument(name + ".yaml", node);
    }

    @Nested
    @DisplayName("Diffing")
    class Diffing {

        @Test
        @DisplayName("first snapshot adds every rule")
        void addsAll() throws Exception {
            when(ruleSource.listDocuments()).thenReturn(List.of(rule("cpu", 80), rule("mem", 90)));

            SyncResult result = ruleSyncService.synchronize();

            assertThat(result.getAdded()).containsExactly("cpu", "mem");
            assertThat(ruleRegistry.ids()).containsExactlyInAnyOrder("cpu", "mem");
        }

        @Test
        @DisplayName("changed, unchanged and vanished rules are classified")
        void classifiesChanges() throws Exception {
            when(ruleSource.listDocuments())
                    .thenReturn(List.of(rule("cpu", 80), rule("mem", 90)))
                    .thenReturn(List.of(rule("cpu", 85)));
            ruleSyncService.synchronize();

            SyncResult result = ruleSyncService.synchronize();

            assertThat(result.getModified()).containsExactly("cpu");
            assertThat(result.getRemoved()).containsExactly("mem");
            assertThat(result.hasChanges()).isTrue();
            assertThat(ruleRegistry.get("cpu").orElseThrow().getConditions().get(0).getThreshold())
                    .isEqualByComparingTo("85");
        }

        @Test
        @DisplayName("identical snapshot changes nothing")
        void unchanged() throws Exception {
            when(ruleSource.listDocuments()).thenReturn(List.of(rule("cpu", 80)));
            ruleSyncService.synchronize();

            SyncResult result = ruleSyncService.synchronize();

            assertThat(result.getUnchanged()).containsExactly("cpu");
            assertThat(result.hasChanges()).isFalse();
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("rejected document keeps the previous version active and reports CONFIG_ERROR")
        void rejectedKeepsPrevious() throws Exception {
            when(ruleSource.listDocuments())
                    .thenReturn(List.of(rule("cpu", 80)))
                    .thenReturn(List.of(invalid("cpu")));
            ruleSyncService.synchronize();

            SyncResult result = ruleSyncService.synchronize();

            assertThat(result.getRejected()).containsExactly("cpu");
            assertThat(result.getRemoved()).isEmpty();
            assertThat(ruleRegistry.contains("cpu")).isTrue();
            verify(ruleStatusReporter).report(eq("cpu"), startsWith("CONFIG_ERROR"));
        }

        @Test
        @DisplayName("unlistable source leaves the registry untouched")
        void sourceUnavailable() throws Exception {
            when(ruleSource.listDocuments())
                    .thenReturn(List.of(rule("cpu", 80)))
                    .thenThrow(new IllegalStateException("API server unreachable"));
            ruleSyncService.synchronize();

            SyncResult result = ruleSyncService.synchronize();

            assertThat(result.isSourceAvailable()).isFalse();
            assertThat(ruleRegistry.contains("cpu")).isTrue();
        }
    }

    @Nested
    @DisplayName("Startup")
    class Startup {

        @Test
        @DisplayName("initial sync purges persisted state of rules that no longer exist")
        void purgesOrphans() throws Exception {
            when(ruleSource.listDocuments()).thenReturn(List.of(rule("cpu", 80), invalid("broken")));
            when(nodeStateStore.knownRuleIds()).thenReturn(Set.of("cpu", "deleted-rule"));
            when(cooldownLedger.knownRuleIds()).thenReturn(Set.of("broken", "another-gone"));

            ruleSyncService.initialSync();

            verify(nodeStateStore).purgeRule("deleted-rule");
            verify(cooldownLedger).purgeRule("another-gone");
            verify(nodeStateStore, never()).purgeRule("cpu");
            verify(cooldownLedger, never()).purgeRule("broken");
            assertThat(ruleSyncService.isStarted()).isTrue();
        }

        @Test
        @DisplayName("no purge when the source is unavailable at startup")
        void noPurgeWithoutSource() {
            when(ruleSource.listDocuments()).thenThrow(new IllegalStateException("down"));

            ruleSyncService.initialSync();

            verify(nodeStateStore, never()).purgeRule(anyString());
            verify(cooldownLedger, never()).purgeRule(anyString());
        }

        @Test
        @DisplayName("periodic resync does nothing before the initial sync")
        void resyncBeforeStart() {
            ruleSyncService.resync();

            verify(ruleSource, never()).listDocuments();
        }
    }
}
