package com.nodeguardian.unit.rule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.nodeguardian.action.AlertAction;
import com.nodeguardian.action.EvictAction;
import com.nodeguardian.action.LabelAction;
import com.nodeguardian.action.TaintAction;
import com.nodeguardian.action.UntaintAction;
import com.nodeguardian.domain.enums.ChannelType;
import com.nodeguardian.domain.enums.ComparisonOperator;
import com.nodeguardian.domain.enums.ConditionLogic;
import com.nodeguardian.domain.enums.MetricKind;
import com.nodeguardian.domain.enums.TaintEffect;
import com.nodeguardian.domain.model.Condition;
import com.nodeguardian.domain.model.Rule;
import com.nodeguardian.engine.GuardianEngineConfig;
import com.nodeguardian.exception.ConfigException;
import com.nodeguardian.exception.ErrorCode;
import com.nodeguardian.notification.ChannelConfig;
import com.nodeguardian.rule.DocumentReader;
import com.nodeguardian.rule.RuleDocumentMapper;
import com.nodeguardian.rule.RuleValidator;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

/**
 * Tests for mapping rule documents: the bundled sample rules, the accepted action shapes,
 * defaults and the collected validation violations.
 */
class RuleDocumentMapperTest {

    private final YAMLMapper yaml = new YAMLMapper();

    private GuardianEngineConfig guardianEngineConfig;
    private RuleDocumentMapper ruleDocumentMapper;
    private DocumentReader documentReader;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = Jackson2ObjectMapperBuilder.json().build();
        guardianEngineConfig = new GuardianEngineConfig();
        ruleDocumentMapper = new RuleDocumentMapper(objectMapper, guardianEngineConfig, new RuleValidator());
        documentReader = new DocumentReader(objectMapper);
    }

    private JsonNode classpathDocument(String resource) throws Exception {
        Path path = Path.of(getClass().getClassLoader().getResource(resource).toURI());
        return documentReader.readFile(path).get(0);
    }

    private JsonNode document(String text) throws Exception {
        return yaml.readTree(text);
    }

    @Nested
    @DisplayName("Bundled rules")
    class BundledRules {

        @Test
        @DisplayName("high-cpu sample maps conditions, selector, actions and monitoring")
        void highCpuRule() throws Exception {
            Rule rule = ruleDocumentMapper.toRule(classpathDocument("rules/high-cpu-rule.yaml"));

            assertThat(rule.getId()).isEqualTo("high-cpu-rule");
            assertThat(rule.getConditionLogic()).isEqualTo(ConditionLogic.AND);
            assertThat(rule.getConditions()).hasSize(2);
            Condition cpu = rule.getConditions().get(0);
            assertThat(cpu.getMetric()).isEqualTo(MetricKind.CPU_UTILIZATION_PERCENT);
            assertThat(cpu.getOperator()).isEqualTo(ComparisonOperator.GREATER_THAN);
            assertThat(cpu.getThreshold()).isEqualByComparingTo("80");
            assertThat(cpu.getDuration()).isEqualTo(Duration.ofMinutes(5));
            assertThat(rule.getConditions().get(1).getThreshold()).isEqualByComparingTo(new BigDecimal("1.5"));

            assertThat(rule.getNodeSelector().getMatchLabels())
                    .containsEntry("node-role.kubernetes.io/worker", "");

            assertThat(rule.getActions()).hasSize(3);
            TaintAction taint = (TaintAction) rule.getActions().get(0);
            assertThat(taint.getKey()).isEqualTo("nodeguardian.io/high-cpu");
            assertThat(taint.getEffect()).isEqualTo(TaintEffect.NO_SCHEDULE);
            assertThat(((LabelAction) rule.getActions().get(1)).getLabels())
                    .containsEntry("nodeguardian.io/status", "high-cpu");
            AlertAction alert = (AlertAction) rule.getActions().get(2);
            assertThat(alert.getTemplate()).isEqualTo("high-cpu-alert");
            assertThat(alert.getChannels())
                    .containsExactly(ChannelConfig.of(ChannelType.LOG), ChannelConfig.of(ChannelType.WEBHOOK));

            assertThat(rule.getRecoveryActions()).first().isInstanceOf(UntaintAction.class);
            assertThat(rule.getMonitoring().getCheckInterval()).isEqualTo(Duration.ofSeconds(30));
            assertThat(rule.getMonitoring().getCooldownPeriod()).isEqualTo(Duration.ofMinutes(10));
            assertThat(rule.getPriority()).isEqualTo(10);
        }

        @Test
        @DisplayName("memory-pressure sample falls back to the default recovery cooldown")
        void memoryPressureRule() throws Exception {
            Rule rule = ruleDocumentMapper.toRule(classpathDocument("rules/memory-pressure-rule.yaml"));

            assertThat(rule.getNodeSelector().getNodeNames()).containsExactly("worker-1", "worker-2");
            EvictAction evict = (EvictAction) rule.getActions().get(0);
            assertThat(evict.effectiveMaxPods()).isEqualTo(5);
            assertThat(evict.getExcludeNamespaces()).containsExactly("kube-system", "monitoring");
            assertThat(rule.getMonitoring().getRecoveryCooldownPeriod())
                    .isEqualTo(guardianEngineConfig.getDefaultRecoveryCooldownPeriod());
            assertThat(rule.getRecoveryActions().get(1)).isInstanceOf(AlertAction.class);
        }
    }

    @Nested
    @DisplayName("Document shapes")
    class DocumentShapes {

        @Test
        @DisplayName("flat action fields and snake_case type names are accepted")
        void flatActionsAndTypeAliases() throws Exception {
            Rule rule = ruleDocumentMapper.toRule(document("""
                    metadata: {name: flat}
                    spec:
                      conditions:
                        - {metric: diskUtilizationPercent, operator: GreaterThan, threshold: "85"}
                      actions:
                        - {type: remove_label, labels: [a, b]}
                        - {type: Taint, key: k, effect: NoExecute}
                    """));

            assertThat(rule.getActions().get(0).getTypeName()).isEqualTo("removeLabel");
            assertThat(((TaintAction) rule.getActions().get(1)).getEffect()).isEqualTo(TaintEffect.NO_EXECUTE);
            assertThat(rule.getConditions().get(0).getThreshold()).isEqualByComparingTo("85");
        }

        @Test
        @DisplayName("omitted duration and monitoring use the engine defaults")
        void defaults() throws Exception {
            Rule rule = ruleDocumentMapper.toRule(document("""
                    metadata: {name: defaults}
                    spec:
                      conditions:
                        - {metric: cpuUtilizationPercent, operator: GreaterThan, value: 90}
                    """));

            assertThat(rule.getConditions().get(0).getDuration())
                    .isEqualTo(guardianEngineConfig.getDefaultConditionDuration());
            assertThat(rule.getMonitoring().getCheckInterval())
                    .isEqualTo(guardianEngineConfig.getDefaultCheckInterval());
            assertThat(rule.isEnabled()).isTrue();
            assertThat(rule.getNodeSelector().isEmpty()).isTrue();
            assertThat(rule.hasRecovery()).isFalse();
        }

        @Test
        @DisplayName("disabled flag is carried through")
        void disabledRule() throws Exception {
            Rule rule = ruleDocumentMapper.toRule(document("""
                    metadata: {name: paused}
                    spec:
                      conditions:
                        - {metric: cpuUtilizationPercent, operator: GreaterThan, value: 90}
                      metadata: {enabled: false}
                    """));

            assertThat(rule.isEnabled()).isFalse();
        }

        @Test
        @DisplayName("ruleName reads metadata.name even from an invalid document")
        void ruleNameOfInvalidDocument() throws Exception {
            JsonNode invalid = document("metadata: {name: broken}\nspec: 42");

            assertThat(RuleDocumentMapper.ruleName(invalid)).isEqualTo("broken");
        }
    }

    @Nested
    @DisplayName("Rejection")
    class Rejection {

        @Test
        @DisplayName("all violations are reported together")
        void collectsViolations() throws Exception {
            JsonNode invalid = document("""
                    metadata: {name: Bad_Name}
                    spec:
                      conditions: []
                      monitoring: {checkInterval: 0s}
                    """);

            assertThatThrownBy(() -> ruleDocumentMapper.toRule(invalid))
                    .isInstanceOf(ConfigException.class)
                    .satisfies(e -> {
                        ConfigException ce = (ConfigException) e;
                        assertThat(ce.getErrorCode()).isEqualTo(ErrorCode.CONFIG_ERROR);
                        assertThat(ce.getDetails()).containsEntry("rule", "Bad_Name");
                        assertThat((List<?>) ce.getDetails().get("violations")).hasSizeGreaterThanOrEqualTo(3);
                    });
        }

        @Test
        @DisplayName("unknown metric, operator or action type is a config error")
        void unknownEnums() {
            assertThatThrownBy(() -> ruleDocumentMapper.toRule(document("""
                            metadata: {name: r}
                            spec:
                              conditions:
                                - {metric: gpuTemperature, operator: GreaterThan, value: 1}
                            """)))
                    .isInstanceOf(ConfigException.class)
                    .hasMessageContaining("gpuTemperature");
            assertThatThrownBy(() -> ruleDocumentMapper.toRule(document("""
                            metadata: {name: r}
                            spec:
                              conditions:
                                - {metric: cpuUtilizationPercent, operator: GreaterThan, value: 1}
                              actions:
                                - {type: reboot}
                            """)))
                    .isInstanceOf(ConfigException.class)
                    .hasMessageContaining("reboot");
        }

        @Test
        @DisplayName("document without spec is rejected")
        void missingSpec() throws Exception {
            JsonNode noSpec = document("metadata: {name: r}");

            assertThatThrownBy(() -> ruleDocumentMapper.toRule(noSpec))
                    .isInstanceOf(ConfigException.class)
                    .hasMessageContaining("no spec");
        }

        @Test
        @DisplayName("invalid taint effect is rejected")
        void invalidTaintEffect() throws Exception {
            JsonNode doc = document("""
                    metadata: {name: r}
                    spec:
                      conditions:
                        - {metric: cpuUtilizationPercent, operator: GreaterThan, value: 1}
                      actions:
                        - {type: taint, taint: {key: k, effect: Sometimes}}
                    """);

            assertThatThrownBy(() -> ruleDocumentMapper.toRule(doc))
                    .isInstanceOf(ConfigException.class)
                    .hasMessageContaining("taint");
        }
    }
}
