package com.nodeguardian.rule;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nodeguardian.action.NodeAction;
import com.nodeguardian.domain.enums.ComparisonOperator;
import com.nodeguardian.domain.enums.ConditionLogic;
import com.nodeguardian.domain.enums.MetricKind;
import com.nodeguardian.domain.model.Condition;
import com.nodeguardian.domain.model.MonitoringSpec;
import com.nodeguardian.domain.model.NodeSelectorSpec;
import com.nodeguardian.domain.model.Rule;
import com.nodeguardian.domain.model.RuleMetadata;
import com.nodeguardian.engine.GuardianEngineConfig;
import com.nodeguardian.exception.ConfigException;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Maps a rule document to an immutable {@link Rule}.
 *
 * <p>Document shape:
 * <pre>
 * metadata: {name}
 * spec:
 *   conditions: [{metric, operator, value, duration, description}]
 *   conditionLogic: AND | OR
 *   nodeSelector: {nodeNames: [...]} | {matchLabels: {...}}
 *   actions: [{type: taint, taint: {key, value, effect}}, ...]
 *   recoveryConditions / recoveryConditionLogic / recoveryActions
 *   monitoring: {checkInterval, cooldownPeriod, recoveryCooldownPeriod}
 *   metadata: {enabled, priority, description}
 * </pre>
 *
 * <p>An action's settings may sit under a key named after its type or directly next to
 * {@code type}. Missing durations fall back to the engine defaults. Any violation raises a
 * {@link ConfigException} listing all of them.
 */
@Component
public class RuleDocumentMapper {

    private static final Map<String, String> ACTION_TYPES = new LinkedHashMap<>();

    static {
        for (String type : List.of(
                "taint", "untaint", "label", "removeLabel", "annotation", "removeAnnotation", "evict", "alert")) {
            ACTION_TYPES.put(normalize(type), type);
        }
    }

    private final ObjectMapper objectMapper;
    private final GuardianEngineConfig guardianEngineConfig;
    private final RuleValidator ruleValidator;

    public RuleDocumentMapper(
            ObjectMapper objectMapper, GuardianEngineConfig guardianEngineConfig, RuleValidator ruleValidator) {
        this.objectMapper = objectMapper;
        this.guardianEngineConfig = guardianEngineConfig;
        this.ruleValidator = ruleValidator;
    }

    /** Reads only {@code metadata.name}, so a rejected document can still be attributed. */
    public static String ruleName(JsonNode document) {
        JsonNode name = document == null ? null : document.path("metadata").get("name");
        return name != null && name.isTextual() ? name.asText() : null;
    }

    public Rule toRule(JsonNode document) {
        if (document == null || !document.isObject()) {
            throw new ConfigException("Rule document must be an object");
        }
        String name = ruleName(document);
        JsonNode spec = document.get("spec");
        if (spec == null || !spec.isObject()) {
            throw new ConfigException("Rule " + name + " has no spec", Map.of("rule", String.valueOf(name)));
        }

        Rule rule;
        try {
            JsonNode metadata = spec.path("metadata");
            rule = Rule.builder()
                    .id(name)
                    .conditions(conditions(spec.get("conditions"), "spec.conditions"))
                    .conditionLogic(logic(spec.get("conditionLogic")))
                    .nodeSelector(nodeSelector(spec.get("nodeSelector")))
                    .actions(actions(spec.get("actions"), "spec.actions"))
                    .recoveryConditions(conditions(spec.get("recoveryConditions"), "spec.recoveryConditions"))
                    .recoveryConditionLogic(logic(spec.get("recoveryConditionLogic")))
                    .recoveryActions(actions(spec.get("recoveryActions"), "spec.recoveryActions"))
                    .monitoring(monitoring(spec.path("monitoring")))
                    .metadata(RuleMetadata.builder()
                            .enabled(metadata.path("enabled").asBoolean(true))
                            .priority(metadata.path("priority").asInt(RuleMetadata.DEFAULT_PRIORITY))
                            .description(text(metadata, "description"))
                            .build())
                    .build();
        } catch (ConfigException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ConfigException("Rule " + name + ": " + e.getMessage(), e);
        }

        List<String> violations = ruleValidator.validate(rule);
        if (!violations.isEmpty()) {
            throw new ConfigException(
                    "Rule " + name + " is invalid: " + String.join("; ", violations),
                    Map.of("rule", String.valueOf(name), "violations", violations));
        }
        return rule;
    }

    private List<Condition> conditions(JsonNode node, String path) {
        List<Condition> conditions = new ArrayList<>();
        if (node == null || node.isNull()) {
            return conditions;
        }
        if (!node.isArray()) {
            throw new ConfigException(path + " must be a list");
        }
        for (int i = 0; i < node.size(); i++) {
            JsonNode item = node.get(i);
            String at = path + "[" + i + "]";
            JsonNode value = item.has("value") ? item.get("value") : item.get("threshold");
            conditions.add(Condition.builder()
                    .metric(item.hasNonNull("metric") ? MetricKind.fromValue(item.get("metric").asText()) : null)
                    .operator(
                            item.hasNonNull("operator")
                                    ? ComparisonOperator.fromValue(item.get("operator").asText())
                                    : null)
                    .threshold(decimal(value, at + ".value"))
                    .duration(DurationParser.parse(
                            text(item, "duration"), guardianEngineConfig.getDefaultConditionDuration()))
                    .description(text(item, "description"))
                    .build());
        }
        return conditions;
    }

    private List<NodeAction> actions(JsonNode node, String path) {
        List<NodeAction> actions = new ArrayList<>();
        if (node == null || node.isNull()) {
            return actions;
        }
        if (!node.isArray()) {
            throw new ConfigException(path + " must be a list");
        }
        for (int i = 0; i < node.size(); i++) {
            actions.add(action(node.get(i), path + "[" + i + "]"));
        }
        return actions;
    }

    private NodeAction action(JsonNode item, String at) {
        String rawType = text(item, "type");
        if (rawType == null) {
            throw new ConfigException(at + ".type is required");
        }
        String type = ACTION_TYPES.get(normalize(rawType));
        if (type == null) {
            throw new ConfigException(at + ": unknown action type '" + rawType + "'");
        }

        ObjectNode flattened = objectMapper.createObjectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = item.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getKey().equals("type") && !field.getKey().equals(rawType) && !field.getKey().equals(type)) {
                flattened.set(field.getKey(), field.getValue());
            }
        }
        JsonNode nested = item.has(rawType) ? item.get(rawType) : item.get(type);
        if (nested != null && nested.isObject()) {
            flattened.setAll((ObjectNode) nested);
        }
        flattened.put("type", type);

        try {
            return objectMapper.treeToValue(flattened, NodeAction.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ConfigException(at + " (" + type + ") is invalid: " + e.getMessage(), e);
        }
    }

    private NodeSelectorSpec nodeSelector(JsonNode node) {
        if (node == null || node.isNull()) {
            return NodeSelectorSpec.all();
        }
        List<String> nodeNames = new ArrayList<>();
        node.path("nodeNames").forEach(n -> nodeNames.add(n.asText()));
        Map<String, String> matchLabels = new LinkedHashMap<>();
        node.path("matchLabels").fields().forEachRemaining(e -> matchLabels.put(e.getKey(), e.getValue().asText()));
        return NodeSelectorSpec.builder()
                .nodeNames(List.copyOf(nodeNames))
                .matchLabels(Map.copyOf(matchLabels))
                .build();
    }

    private MonitoringSpec monitoring(JsonNode node) {
        return MonitoringSpec.builder()
                .checkInterval(
                        DurationParser.parse(text(node, "checkInterval"), guardianEngineConfig.getDefaultCheckInterval()))
                .cooldownPeriod(DurationParser.parse(
                        text(node, "cooldownPeriod"), guardianEngineConfig.getDefaultCooldownPeriod()))
                .recoveryCooldownPeriod(DurationParser.parse(
                        text(node, "recoveryCooldownPeriod"),
                        guardianEngineConfig.getDefaultRecoveryCooldownPeriod()))
                .build();
    }

    private static ConditionLogic logic(JsonNode node) {
        if (node == null || node.isNull() || node.asText().isBlank()) {
            return ConditionLogic.AND;
        }
        try {
            return ConditionLogic.valueOf(node.asText().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Unknown condition logic: " + node.asText());
        }
    }

    private static BigDecimal decimal(JsonNode node, String at) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        try {
            return new BigDecimal(node.asText().trim());
        } catch (NumberFormatException e) {
            throw new ConfigException(at + " is not a number: " + node.asText());
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }

    private static String normalize(String type) {
        return type.replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
    }
}
