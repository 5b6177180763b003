package com.nodeguardian.notification;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nodeguardian.config.RuleSourceConfig;
import com.nodeguardian.domain.enums.AlertSeverity;
import com.nodeguardian.domain.enums.AlertType;
import com.nodeguardian.domain.enums.ChannelType;
import com.nodeguardian.exception.ConfigException;
import com.nodeguardian.rule.DocumentReader;
import com.nodeguardian.rule.DocumentReader.SourcedDocument;
import jakarta.annotation.PostConstruct;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Named alert templates: the two built-ins plus any loaded from {@code nodeguardian.rules.templates-path}.
 *
 * <p>Template documents look like {@code {metadata: {name}, spec: {title, summary, description,
 * severity, channels}}}; {@code subject} and {@code body} are accepted as aliases of title and
 * description. A loaded template may replace a built-in; unregistering a built-in restores it.
 */
@Component
public class AlertTemplateRegistry {

    private static final Logger log = LoggerFactory.getLogger(AlertTemplateRegistry.class);

    public static final String DEFAULT_TEMPLATE = "default";
    public static final String RECOVERY_TEMPLATE = "recovery";

    private final DocumentReader documentReader;
    private final ObjectMapper objectMapper;
    private final RuleSourceConfig ruleSourceConfig;

    private final Map<String, AlertTemplate> templates = new ConcurrentHashMap<>();

    public AlertTemplateRegistry(
            DocumentReader documentReader, ObjectMapper objectMapper, RuleSourceConfig ruleSourceConfig) {
        this.documentReader = documentReader;
        this.objectMapper = objectMapper;
        this.ruleSourceConfig = ruleSourceConfig;
        registerBuiltIns();
    }

    @PostConstruct
    public void loadConfiguredTemplates() {
        String path = ruleSourceConfig.getTemplatesPath();
        if (path == null || path.isBlank()) {
            return;
        }
        int loaded = 0;
        for (SourcedDocument document : documentReader.readDirectory(Path.of(path))) {
            try {
                register(fromDocument(document.content()));
                loaded++;
            } catch (ConfigException e) {
                log.error("Rejected alert template in {}: {}", document.source(), e.getMessage());
            }
        }
        log.info("Loaded {} alert templates from {}", loaded, path);
    }

    public void register(AlertTemplate template) {
        if (template.getName() == null || template.getName().isBlank()) {
            throw new ConfigException("Alert template must have a name");
        }
        templates.put(template.getName(), template);
        log.info("Alert template registered: {}", template.getName());
    }

    public void unregister(String name) {
        templates.remove(name);
        if (DEFAULT_TEMPLATE.equals(name) || RECOVERY_TEMPLATE.equals(name)) {
            registerBuiltIns();
        }
        log.info("Alert template unregistered: {}", name);
    }

    public Optional<AlertTemplate> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(templates.get(name));
    }

    /** The requested template, or the built-in default for the alert's kind when it is unknown. */
    public AlertTemplate resolve(String name, AlertType alertType) {
        String fallback = alertType == AlertType.RECOVERY ? RECOVERY_TEMPLATE : DEFAULT_TEMPLATE;
        if (name == null || name.isBlank()) {
            return templates.get(fallback);
        }
        AlertTemplate template = templates.get(name);
        if (template == null) {
            log.warn("Alert template {} not found, using {}", name, fallback);
            return templates.get(fallback);
        }
        return template;
    }

    public AlertTemplate fromDocument(JsonNode document) {
        String name = document.path("metadata").path("name").asText(null);
        JsonNode spec = document.has("spec") ? document.get("spec") : document;
        if (name == null) {
            name = spec.path("name").asText(null);
        }
        if (name == null || name.isBlank()) {
            throw new ConfigException("Alert template must have metadata.name");
        }
        if (!spec.isObject()) {
            throw new ConfigException("Alert template " + name + " has no spec object");
        }

        ObjectNode normalized = ((ObjectNode) spec).deepCopy();
        if (!normalized.has("title") && normalized.has("subject")) {
            normalized.set("title", normalized.get("subject"));
        }
        if (!normalized.has("description") && normalized.has("body")) {
            normalized.set("description", normalized.get("body"));
        }
        normalized.remove(List.of("subject", "body", "name"));

        try {
            AlertTemplate template = objectMapper.treeToValue(normalized, AlertTemplate.class);
            template.setName(name);
            if (template.getChannels() == null) {
                template.setChannels(new ArrayList<>());
            }
            return template;
        } catch (Exception e) {
            throw new ConfigException("Alert template " + name + " is invalid: " + e.getMessage(), e);
        }
    }

    private void registerBuiltIns() {
        templates.putIfAbsent(
                DEFAULT_TEMPLATE,
                AlertTemplate.builder()
                        .name(DEFAULT_TEMPLATE)
                        .title("[NodeGuardian] Node alert - {{ ruleName }}")
                        .summary("Rule {{ ruleName }} triggered on {{ nodeCount }} node(s): {{ triggeredNodes }}")
                        .description("Rule: {{ ruleName }}\n"
                                + "Description: {{ ruleDescription }}\n"
                                + "Nodes: {{ triggeredNodes }}\n"
                                + "Time: {{ timestamp }}")
                        .severity(AlertSeverity.WARNING)
                        .channels(new ArrayList<>(List.of(ChannelConfig.of(ChannelType.LOG))))
                        .build());
        templates.putIfAbsent(
                RECOVERY_TEMPLATE,
                AlertTemplate.builder()
                        .name(RECOVERY_TEMPLATE)
                        .title("[NodeGuardian] Node recovered - {{ ruleName }}")
                        .summary("Rule {{ ruleName }} recovered on {{ nodeCount }} node(s): {{ triggeredNodes }}")
                        .description("Rule: {{ ruleName }}\n"
                                + "Recovered nodes: {{ triggeredNodes }}\n"
                                + "Time: {{ timestamp }}")
                        .severity(AlertSeverity.INFO)
                        .channels(new ArrayList<>(List.of(ChannelConfig.of(ChannelType.LOG))))
                        .build());
    }
}
