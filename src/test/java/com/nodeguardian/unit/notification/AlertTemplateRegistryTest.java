package com.nodeguardian.unit.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nodeguardian.config.RuleSourceConfig;
import com.nodeguardian.domain.enums.AlertSeverity;
import com.nodeguardian.domain.enums.AlertType;
import com.nodeguardian.domain.enums.ChannelType;
import com.nodeguardian.exception.ConfigException;
import com.nodeguardian.notification.AlertTemplate;
import com.nodeguardian.notification.AlertTemplateRegistry;
import com.nodeguardian.notification.ChannelConfig;
import com.nodeguardian.rule.DocumentReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

class AlertTemplateRegistryTest {

    @TempDir
    Path templatesDir;

    private ObjectMapper objectMapper;
    private RuleSourceConfig ruleSourceConfig;
    private AlertTemplateRegistry alertTemplateRegistry;

    @BeforeEach
    void setUp() {
        objectMapper = Jackson2ObjectMapperBuilder.json().build();
        ruleSourceConfig = new RuleSourceConfig();
        alertTemplateRegistry =
                new AlertTemplateRegistry(new DocumentReader(objectMapper), objectMapper, ruleSourceConfig);
    }

    @Test
    @DisplayName("built-in templates exist for trigger and recovery")
    void builtIns() {
        assertThat(alertTemplateRegistry.resolve(null, AlertType.TRIGGER).getName()).isEqualTo("default");
        assertThat(alertTemplateRegistry.resolve(null, AlertType.RECOVERY).getName()).isEqualTo("recovery");
    }

    @Test
    @DisplayName("unknown template name falls back to the built-in of the alert kind")
    void unknownFallsBack() {
        assertThat(alertTemplateRegistry.resolve("nope", AlertType.RECOVERY).getName()).isEqualTo("recovery");
    }

    @Test
    @DisplayName("templates are loaded from the configured directory with subject/body aliases")
    void loadsFromDirectory() throws IOException {
        Files.writeString(templatesDir.resolve("disk.yaml"), """
                apiVersion: nodeguardian.k8s.io/v1
                kind: NodeGuardianAlertTemplate
                metadata:
                  name: disk-full
                spec:
                  subject: "Disk full on {{ triggeredNodes }}"
                  body: "Rule {{ ruleName }}"
                  severity: critical
                  channels:
                    - webhook
                    - type: log
                """);
        ruleSourceConfig.setTemplatesPath(templatesDir.toString());

        alertTemplateRegistry.loadConfiguredTemplates();

        AlertTemplate template = alertTemplateRegistry.find("disk-full").orElseThrow();
        assertThat(template.getTitle()).isEqualTo("Disk full on {{ triggeredNodes }}");
        assertThat(template.getDescription()).isEqualTo("Rule {{ ruleName }}");
        assertThat(template.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
        assertThat(template.getChannels())
                .containsExactly(ChannelConfig.of(ChannelType.WEBHOOK), ChannelConfig.of(ChannelType.LOG));
    }

    @Test
    @DisplayName("unregistering an overridden built-in restores the original")
    void unregisterRestoresBuiltIn() {
        alertTemplateRegistry.register(AlertTemplate.builder().name("default").title("custom").build());
        assertThat(alertTemplateRegistry.resolve(null, AlertType.TRIGGER).getTitle()).isEqualTo("custom");

        alertTemplateRegistry.unregister("default");

        assertThat(alertTemplateRegistry.resolve(null, AlertType.TRIGGER).getTitle()).contains("Node alert");
    }

    @Test
    @DisplayName("template without a name is rejected")
    void namelessRejected() {
        assertThatThrownBy(() -> alertTemplateRegistry.register(AlertTemplate.builder().title("x").build()))
                .isInstanceOf(ConfigException.class);
    }
}
