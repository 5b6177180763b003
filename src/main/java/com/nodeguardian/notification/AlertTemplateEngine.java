package com.nodeguardian.notification;

import com.nodeguardian.domain.enums.AlertSeverity;
import com.nodeguardian.domain.enums.AlertType;
import com.nodeguardian.domain.model.Rule;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Renders an {@link AlertTemplate} into an {@link AlertMessage}.
 *
 * <p>Placeholders are {@code {{ name }}} or {@code {{.name}}}. Names are matched ignoring case
 * and underscores, so {@code rule_name} and {@code ruleName} are the same variable. Available:
 * ruleName, ruleDescription, triggeredNodes (comma separated), nodeCount, timestamp (ISO-8601)
 * and alertType. Unknown placeholders are left as written.
 *
 * <p>Action batches run per (rule, node), so an alert action renders for the one node its batch
 * fired on: {@code triggeredNodes} is that node and {@code nodeCount} is 1. Ten nodes crossing a
 * threshold in the same tick produce ten alerts, each under its own node's cooldown.
 */
@Component
public class AlertTemplateEngine {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*\\.?([A-Za-z_][A-Za-z0-9_]*)\\s*}}");

    public AlertMessage render(AlertTemplate template, Rule rule, List<String> nodes, AlertType alertType, Instant now) {
        Map<String, String> variables = variables(rule, nodes, alertType, now);
        AlertSeverity severity = template.getSeverity() != null
                ? template.getSeverity()
                : (alertType == AlertType.RECOVERY ? AlertSeverity.INFO : AlertSeverity.WARNING);

        return AlertMessage.builder()
                .title(substitute(template.getTitle(), variables))
                .summary(substitute(template.getSummary(), variables))
                .description(substitute(template.getDescription(), variables))
                .severity(severity)
                .ruleName(rule.getId())
                .triggeredNodes(List.copyOf(nodes))
                .timestamp(now)
                .alertType(alertType)
                .templateName(template.getName())
                .templateChannels(template.getChannels() != null ? List.copyOf(template.getChannels()) : List.of())
                .build();
    }

    String substitute(String text, Map<String, String> variables) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String value = variables.get(normalize(matcher.group(1)));
            String replacement = value != null ? value : matcher.group();
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private Map<String, String> variables(Rule rule, List<String> nodes, AlertType alertType, Instant now) {
        Map<String, String> variables = new HashMap<>();
        variables.put(normalize("ruleName"), rule.getId());
        variables.put(normalize("ruleDescription"), rule.getDescription() != null ? rule.getDescription() : "");
        variables.put(normalize("triggeredNodes"), String.join(", ", nodes));
        variables.put(normalize("nodeCount"), String.valueOf(nodes.size()));
        variables.put(normalize("timestamp"), now.toString());
        variables.put(normalize("alertType"), alertType.toValue());
        return variables;
    }

    private static String normalize(String name) {
        return name.replace("_", "").toLowerCase(Locale.ROOT);
    }
}
