package com.nodeguardian.domain.model;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Which nodes a rule watches.
 *
 * <p>Explicit {@code nodeNames} take precedence and are returned as-is. Otherwise
 * {@code matchLabels} is used as an equality label selector. An empty selector matches every node.
 */
@Value
@Builder
public class NodeSelectorSpec {

    @Builder.Default
    List<String> nodeNames = List.of();

    @Builder.Default
    Map<String, String> matchLabels = Map.of();

    public static NodeSelectorSpec all() {
        return NodeSelectorSpec.builder().build();
    }

    public boolean hasNodeNames() {
        return nodeNames != null && !nodeNames.isEmpty();
    }

    public boolean isEmpty() {
        return !hasNodeNames() && (matchLabels == null || matchLabels.isEmpty());
    }

    /** Renders matchLabels as a Kubernetes label selector string ({@code a=b,c=d}). */
    public String toLabelSelector() {
        if (matchLabels == null || matchLabels.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        matchLabels.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> {
                    if (sb.length() > 0) {
                        sb.append(',');
                    }
                    sb.append(e.getKey()).append('=').append(e.getValue());
                });
        return sb.toString();
    }
}
