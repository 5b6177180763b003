package com.nodeguardian.action;

import com.nodeguardian.domain.model.PodRef;
import com.nodeguardian.exception.ActionExecutionException;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evicts up to {@code maxPods} pods scheduled on the node, skipping excluded namespaces.
 *
 * <p>Not idempotent: every firing evicts a fresh batch, so the effect is bounded per invocation.
 * One pod failing to evict does not stop the others; the action fails afterwards if any did.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvictAction implements NodeAction {

    private static final Logger log = LoggerFactory.getLogger(EvictAction.class);

    public static final int DEFAULT_MAX_PODS = 10;

    private Integer maxPods;
    private List<String> excludeNamespaces;

    @Override
    public void execute(ActionContext context) {
        List<String> excluded = excludeNamespaces != null ? excludeNamespaces : context.defaultExcludeNamespaces();
        List<PodRef> pods = context.nodeControl().listPods(context.nodeName(), excluded);
        List<PodRef> batch = pods.subList(0, Math.min(effectiveMaxPods(), pods.size()));

        int evicted = 0;
        List<String> failures = new ArrayList<>();
        for (PodRef pod : batch) {
            try {
                context.nodeControl().evictPod(pod);
                evicted++;
            } catch (Exception e) {
                log.error("Failed to evict pod {} from node {}: {}", pod, context.nodeName(), e.getMessage());
                failures.add(pod + ": " + e.getMessage());
            }
        }

        log.info("Evicted {}/{} pods from node {} (candidates={})", evicted, batch.size(), context.nodeName(), pods.size());
        if (!failures.isEmpty()) {
            throw new ActionExecutionException(
                    "Evicted " + evicted + " of " + batch.size() + " pods from " + context.nodeName() + ", failed: "
                            + failures);
        }
    }

    public int effectiveMaxPods() {
        return maxPods != null && maxPods >= 0 ? maxPods : DEFAULT_MAX_PODS;
    }

    @Override
    public String getTypeName() {
        return "evict";
    }
}
