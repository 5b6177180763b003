package com.nodeguardian.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nodeguardian.domain.enums.TaintEffect;
import com.nodeguardian.domain.model.NodeSelectorSpec;
import com.nodeguardian.domain.model.PodRef;
import com.nodeguardian.exception.ActionExecutionException;
import com.nodeguardian.exception.NodeSelectorException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Kubernetes REST API adapter: node listing, node mutations, pod eviction, node metrics and the
 * NodeGuardianRule custom resources with their status.
 *
 * <p>Labels and annotations are changed with JSON merge patches, where a {@code null} value
 * deletes the key, so both upsert and removal are idempotent. Taints are a list, which a merge
 * patch replaces as a whole; they are changed read-modify-write, keyed by (key, effect).
 */
@Component
public class KubernetesApiClient implements NodeSelectorClient, NodeControlClient {

    private static final Logger log = LoggerFactory.getLogger(KubernetesApiClient.class);

    private static final MediaType MERGE_PATCH = MediaType.parseMediaType("application/merge-patch+json");

    private final RestTemplate kubernetesRestTemplate;
    private final KubernetesConfig kubernetesConfig;
    private final ObjectMapper objectMapper;

    public KubernetesApiClient(
            @Qualifier("kubernetesRestTemplate") RestTemplate kubernetesRestTemplate,
            KubernetesConfig kubernetesConfig,
            ObjectMapper objectMapper) {
        this.kubernetesRestTemplate = kubernetesRestTemplate;
        this.kubernetesConfig = kubernetesConfig;
        this.objectMapper = objectMapper;
    }

    // ========================
    // NODE SELECTION
    // ========================

    /** Explicit node names are returned as given; otherwise nodes are listed by label selector. */
    @Override
    public List<String> resolve(NodeSelectorSpec selector) {
        if (selector.hasNodeNames()) {
            return selector.getNodeNames();
        }
        JsonNode list;
        try {
            String labelSelector = selector.toLabelSelector();
            list = labelSelector.isEmpty()
                    ? kubernetesRestTemplate.getForObject("/api/v1/nodes", JsonNode.class)
                    : kubernetesRestTemplate.getForObject(
                            "/api/v1/nodes?labelSelector={selector}", JsonNode.class, labelSelector);
        } catch (RestClientException e) {
            throw new NodeSelectorException("Cannot list nodes: " + e.getMessage(), e);
        }
        return names(list);
    }

    // ========================
    // NODE MUTATIONS
    // ========================

    @Override
    public void taint(String nodeName, String key, String value, TaintEffect effect) {
        List<JsonNode> taints = currentTaints(nodeName);
        ArrayNode updated = objectMapper.createArrayNode();
        for (JsonNode taint : taints) {
            if (!(key.equals(taint.path("key").asText()) && effect.getApiName().equals(taint.path("effect").asText()))) {
                updated.add(taint);
            }
        }
        ObjectNode taint = updated.addObject();
        taint.put("key", key);
        taint.put("value", value);
        taint.put("effect", effect.getApiName());

        patchTaints(nodeName, updated);
        log.info("Node {} tainted {}={}:{}", nodeName, key, value, effect.getApiName());
    }

    /** Removes every taint with {@code key}, whatever its effect. */
    @Override
    public void untaint(String nodeName, String key) {
        List<JsonNode> taints = currentTaints(nodeName);
        ArrayNode updated = objectMapper.createArrayNode();
        taints.stream().filter(taint -> !key.equals(taint.path("key").asText())).forEach(updated::add);
        if (updated.size() == taints.size()) {
            log.debug("Node {} has no taint {}", nodeName, key);
            return;
        }
        patchTaints(nodeName, updated);
        log.info("Node {} untainted {}", nodeName, key);
    }

    @Override
    public void label(String nodeName, Map<String, String> labels) {
        patchMetadata(nodeName, "labels", labels, List.of());
        log.info("Node {} labeled {}", nodeName, labels);
    }

    @Override
    public void removeLabels(String nodeName, Collection<String> keys) {
        patchMetadata(nodeName, "labels", Map.of(), keys);
        log.info("Node {} labels removed {}", nodeName, keys);
    }

    @Override
    public void annotate(String nodeName, Map<String, String> annotations) {
        patchMetadata(nodeName, "annotations", annotations, List.of());
        log.info("Node {} annotated {}", nodeName, annotations.keySet());
    }

    @Override
    public void removeAnnotations(String nodeName, Collection<String> keys) {
        patchMetadata(nodeName, "annotations", Map.of(), keys);
        log.info("Node {} annotations removed {}", nodeName, keys);
    }

    // ========================
    // NODE STATUS & METRICS
    // ========================

    /**
     * The node object, for its {@code status.capacity} and {@code status.conditions}.
     *
     * @throws RestClientException when the API server cannot be reached or rejects the request
     */
    public JsonNode getNode(String nodeName) {
        JsonNode node = kubernetesRestTemplate.getForObject("/api/v1/nodes/{name}", JsonNode.class, nodeName);
        return node != null ? node : objectMapper.createObjectNode();
    }

    /**
     * Current usage of the node as reported by the Metrics Server ({@code usage.cpu},
     * {@code usage.memory}).
     *
     * @throws RestClientException when the metrics API is not served or has no sample yet
     */
    public JsonNode getNodeMetrics(String nodeName) {
        JsonNode metrics = kubernetesRestTemplate.getForObject(
                "/apis/metrics.k8s.io/v1beta1/nodes/{name}", JsonNode.class, nodeName);
        return metrics != null ? metrics : objectMapper.createObjectNode();
    }

    // ========================
    // PODS
    // ========================

    @Override
    public List<PodRef> listPods(String nodeName, Collection<String> excludeNamespaces) {
        JsonNode list;
        try {
            list = kubernetesRestTemplate.getForObject(
                    "/api/v1/pods?fieldSelector={selector}", JsonNode.class, "spec.nodeName=" + nodeName);
        } catch (RestClientException e) {
            throw new ActionExecutionException("Cannot list pods on node " + nodeName + ": " + e.getMessage(), e);
        }

        Set<String> excluded = Set.copyOf(excludeNamespaces);
        List<PodRef> pods = new ArrayList<>();
        if (list != null) {
            for (JsonNode item : list.path("items")) {
                JsonNode metadata = item.path("metadata");
                String namespace = metadata.path("namespace").asText();
                // already terminating
                if (excluded.contains(namespace) || metadata.hasNonNull("deletionTimestamp")) {
                    continue;
                }
                pods.add(new PodRef(namespace, metadata.path("name").asText()));
            }
        }
        return pods;
    }

    /** Evicts through the Eviction subresource so PodDisruptionBudgets are honored. */
    @Override
    public void evictPod(PodRef pod) {
        ObjectNode eviction = objectMapper.createObjectNode();
        eviction.put("apiVersion", "policy/v1");
        eviction.put("kind", "Eviction");
        eviction.putObject("metadata").put("name", pod.name()).put("namespace", pod.namespace());
        eviction.putObject("deleteOptions").put("gracePeriodSeconds", kubernetesConfig.getEvictionGracePeriodSeconds());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            kubernetesRestTemplate.postForObject(
                    "/api/v1/namespaces/{namespace}/pods/{name}/eviction",
                    new HttpEntity<>(eviction, headers),
                    JsonNode.class,
                    pod.namespace(),
                    pod.name());
            log.info("Evicted pod {}", pod);
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("Pod {} already gone", pod);
        } catch (RestClientException e) {
            throw new ActionExecutionException("Cannot evict pod " + pod + ": " + e.getMessage(), e);
        }
    }

    // ========================
    // RULE RESOURCES
    // ========================

    /** All cluster-scoped NodeGuardianRule objects, as raw documents. */
    public List<JsonNode> listRuleDocuments() {
        JsonNode list = kubernetesRestTemplate.getForObject(
                "/apis/{group}/{version}/{plural}",
                JsonNode.class,
                kubernetesConfig.getRuleGroup(),
                kubernetesConfig.getRuleVersion(),
                kubernetesConfig.getRulePlural());
        List<JsonNode> items = new ArrayList<>();
        if (list != null) {
            list.path("items").forEach(items::add);
        }
        return items;
    }

    /**
     * Replaces the {@code status} of a NodeGuardianRule through its status subresource.
     *
     * @throws RestClientException when the resource is gone or the patch is rejected
     */
    public void patchRuleStatus(String ruleName, ObjectNode status) {
        ObjectNode patch = objectMapper.createObjectNode();
        patch.set("status", status);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MERGE_PATCH);
        kubernetesRestTemplate.exchange(
                "/apis/{group}/{version}/{plural}/{name}/status",
                HttpMethod.PATCH,
                new HttpEntity<>(patch, headers),
                JsonNode.class,
                kubernetesConfig.getRuleGroup(),
                kubernetesConfig.getRuleVersion(),
                kubernetesConfig.getRulePlural(),
                ruleName);
    }

    private List<JsonNode> currentTaints(String nodeName) {
        JsonNode node;
        try {
            node = getNode(nodeName);
        } catch (RestClientException e) {
            throw new ActionExecutionException("Cannot read node " + nodeName + ": " + e.getMessage(), e);
        }
        List<JsonNode> taints = new ArrayList<>();
        node.path("spec").path("taints").forEach(taints::add);
        return taints;
    }

    private void patchTaints(String nodeName, ArrayNode taints) {
        ObjectNode patch = objectMapper.createObjectNode();
        patch.putObject("spec").set("taints", taints);
        patchNode(nodeName, patch);
    }

    private void patchMetadata(String nodeName, String field, Map<String, String> upserts, Collection<String> removals) {
        ObjectNode patch = objectMapper.createObjectNode();
        ObjectNode entries = patch.putObject("metadata").putObject(field);
        upserts.forEach(entries::put);
        removals.forEach(entries::putNull);
        patchNode(nodeName, patch);
    }

    private void patchNode(String nodeName, ObjectNode patch) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MERGE_PATCH);
        try {
            kubernetesRestTemplate.exchange(
                    "/api/v1/nodes/{name}", HttpMethod.PATCH, new HttpEntity<>(patch, headers), JsonNode.class, nodeName);
        } catch (RestClientException e) {
            throw new ActionExecutionException("Cannot patch node " + nodeName + ": " + e.getMessage(), e);
        }
    }

    private static List<String> names(JsonNode list) {
        List<String> names = new ArrayList<>();
        if (list != null) {
            list.path("items").forEach(item -> names.add(item.path("metadata").path("name").asText()));
        }
        return names;
    }
}
