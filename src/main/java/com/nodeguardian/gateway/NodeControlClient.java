package com.nodeguardian.gateway;

import com.nodeguardian.domain.enums.TaintEffect;
import com.nodeguardian.domain.model.PodRef;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Node mutation primitives. Everything except {@link #evictPod} is an idempotent upsert or
 * removal; implementations throw {@link com.nodeguardian.exception.ActionExecutionException}
 * on failure.
 */
public interface NodeControlClient {

    void taint(String nodeName, String key, String value, TaintEffect effect);

    void untaint(String nodeName, String key);

    void label(String nodeName, Map<String, String> labels);

    void removeLabels(String nodeName, Collection<String> keys);

    void annotate(String nodeName, Map<String, String> annotations);

    void removeAnnotations(String nodeName, Collection<String> keys);

    /** Pods scheduled on the node, excluding the given namespaces. */
    List<PodRef> listPods(String nodeName, Collection<String> excludeNamespaces);

    void evictPod(PodRef pod);
}
