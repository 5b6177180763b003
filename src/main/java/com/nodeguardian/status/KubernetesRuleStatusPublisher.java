package com.nodeguardian.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nodeguardian.domain.enums.RulePhase;
import com.nodeguardian.gateway.KubernetesApiClient;
import java.time.Instant;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;

/**
 * Writes rule status back to the NodeGuardianRule resource it came from, when rules are read
 * from the cluster.
 *
 * <p>The patch runs on the {@code ioExecutor} so the caller never waits on the API server. A
 * removed rule is marked {@code Inactive}; if its resource is already gone the 404 is ignored.
 */
@Component
@ConditionalOnProperty(name = "nodeguardian.rules.source", havingValue = "kubernetes")
public class KubernetesRuleStatusPublisher implements StatusPublisher {

    private static final Logger log = LoggerFactory.getLogger(KubernetesRuleStatusPublisher.class);

    private final KubernetesApiClient kubernetesApiClient;
    private final ObjectMapper objectMapper;
    private final Executor ioExecutor;

    public KubernetesRuleStatusPublisher(
            KubernetesApiClient kubernetesApiClient,
            ObjectMapper objectMapper,
            @Qualifier("ioExecutor") Executor ioExecutor) {
        this.kubernetesApiClient = kubernetesApiClient;
        this.objectMapper = objectMapper;
        this.ioExecutor = ioExecutor;
    }

    @Override
    public void publish(RuleStatus status) {
        ObjectNode body = toResourceStatus(status);
        try {
            ioExecutor.execute(() -> patch(status.getRuleId(), body));
        } catch (RejectedExecutionException e) {
            log.warn("Status of rule {} not written to its resource: I/O executor saturated", status.getRuleId());
        }
    }

    private ObjectNode toResourceStatus(RuleStatus status) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("phase", status.isRemoved() ? "Inactive" : phaseName(status.getPhase()));
        putInstant(body, "lastTriggered", status.getLastTriggeredAt());
        putInstant(body, "lastRecovered", status.getLastRecoveredAt());
        ArrayNode nodes = body.putArray("triggeredNodes");
        if (!status.isRemoved()) {
            status.getTriggeredNodes().forEach(nodes::add);
        }
        if (status.getLastError() != null) {
            body.put("lastError", status.getLastError());
        } else {
            body.putNull("lastError");
        }
        putInstant(body, "lastUpdate", status.getUpdatedAt());
        return body;
    }

    private void patch(String ruleId, ObjectNode body) {
        try {
            kubernetesApiClient.patchRuleStatus(ruleId, body);
            log.debug("Status of rule {} written to its resource: {}", ruleId, body.path("phase").asText());
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("Resource of rule {} is gone, status not written", ruleId);
        } catch (RestClientException e) {
            log.warn("Status of rule {} not written to its resource: {}", ruleId, e.getMessage());
        }
    }

    private static String phaseName(RulePhase phase) {
        return phase == RulePhase.TRIGGERED ? "Triggered" : "Idle";
    }

    private static void putInstant(ObjectNode body, String field, Instant instant) {
        if (instant != null) {
            body.put(field, instant.toString());
        }
    }
}
