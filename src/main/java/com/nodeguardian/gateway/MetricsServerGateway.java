package com.nodeguardian.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.nodeguardian.domain.enums.MetricKind;
import com.nodeguardian.exception.MetricUnavailableException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

/**
 * {@link MetricsGateway} over what the Kubernetes API itself knows about a node.
 *
 * <p>CPU and memory utilization are the Metrics Server usage as a percentage of the node's
 * {@code status.capacity}. Disk utilization is only coarse: the configured
 * {@code disk-pressure-percent} while the node's {@code DiskPressure} condition is True, zero
 * while it is False. Load ratio is not available here.
 */
@Component
public class MetricsServerGateway implements MetricsGateway {

    private static final Logger log = LoggerFactory.getLogger(MetricsServerGateway.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final KubernetesApiClient kubernetesApiClient;
    private final MetricsServerConfig metricsServerConfig;

    public MetricsServerGateway(KubernetesApiClient kubernetesApiClient, MetricsServerConfig metricsServerConfig) {
        this.kubernetesApiClient = kubernetesApiClient;
        this.metricsServerConfig = metricsServerConfig;
    }

    @Override
    public BigDecimal get(String nodeName, MetricKind metric) {
        if (!metricsServerConfig.isEnabled()) {
            throw new MetricUnavailableException(nodeName, metric, "Metrics Server fallback disabled");
        }
        try {
            BigDecimal value = switch (metric) {
                case CPU_UTILIZATION_PERCENT -> utilization(nodeName, metric, "cpu");
                case MEMORY_UTILIZATION_PERCENT -> utilization(nodeName, metric, "memory");
                case DISK_UTILIZATION_PERCENT -> diskPressure(nodeName, metric);
                case CPU_LOAD_RATIO -> throw new MetricUnavailableException(
                        nodeName, metric, "not provided by the Metrics Server");
            };
            log.debug("{} on {} = {} (Metrics Server)", metric.getDocumentName(), nodeName, value);
            return value;
        } catch (RestClientException e) {
            throw new MetricUnavailableException(nodeName, metric, e);
        }
    }

    private BigDecimal utilization(String nodeName, MetricKind metric, String resource) {
        String usage = kubernetesApiClient.getNodeMetrics(nodeName).path("usage").path(resource).asText(null);
        String capacity = kubernetesApiClient
                .getNode(nodeName)
                .path("status")
                .path("capacity")
                .path(resource)
                .asText(null);
        if (usage == null || capacity == null) {
            throw new MetricUnavailableException(
                    nodeName, metric, "no " + resource + (usage == null ? " usage" : " capacity") + " reported");
        }
        try {
            BigDecimal used = KubernetesQuantity.parse(usage);
            BigDecimal total = KubernetesQuantity.parse(capacity);
            if (total.signum() <= 0) {
                throw new MetricUnavailableException(nodeName, metric, resource + " capacity is " + capacity);
            }
            return used.multiply(HUNDRED).divide(total, 2, RoundingMode.HALF_UP);
        } catch (NumberFormatException e) {
            throw new MetricUnavailableException(nodeName, metric, e.getMessage());
        }
    }

    private BigDecimal diskPressure(String nodeName, MetricKind metric) {
        for (JsonNode condition : kubernetesApiClient.getNode(nodeName).path("status").path("conditions")) {
            if (!"DiskPressure".equals(condition.path("type").asText())) {
                continue;
            }
            String status = condition.path("status").asText();
            if ("True".equals(status)) {
                return metricsServerConfig.getDiskPressurePercent();
            }
            if ("False".equals(status)) {
                return BigDecimal.ZERO;
            }
            throw new MetricUnavailableException(nodeName, metric, "DiskPressure condition is " + status);
        }
        throw new MetricUnavailableException(nodeName, metric, "no DiskPressure condition");
    }
}
