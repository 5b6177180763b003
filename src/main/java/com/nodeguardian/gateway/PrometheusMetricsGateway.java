package com.nodeguardian.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.nodeguardian.domain.enums.MetricKind;
import com.nodeguardian.exception.MetricUnavailableException;
import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * {@link MetricsGateway} backed by Prometheus instant queries over node-exporter series.
 *
 * <p>Series are matched to the node by {@code instance=~".*<node>.*"}. The first sample of the
 * result vector is the value. An empty vector, a non-numeric sample or a transport error is
 * reported as {@link MetricUnavailableException}.
 */
@Component
public class PrometheusMetricsGateway implements MetricsGateway {

    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsGateway.class);

    private static final String QUERY_PATH = "/api/v1/query?query={query}";

    private final RestTemplate prometheusRestTemplate;
    private final PrometheusConfig prometheusConfig;

    public PrometheusMetricsGateway(
            @Qualifier("prometheusRestTemplate") RestTemplate prometheusRestTemplate, PrometheusConfig prometheusConfig) {
        this.prometheusRestTemplate = prometheusRestTemplate;
        this.prometheusConfig = prometheusConfig;
    }

    @Override
    public BigDecimal get(String nodeName, MetricKind metric) {
        if (!prometheusConfig.isEnabled()) {
            throw new MetricUnavailableException(nodeName, metric, "Prometheus disabled");
        }
        String query = query(nodeName, metric);

        JsonNode response;
        try {
            response = prometheusRestTemplate.getForObject(QUERY_PATH, JsonNode.class, query);
        } catch (RestClientException e) {
            throw new MetricUnavailableException(nodeName, metric, e);
        }

        if (response == null || !"success".equals(response.path("status").asText())) {
            throw new MetricUnavailableException(
                    nodeName, metric, "query failed: " + (response == null ? "empty body" : response.path("error")));
        }
        JsonNode result = response.path("data").path("result");
        if (!result.isArray() || result.isEmpty()) {
            throw new MetricUnavailableException(nodeName, metric, "no series");
        }

        String sample = result.get(0).path("value").path(1).asText(null);
        if (sample == null) {
            throw new MetricUnavailableException(nodeName, metric, "series without sample");
        }
        try {
            BigDecimal value = new BigDecimal(sample);
            log.debug("{} on {} = {}", metric.getDocumentName(), nodeName, value);
            return value;
        } catch (NumberFormatException e) {
            throw new MetricUnavailableException(nodeName, metric, "non-numeric sample " + sample);
        }
    }

    static String query(String nodeName, MetricKind metric) {
        String instance = "instance=~\".*" + nodeName + ".*\"";
        return switch (metric) {
            case CPU_UTILIZATION_PERCENT -> "100 - (avg by (instance) (irate(node_cpu_seconds_total{mode=\"idle\","
                    + instance + "}[5m])) * 100)";
            case MEMORY_UTILIZATION_PERCENT -> "(1 - (node_memory_MemAvailable_bytes{" + instance
                    + "} / node_memory_MemTotal_bytes{" + instance + "})) * 100";
            case DISK_UTILIZATION_PERCENT -> "(1 - (node_filesystem_avail_bytes{" + instance
                    + ",mountpoint=\"/\"} / node_filesystem_size_bytes{" + instance + ",mountpoint=\"/\"})) * 100";
            case CPU_LOAD_RATIO -> "node_load1{" + instance
                    + "} / on(instance) count by (instance) (node_cpu_seconds_total{mode=\"idle\"," + instance + "})";
        };
    }
}
