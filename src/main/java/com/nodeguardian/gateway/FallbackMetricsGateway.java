package com.nodeguardian.gateway;

import com.nodeguardian.domain.enums.MetricKind;
import com.nodeguardian.exception.MetricUnavailableException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

/**
 * The {@link MetricsGateway} the engine uses: Prometheus first, then the Kubernetes API.
 *
 * <p>CPU, memory and disk fall back to {@link MetricsServerGateway}. Load ratio falls back to
 * CPU utilization / 100, with CPU utilization itself resolved through this chain. When both
 * sources fail the exception names both reasons.
 */
@Primary
@Component
public class FallbackMetricsGateway implements MetricsGateway {

    private static final Logger log = LoggerFactory.getLogger(FallbackMetricsGateway.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final PrometheusMetricsGateway prometheusMetricsGateway;
    private final MetricsServerGateway metricsServerGateway;

    public FallbackMetricsGateway(
            PrometheusMetricsGateway prometheusMetricsGateway, MetricsServerGateway metricsServerGateway) {
        this.prometheusMetricsGateway = prometheusMetricsGateway;
        this.metricsServerGateway = metricsServerGateway;
    }

    @Override
    public BigDecimal get(String nodeName, MetricKind metric) {
        try {
            return prometheusMetricsGateway.get(nodeName, metric);
        } catch (MetricUnavailableException primary) {
            log.debug(
                    "Prometheus has no {} for {} ({}), falling back",
                    metric.getDocumentName(),
                    nodeName,
                    primary.getReason());
            try {
                return fallback(nodeName, metric);
            } catch (MetricUnavailableException secondary) {
                MetricUnavailableException combined = new MetricUnavailableException(
                        nodeName,
                        metric,
                        "prometheus: " + primary.getReason() + "; fallback: " + secondary.getReason());
                combined.addSuppressed(primary);
                combined.addSuppressed(secondary);
                throw combined;
            }
        }
    }

    private BigDecimal fallback(String nodeName, MetricKind metric) {
        if (metric == MetricKind.CPU_LOAD_RATIO) {
            return get(nodeName, MetricKind.CPU_UTILIZATION_PERCENT).divide(HUNDRED, 4, RoundingMode.HALF_UP);
        }
        return metricsServerGateway.get(nodeName, metric);
    }
}
