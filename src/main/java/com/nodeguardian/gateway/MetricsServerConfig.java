package com.nodeguardian.gateway;

import java.math.BigDecimal;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Fallback metric sources under the {@code nodeguardian.metrics-server} prefix, used when
 * Prometheus has no value.
 *
 * <ul>
 *   <li>{@code enabled} -- read CPU and memory from the Metrics Server and disk from node conditions</li>
 *   <li>{@code diskPressurePercent} -- disk utilization assumed while the node reports DiskPressure</li>
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "nodeguardian.metrics-server")
@Getter
@Setter
public class MetricsServerConfig {

    private boolean enabled = true;

    private BigDecimal diskPressurePercent = BigDecimal.valueOf(90);
}
