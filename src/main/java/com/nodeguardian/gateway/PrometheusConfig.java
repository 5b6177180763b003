package com.nodeguardian.gateway;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * Prometheus query endpoint under the {@code nodeguardian.prometheus} prefix. The request timeout
 * stays well under the external call timeout so the Kubernetes fallback still fits in it.
 */
@Configuration
@ConfigurationProperties(prefix = "nodeguardian.prometheus")
@Getter
@Setter
public class PrometheusConfig {

    private boolean enabled = true;

    private String url = "http://prometheus-k8s.monitoring.svc:9090";

    private Duration requestTimeout = Duration.ofSeconds(4);

    @Bean("prometheusRestTemplate")
    public RestTemplate prometheusRestTemplate(RestTemplateBuilder builder) {
        return builder.rootUri(url)
                .setConnectTimeout(Duration.ofSeconds(5))
                .setReadTimeout(requestTimeout)
                .build();
    }
}
