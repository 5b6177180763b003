package com.nodeguardian.gateway;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.ssl.SslBundles;
import org.springframework.boot.web.client.ClientHttpRequestFactories;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * Kubernetes API access under the {@code nodeguardian.kubernetes} prefix.
 *
 * <p>Provides the {@link RestTemplate} used by {@link KubernetesApiClient}. The bearer token
 * is re-read from {@code tokenFile} on each request so projected service-account tokens
 * that rotate on disk keep working.
 */
@Configuration
@ConfigurationProperties(prefix = "nodeguardian.kubernetes")
@Getter
@Setter
public class KubernetesConfig {

    private String apiUrl = "https://kubernetes.default.svc";

    private String tokenFile = "/var/run/secrets/kubernetes.io/serviceaccount/token";

    /** Static token, used when set instead of {@code tokenFile}. */
    private String token;

    private Duration requestTimeout = Duration.ofSeconds(10);

    private int evictionGracePeriodSeconds = 30;

    private List<String> defaultExcludeNamespaces = new ArrayList<>(List.of("kube-system", "kube-public"));

    private String ruleGroup = "nodeguardian.k8s.io";
    private String ruleVersion = "v1";
    private String rulePlural = "nodeguardianrules";

    /** Name of a {@code spring.ssl.bundle} trusting the API server CA. Optional. */
    private String sslBundle;

    @Bean("kubernetesRestTemplate")
    public RestTemplate kubernetesRestTemplate(RestTemplateBuilder builder, ObjectProvider<SslBundles> sslBundles) {
        if (sslBundle != null && !sslBundle.isBlank()) {
            builder = builder.setSslBundle(sslBundles.getObject().getBundle(sslBundle));
        }
        // JDK client: the default HttpURLConnection factory cannot send PATCH
        return builder.requestFactory(
                        settings -> ClientHttpRequestFactories.get(JdkClientHttpRequestFactory.class, settings))
                .rootUri(apiUrl)
                .setConnectTimeout(Duration.ofSeconds(5))
                .setReadTimeout(requestTimeout)
                .additionalInterceptors((request, body, execution) -> {
                    String bearer = resolveToken();
                    if (bearer != null && !bearer.isBlank()) {
                        request.getHeaders().setBearerAuth(bearer);
                    }
                    return execution.execute(request, body);
                })
                .build();
    }

    String resolveToken() {
        if (token != null && !token.isBlank()) {
            return token;
        }
        try {
            Path path = Path.of(tokenFile);
            return Files.exists(path) ? Files.readString(path).trim() : null;
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read Kubernetes token file " + tokenFile, e);
        }
    }
}
