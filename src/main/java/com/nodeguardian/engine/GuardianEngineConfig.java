package com.nodeguardian.engine;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the evaluation engine under the {@code nodeguardian.engine} prefix.
 *
 * <ul>
 *   <li>{@code enabled} -- master toggle; when false no timers are started</li>
 *   <li>{@code maxConcurrentEvaluations} -- global cap on in-flight (rule, node) evaluations</li>
 *   <li>{@code recoveryCheckIntervalMs} -- period of the recovery sweep</li>
 *   <li>{@code externalCallTimeout} -- bound on every metric fetch, node mutation and channel send</li>
 *   <li>{@code default*} -- used when a rule document omits the value</li>
 * </ul>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "nodeguardian.engine")
public class GuardianEngineConfig {

    private boolean enabled = true;
    private int maxConcurrentEvaluations = 10;
    private long recoveryCheckIntervalMs = 30000;
    private Duration externalCallTimeout = Duration.ofSeconds(10);
    private Duration defaultCheckInterval = Duration.ofSeconds(30);
    private Duration defaultCooldownPeriod = Duration.ofMinutes(10);
    private Duration defaultRecoveryCooldownPeriod = Duration.ofMinutes(2);
    private Duration defaultConditionDuration = Duration.ofMinutes(5);

    /** Upper bound on how long shutdown waits for in-flight batches. */
    private Duration shutdownDrainTimeout = Duration.ofSeconds(30);
}
