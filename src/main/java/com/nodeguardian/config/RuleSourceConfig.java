package com.nodeguardian.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Where rule and alert template documents come from.
 *
 * <p>{@code source=file} reads {@code *.yaml|*.yml|*.json} from {@code path};
 * {@code source=kubernetes} lists the {@code nodeguardianrules} custom resources.
 * Properties are read from the {@code nodeguardian.rules} prefix.
 */
@Configuration
@ConfigurationProperties(prefix = "nodeguardian.rules")
@Getter
@Setter
public class RuleSourceConfig {

    public enum SourceType {
        FILE,
        KUBERNETES
    }

    private SourceType source = SourceType.FILE;

    /** Directory of rule documents for the file source. */
    private String path = "/etc/nodeguardian/rules";

    /** Period of the re-list and diff against the registry. */
    private long resyncIntervalMs = 60000;

    /** Directory of alert template documents. Optional. */
    private String templatesPath;
}
