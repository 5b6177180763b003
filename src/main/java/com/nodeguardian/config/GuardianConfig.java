package com.nodeguardian.config;

import com.nodeguardian.engine.GuardianEngineConfig;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Shared beans of the control loop. */
@Configuration
@EnableConfigurationProperties(GuardianEngineConfig.class)
public class GuardianConfig {

    /** Single time source; engine components also take an explicit instant so tests can drive time. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
