package com.aether.core.config;

import com.aether.core.safety.SafetyValidator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Beans for the pure core components that take configuration rather than collaborators.
 */
@Configuration
public class CoreConfig {

    /**
     * Wall clock used to stamp events created by the core itself (timers, acknowledgements,
     * REST ingest without a source timestamp).
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SafetyValidator safetyValidator(AetherProperties properties) {
        return new SafetyValidator(properties.getMission().getMinGpsFix());
    }
}
