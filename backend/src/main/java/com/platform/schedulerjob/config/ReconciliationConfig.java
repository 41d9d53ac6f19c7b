package com.platform.schedulerjob.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Beans shared by the reconciliation components.
 */
@Configuration
public class ReconciliationConfig {
    
    /**
     * Source of "now" for start times that are not configured.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
