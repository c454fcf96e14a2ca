package com.apex.decision.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class EngineConfig {

    /**
     * Wall clock for TTLs, cooldowns and stat days; tests replace it with a controllable one.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
