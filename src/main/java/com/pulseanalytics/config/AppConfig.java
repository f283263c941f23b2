package com.pulseanalytics.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AppConfig {

    /**
     * Ingestion timestamps, query ranges and stream messages all read this clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
