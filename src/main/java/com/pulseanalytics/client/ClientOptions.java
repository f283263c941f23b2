package com.pulseanalytics.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Settings for {@link AnalyticsClient}. Only the API key is required.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClientOptions {
    
    private String apiKey;
    
    @Builder.Default
    private String baseUrl = "http://localhost:3000";
    
    @Builder.Default
    private Duration timeout = Duration.ofSeconds(5);
    
    // Queue length that triggers an immediate flush
    @Builder.Default
    private int batchSize = 100;
    
    @Builder.Default
    private Duration flushInterval = Duration.ofSeconds(10);
    
    @Builder.Default
    private boolean enableBatching = true;
}
