package com.pulseanalytics.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-call options for track/page.
 * 
 * enableBatching overrides the client-wide setting for this call only;
 * null means "use the client setting".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrackOptions {
    private String userId;
    private String sessionId;
    private Boolean enableBatching;
    
    public static TrackOptions none() {
        return new TrackOptions();
    }
}
