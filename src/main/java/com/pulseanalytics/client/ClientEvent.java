package com.pulseanalytics.client;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * An event as the client sends it to /track and /track/batch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ClientEvent {
    private String event;
    private Map<String, Object> properties;
    private String userId;
    private String sessionId;
    private String timestamp;
}
