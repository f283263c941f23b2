package com.pulseanalytics.client;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Wire access used by {@link AnalyticsClient}. Every method throws
 * {@link AnalyticsClientException} on failure.
 */
public interface AnalyticsTransport {
    
    TrackAck sendEvent(ClientEvent event);
    
    TrackAck sendBatch(List<ClientEvent> events);
    
    JsonNode getEvents(Map<String, String> params);
    
    JsonNode health();
}
