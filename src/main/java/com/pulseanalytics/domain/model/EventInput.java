package com.pulseanalytics.domain.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A single event as submitted by a client.
 * 
 * The SDK sends the event name as "event"; "type" is accepted as well.
 * timestamp is kept as raw text: it wins over the ingestion clock only when
 * it parses as an ISO-8601 instant.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventInput {
    
    @JsonAlias("event")
    private String type;
    
    private Map<String, Object> properties;
    private String userId;
    private String sessionId;
    private String timestamp;
}
