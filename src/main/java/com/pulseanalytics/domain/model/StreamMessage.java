package com.pulseanalytics.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Message pushed on a realtime stream. type is the discriminator clients
 * switch on.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StreamMessage {
    
    public static final String CONNECTED = "connected";
    public static final String HEARTBEAT = "heartbeat";
    public static final String EVENT = "event";
    
    private String type;
    private String connectionId;
    private EventView data;
    private Instant timestamp;
    
    public static StreamMessage connected(String connectionId, Instant now) {
        return StreamMessage.builder().type(CONNECTED).connectionId(connectionId).timestamp(now).build();
    }
    
    public static StreamMessage heartbeat(Instant now) {
        return StreamMessage.builder().type(HEARTBEAT).timestamp(now).build();
    }
    
    public static StreamMessage event(EventView event, Instant now) {
        return StreamMessage.builder().type(EVENT).data(event).timestamp(now).build();
    }
}
