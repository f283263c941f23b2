package com.pulseanalytics.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * What track/flush hand back to the caller.
 * 
 * Either a server acknowledgment (eventId or eventIds/count) or, for a
 * buffered call, {queued: true, queueSize}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TrackAck {
    private Boolean success;
    private UUID eventId;
    private String timestamp;
    private List<UUID> eventIds;
    private Integer count;
    private Boolean queued;
    private Integer queueSize;
    
    static TrackAck queued(int queueSize) {
        return TrackAck.builder().queued(true).queueSize(queueSize).build();
    }
    
    static TrackAck nothingToFlush() {
        return TrackAck.builder().success(true).count(0).build();
    }
}
