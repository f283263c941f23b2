package com.pulseanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request model for the relational event listing.
 * 
 * Supports exact filters on type and user, an inclusive time range and
 * limit/offset pagination.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventQueryRequest {
    
    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;
    
    private String userId;
    private String eventType;
    private Instant startTime;
    private Instant endTime;
    
    private Integer limit;
    private Integer offset;
    
    // Defaults
    public Integer getLimit() {
        if (limit == null || limit <= 0) {
            return DEFAULT_LIMIT;
        }
        return Math.min(limit, MAX_LIMIT);
    }
    
    public Integer getOffset() {
        if (offset == null || offset < 0) {
            return 0;
        }
        return offset;
    }
    
    public Instant getStartTime() {
        if (startTime == null) {
            return Instant.EPOCH;
        }
        return startTime;
    }
    
    public Instant getEndTime() {
        if (endTime == null) {
            // Far enough ahead to include client clocks that run fast
            return Instant.now().plusSeconds(24 * 3600);
        }
        return endTime;
    }
}
