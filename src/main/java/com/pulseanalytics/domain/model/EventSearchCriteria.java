package com.pulseanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Filters for an index-backed event search. All supplied filters are ANDed.
 * Results are always newest first.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventSearchCriteria {
    
    private String eventType;
    private String userId;
    private Instant startTime;
    private Instant endTime;
    
    @Builder.Default
    private Map<String, String> propertyFilters = new LinkedHashMap<>();
    
    private Integer limit;
    private Integer offset;
    
    public Integer getLimit() {
        if (limit == null || limit <= 0) {
            return EventQueryRequest.DEFAULT_LIMIT;
        }
        return Math.min(limit, EventQueryRequest.MAX_LIMIT);
    }
    
    public Integer getOffset() {
        if (offset == null || offset < 0) {
            return 0;
        }
        return offset;
    }
}
