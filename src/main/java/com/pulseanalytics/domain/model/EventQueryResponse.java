package com.pulseanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventQueryResponse {
    
    private List<EventView> events;
    private int count;
    private int offset;
    private int limit;
    private long total;
    private long queryTimeMs;
}
