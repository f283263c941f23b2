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
public class EventSearchResponse {
    
    private List<EventView> events;
    private long total;
    private int count;
    
    // Index-reported query time in ms
    private long latency;
}
