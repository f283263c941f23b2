package com.pulseanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Dashboard analytics for one tenant over a time range.
 * 
 * eventsOverTime covers the whole range at the requested interval, with
 * zero-count buckets where nothing happened.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyticsSummary {
    
    private long totalEvents;
    private long uniqueUsers;
    private List<TimeBucket> eventsOverTime;
    private List<EventCount> topEvents;
    
    private BucketInterval interval;
    private Instant startTime;
    private Instant endTime;
}
