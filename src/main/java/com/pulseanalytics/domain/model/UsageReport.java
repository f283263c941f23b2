package com.pulseanalytics.domain.model;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Analytics over the last N days plus a growth rate.
 * 
 * growthRate compares the event total of the second half of the daily series
 * against the first half, in percent. It is a rough heuristic for the
 * dashboard, not a trend estimate.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageReport {
    
    @JsonUnwrapped
    private AnalyticsSummary analytics;
    
    private double growthRate;
    private int days;
}
