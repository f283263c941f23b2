package com.pulseanalytics.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * What the dashboard needs before its first query.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DashboardConfig {
    private UUID tenantId;
    private String tenantName;
    private String streamPath;
    private int defaultRangeDays;
    private List<String> intervals;
}
