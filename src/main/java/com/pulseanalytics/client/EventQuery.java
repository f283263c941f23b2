package com.pulseanalytics.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Filters for {@link AnalyticsClient#query(EventQuery)}, sent as /events query parameters.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventQuery {
    private String eventType;
    private String userId;
    private String startDate;
    private String endDate;
    private Integer limit;
    private Integer offset;
    
    Map<String, String> toParams() {
        Map<String, String> params = new LinkedHashMap<>();
        putIfPresent(params, "event_type", eventType);
        putIfPresent(params, "user_id", userId);
        putIfPresent(params, "start_date", startDate);
        putIfPresent(params, "end_date", endDate);
        putIfPresent(params, "limit", limit);
        putIfPresent(params, "offset", offset);
        return params;
    }
    
    private static void putIfPresent(Map<String, String> params, String name, Object value) {
        if (value != null && !value.toString().isBlank()) {
            params.put(name, value.toString());
        }
    }
}
