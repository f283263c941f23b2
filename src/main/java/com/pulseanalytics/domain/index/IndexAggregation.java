package com.pulseanalytics.domain.index;

import com.pulseanalytics.domain.model.EventCount;
import com.pulseanalytics.domain.model.TimeBucket;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexAggregation {
    private long totalEvents;
    private long uniqueUsers;
    private List<TimeBucket> buckets;
    private List<EventCount> topEvents;
}
