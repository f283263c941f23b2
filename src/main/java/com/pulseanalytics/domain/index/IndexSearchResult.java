package com.pulseanalytics.domain.index;

import com.pulseanalytics.domain.model.EventView;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexSearchResult {
    private List<EventView> events;
    private long total;
    private long tookMs;
}
