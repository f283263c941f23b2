package com.pulseanalytics.domain.index;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexHealth {
    
    // green / yellow / red as reported by the cluster, "unreachable" otherwise
    private String status;
    private boolean available;
    private Map<String, Object> details;
}
