package com.pulseanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Per-step counts for an ordered list of event types.
 * 
 * Known limitation: each step is counted on its own within the window. A
 * user does not have to reach step N-1 to be counted at step N, so this is
 * not a sequential conversion funnel.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FunnelReport {
    private List<FunnelStep> funnel;
    private String window;
}
