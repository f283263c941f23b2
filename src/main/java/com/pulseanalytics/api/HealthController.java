package com.pulseanalytics.api;

import com.pulseanalytics.domain.index.AggregationIndex;
import com.pulseanalytics.domain.index.IndexHealth;
import com.pulseanalytics.domain.realtime.RealtimeFanoutHub;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness of the service and of the aggregation index, checked separately.
 * Neither endpoint needs an API key.
 */
@RestController
@RequiredArgsConstructor
public class HealthController {
    
    private final AggregationIndex aggregationIndex;
    private final RealtimeFanoutHub fanoutHub;
    private final Clock clock;
    
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("timestamp", clock.instant().toString());
        body.put("openStreams", fanoutHub.connectionCount());
        return ResponseEntity.ok(body);
    }
    
    @GetMapping("/health/index")
    public ResponseEntity<IndexHealth> indexHealth() {
        IndexHealth health = aggregationIndex.health();
        HttpStatus status = health.isAvailable() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(health);
    }
}
