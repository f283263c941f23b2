package com.pulseanalytics.api;

import com.pulseanalytics.api.dto.BatchTrackResponse;
import com.pulseanalytics.api.dto.TrackResponse;
import com.pulseanalytics.domain.exception.InvalidEventException;
import com.pulseanalytics.domain.model.BatchEventInput;
import com.pulseanalytics.domain.model.BatchIngestResult;
import com.pulseanalytics.domain.model.EventInput;
import com.pulseanalytics.domain.model.IngestResult;
import com.pulseanalytics.domain.service.IngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Event ingestion API.
 * 
 * Endpoints:
 * - POST /track - Track one event
 * - POST /track/batch - Track a batch atomically
 * 
 * Both return 201 once the events are committed to the relational store.
 * A 201 does not mean the events are already visible in aggregations.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class IngestionController {
    
    private final IngestionService ingestionService;
    
    /**
     * POST /track
     * 
     * Request body:
     * {
     *   "event": "signup",          (or "type")
     *   "properties": { ... },
     *   "userId": "u1",
     *   "sessionId": "s1",
     *   "timestamp": "2024-01-01T00:00:00Z"
     * }
     */
    @PostMapping("/track")
    public ResponseEntity<TrackResponse> track(
            @RequestAttribute(TenantAuthInterceptor.TENANT_ATTRIBUTE) UUID tenantId,
            @RequestBody(required = false) EventInput input) {
        
        IngestResult result = ingestionService.ingestOne(tenantId, input);
        
        return ResponseEntity.status(HttpStatus.CREATED).body(TrackResponse.builder()
                .success(true)
                .eventId(result.getEventId())
                .timestamp(result.getTimestamp())
                .build());
    }
    
    /**
     * POST /track/batch
     * 
     * Request body: { "events": [ {...}, {...} ] }
     * 
     * All events are stored or none is.
     */
    @PostMapping("/track/batch")
    public ResponseEntity<BatchTrackResponse> trackBatch(
            @RequestAttribute(TenantAuthInterceptor.TENANT_ATTRIBUTE) UUID tenantId,
            @RequestBody(required = false) BatchEventInput body) {
        
        if (body == null) {
            throw new InvalidEventException("Events array required");
        }
        
        BatchIngestResult result = ingestionService.ingestBatch(tenantId, body.getEvents());
        
        return ResponseEntity.status(HttpStatus.CREATED).body(BatchTrackResponse.builder()
                .success(true)
                .eventIds(result.getEventIds())
                .count(result.getCount())
                .build());
    }
}
