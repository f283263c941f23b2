package com.pulseanalytics.api;

import com.pulseanalytics.domain.realtime.RealtimeFanoutHub;
import com.pulseanalytics.infrastructure.realtime.SseEventChannel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.UUID;

/**
 * GET /events/stream - realtime feed of the tenant's new events (SSE).
 * 
 * Messages (JSON in the data line, "type" discriminator):
 * - {"type":"connected","connectionId":"..."} right after the stream opens
 * - {"type":"heartbeat"} on a fixed interval
 * - {"type":"event","data":{...}} per event ingested while the stream is open
 * 
 * No backlog is replayed on (re)connect.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class StreamController {
    
    private final RealtimeFanoutHub fanoutHub;
    
    // 0 = no server-side timeout; the stream lives until the client goes away
    @Value("${app.stream.timeout-ms:0}")
    private long streamTimeoutMs;
    
    @GetMapping(path = "/events/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestAttribute(TenantAuthInterceptor.TENANT_ATTRIBUTE) UUID tenantId) {
        SseEmitter emitter = new SseEmitter(streamTimeoutMs);
        
        String connectionId = fanoutHub.register(tenantId, new SseEventChannel(emitter));
        
        emitter.onCompletion(() -> fanoutHub.unregister(connectionId));
        emitter.onTimeout(() -> {
            fanoutHub.unregister(connectionId);
            emitter.complete();
        });
        emitter.onError(error -> {
            log.debug("Stream {} errored: {}", connectionId, error.getMessage());
            fanoutHub.unregister(connectionId);
        });
        
        return emitter;
    }
}
