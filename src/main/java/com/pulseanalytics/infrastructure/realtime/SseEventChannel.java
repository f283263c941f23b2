package com.pulseanalytics.infrastructure.realtime;

import com.pulseanalytics.domain.model.StreamMessage;
import com.pulseanalytics.domain.realtime.EventChannel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

/**
 * EventChannel over a Spring MVC SseEmitter. Each message goes out as one
 * unnamed SSE event with a JSON data line.
 */
@Slf4j
@RequiredArgsConstructor
public class SseEventChannel implements EventChannel {
    
    private final SseEmitter emitter;
    
    @Override
    public void send(StreamMessage message) throws IOException {
        emitter.send(SseEmitter.event().data(message, MediaType.APPLICATION_JSON));
    }
    
    @Override
    public void close() {
        try {
            emitter.complete();
        } catch (IllegalStateException e) {
            log.debug("SSE emitter already completed: {}", e.getMessage());
        }
    }
}
