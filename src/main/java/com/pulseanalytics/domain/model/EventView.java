package com.pulseanalytics.domain.model;

import com.pulseanalytics.infrastructure.persistence.entity.EventEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Read-side shape of a stored event.
 * 
 * Used for listing and search results, for index documents and for the
 * payload of realtime "event" messages.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventView {
    
    private UUID id;
    private UUID tenantId;
    private String eventType;
    private String userId;
    private String sessionId;
    private Map<String, Object> properties;
    private Instant timestamp;
    private Instant createdAt;
    
    public static EventView from(EventEntity entity) {
        return EventView.builder()
                .id(entity.getId())
                .tenantId(entity.getTenantId())
                .eventType(entity.getEventType())
                .userId(entity.getUserId())
                .sessionId(entity.getSessionId())
                .properties(entity.getProperties() != null
                        ? new LinkedHashMap<>(entity.getProperties())
                        : new LinkedHashMap<>())
                .timestamp(entity.getTimestamp())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
