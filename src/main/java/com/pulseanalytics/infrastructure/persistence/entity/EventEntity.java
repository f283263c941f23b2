package com.pulseanalytics.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One tracked event. Source of truth for everything the index and the
 * realtime stream see.
 * 
 * Rows are append-only: there is no update path, and tenantId never changes
 * after insert.
 * 
 * Indexing Strategy:
 * - tenantId on every index, since every read is tenant-scoped
 * - (tenantId, timestamp) for the listing endpoint (sorted desc)
 * - (tenantId, eventType) and (tenantId, userId) for exact filters
 */
@Entity
@Table(name = "events", indexes = {
    @Index(name = "idx_events_tenant_timestamp", columnList = "tenant_id,timestamp"),
    @Index(name = "idx_events_tenant_type", columnList = "tenant_id,event_type"),
    @Index(name = "idx_events_tenant_user", columnList = "tenant_id,user_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventEntity {
    
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", columnDefinition = "UUID")
    private UUID id;
    
    @Column(name = "tenant_id", nullable = false, updatable = false, columnDefinition = "UUID")
    private UUID tenantId;
    
    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;
    
    @Column(name = "user_id")
    private String userId;
    
    @Column(name = "session_id")
    private String sessionId;
    
    @Convert(converter = PropertiesConverter.class)
    @Column(name = "properties", columnDefinition = "TEXT")
    private Map<String, Object> properties;
    
    @Column(name = "timestamp", nullable = false)
    private Instant timestamp;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (timestamp == null) {
            timestamp = createdAt;
        }
    }
}
