package com.pulseanalytics.domain.service;

import com.pulseanalytics.domain.model.EventInput;
import com.pulseanalytics.domain.model.EventQueryRequest;
import com.pulseanalytics.infrastructure.persistence.entity.EventEntity;
import com.pulseanalytics.infrastructure.persistence.repository.EventRepository;
import com.pulseanalytics.infrastructure.persistence.repository.OffsetLimitRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.UUID;

/**
 * Relational source of truth for events.
 * 
 * insertAll is one transaction: either every row of the batch is committed
 * or none is. It is kept on its own bean so the transaction has committed by
 * the time IngestionService starts mirroring and broadcasting.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DurableEventStore {
    
    private final EventRepository eventRepository;
    private final Clock clock;
    
    /**
     * Insert one row per input, scoped to tenantId, in submission order.
     * 
     * Flushes before returning so constraint violations surface inside the
     * transaction and roll back the whole batch.
     */
    @Transactional
    public List<EventEntity> insertAll(UUID tenantId, List<EventInput> inputs) {
        Instant ingestedAt = clock.instant();
        List<EventEntity> rows = new ArrayList<>(inputs.size());
        
        for (EventInput input : inputs) {
            rows.add(EventEntity.builder()
                    .tenantId(tenantId)
                    .eventType(input.getType())
                    .userId(input.getUserId())
                    .sessionId(input.getSessionId())
                    .properties(input.getProperties() != null
                            ? new LinkedHashMap<>(input.getProperties())
                            : new LinkedHashMap<>())
                    .timestamp(resolveTimestamp(input.getTimestamp(), ingestedAt))
                    .createdAt(ingestedAt)
                    .build());
        }
        
        List<EventEntity> saved = eventRepository.saveAll(rows);
        eventRepository.flush();
        
        log.debug("Inserted {} event row(s) for tenant {}", saved.size(), tenantId);
        return saved;
    }
    
    @Transactional(readOnly = true, timeout = 10)
    public List<EventEntity> findEvents(UUID tenantId, EventQueryRequest request) {
        return eventRepository.findTenantEvents(
                tenantId,
                request.getUserId(),
                request.getEventType(),
                request.getStartTime(),
                request.getEndTime(),
                OffsetLimitRequest.of(request.getOffset(), request.getLimit())
        );
    }
    
    @Transactional(readOnly = true, timeout = 10)
    public long countEvents(UUID tenantId, EventQueryRequest request) {
        return eventRepository.countTenantEvents(
                tenantId,
                request.getUserId(),
                request.getEventType(),
                request.getStartTime(),
                request.getEndTime()
        );
    }
    
    /**
     * Caller-supplied timestamp if it parses as ISO-8601, ingestion time otherwise.
     */
    static Instant resolveTimestamp(String raw, Instant fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Instant.parse(raw.trim());
        } catch (DateTimeParseException notAnInstant) {
            try {
                return OffsetDateTime.parse(raw.trim()).toInstant();
            } catch (DateTimeParseException e) {
                log.debug("Unparseable event timestamp '{}', using ingestion time", raw);
                return fallback;
            }
        }
    }
}
