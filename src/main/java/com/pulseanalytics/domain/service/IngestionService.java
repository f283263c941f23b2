package com.pulseanalytics.domain.service;

import com.pulseanalytics.domain.exception.InvalidEventException;
import com.pulseanalytics.domain.exception.StoreUnavailableException;
import com.pulseanalytics.domain.index.AggregationIndex;
import com.pulseanalytics.domain.model.BatchIngestResult;
import com.pulseanalytics.domain.model.EventInput;
import com.pulseanalytics.domain.model.EventView;
import com.pulseanalytics.domain.model.IngestResult;
import com.pulseanalytics.domain.realtime.RealtimeFanoutHub;
import com.pulseanalytics.infrastructure.persistence.entity.EventEntity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.persistence.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Ingestion pipeline: validate, store, mirror, broadcast.
 * 
 * Flow per call (single event or batch):
 * 1. Validate every input. Any invalid input rejects the call before anything is written
 * 2. Insert all rows in one relational transaction (all-or-nothing)
 * 3. After commit, bulk-index the committed rows into the aggregation index
 * 4. Broadcast each committed row, in commit order, to the tenant's open streams
 * 
 * Consistency:
 * - The relational store is the source of truth. A store failure fails the call
 * - The index mirror is best-effort. A failed mirror is logged and counted
 *   (index.mirror.failures) and the call still succeeds; those events stay
 *   missing from aggregations until they are reindexed
 * - Broadcast is fire-and-forget and never changes the result
 * 
 * There is no atomicity across the two stores, and no cancellation once the
 * transaction has started.
 */
@Slf4j
@Service
public class IngestionService {
    
    static final int MAX_TYPE_LENGTH = 100;
    static final int MAX_ID_LENGTH = 255;
    
    private final DurableEventStore eventStore;
    private final AggregationIndex aggregationIndex;
    private final RealtimeFanoutHub fanoutHub;
    private final MeterRegistry meterRegistry;
    private final int maxBatchSize;
    private final Counter mirrorFailures;
    private final Counter storeFailures;
    
    public IngestionService(DurableEventStore eventStore,
                            AggregationIndex aggregationIndex,
                            RealtimeFanoutHub fanoutHub,
                            MeterRegistry meterRegistry,
                            @Value("${app.ingest.max-batch-size:1000}") int maxBatchSize) {
        this.eventStore = eventStore;
        this.aggregationIndex = aggregationIndex;
        this.fanoutHub = fanoutHub;
        this.meterRegistry = meterRegistry;
        this.maxBatchSize = maxBatchSize;
        this.mirrorFailures = Counter.builder("index.mirror.failures").register(meterRegistry);
        this.storeFailures = Counter.builder("store.write.failures").register(meterRegistry);
    }
    
    public IngestResult ingestOne(UUID tenantId, EventInput input) {
        if (input == null) {
            throw new InvalidEventException("Event body required");
        }
        validate(input, null);
        
        EventEntity row = ingest(tenantId, List.of(input), "single").get(0);
        
        return IngestResult.builder()
                .eventId(row.getId())
                .timestamp(row.getTimestamp())
                .build();
    }
    
    public BatchIngestResult ingestBatch(UUID tenantId, List<EventInput> inputs) {
        if (inputs == null || inputs.isEmpty()) {
            throw new InvalidEventException("Events array required");
        }
        if (inputs.size() > maxBatchSize) {
            throw new InvalidEventException(
                    "Batch of " + inputs.size() + " events exceeds the limit of " + maxBatchSize);
        }
        for (int i = 0; i < inputs.size(); i++) {
            if (inputs.get(i) == null) {
                throw new InvalidEventException("events[" + i + "]: event body required");
            }
            validate(inputs.get(i), i);
        }
        
        List<UUID> ids = ingest(tenantId, inputs, "batch").stream()
                .map(EventEntity::getId)
                .collect(Collectors.toList());
        
        return BatchIngestResult.builder()
                .eventIds(ids)
                .count(ids.size())
                .build();
    }
    
    private List<EventEntity> ingest(UUID tenantId, List<EventInput> inputs, String mode) {
        Timer.Sample sample = Timer.start(meterRegistry);
        
        List<EventEntity> committed;
        try {
            committed = eventStore.insertAll(tenantId, inputs);
        } catch (DataAccessException | TransactionException | PersistenceException e) {
            storeFailures.increment();
            log.error("Event store write failed for tenant {} ({} event(s) rolled back): {}",
                    tenantId, inputs.size(), e.getMessage(), e);
            throw new StoreUnavailableException("Failed to track events", e);
        }
        
        List<EventView> views = committed.stream()
                .map(EventView::from)
                .collect(Collectors.toList());
        
        mirror(tenantId, views);
        
        for (EventView view : views) {
            try {
                fanoutHub.broadcast(tenantId, view);
            } catch (RuntimeException e) {
                log.warn("Broadcast of event {} for tenant {} failed: {}", view.getId(), tenantId, e.getMessage());
            }
        }
        
        Counter.builder("events.ingested")
                .tag("mode", mode)
                .register(meterRegistry)
                .increment(committed.size());
        sample.stop(Timer.builder("ingest.latency")
                .tag("mode", mode)
                .register(meterRegistry));
        
        log.info("Ingested {} event(s) for tenant {} ({})", committed.size(), tenantId, mode);
        return committed;
    }
    
    private void mirror(UUID tenantId, List<EventView> views) {
        List<UUID> missing;
        try {
            missing = aggregationIndex.indexEvents(tenantId, views);
        } catch (RuntimeException e) {
            mirrorFailures.increment(views.size());
            log.error("Index mirror failed for tenant {}: {} stored event(s) missing from aggregations, ids={}: {}",
                    tenantId, views.size(),
                    views.stream().map(EventView::getId).collect(Collectors.toList()),
                    e.getMessage(), e);
            return;
        }
        
        if (missing != null && !missing.isEmpty()) {
            mirrorFailures.increment(missing.size());
            log.error("Index mirror partially rejected for tenant {}: {} of {} stored event(s) missing from aggregations, ids={}",
                    tenantId, missing.size(), views.size(), missing);
        }
    }
    
    private void validate(EventInput input, Integer position) {
        String where = position == null ? "" : "events[" + position + "]: ";
        
        if (input.getType() == null || input.getType().isBlank()) {
            throw new InvalidEventException(where + "Event name required");
        }
        if (input.getType().length() > MAX_TYPE_LENGTH) {
            throw new InvalidEventException(where + "Event name longer than " + MAX_TYPE_LENGTH + " characters");
        }
        if (input.getUserId() != null && input.getUserId().length() > MAX_ID_LENGTH) {
            throw new InvalidEventException(where + "userId longer than " + MAX_ID_LENGTH + " characters");
        }
        if (input.getSessionId() != null && input.getSessionId().length() > MAX_ID_LENGTH) {
            throw new InvalidEventException(where + "sessionId longer than " + MAX_ID_LENGTH + " characters");
        }
    }
}
