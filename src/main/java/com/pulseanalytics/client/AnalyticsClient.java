package com.pulseanalytics.client;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Client-side batching buffer for the analytics service.
 * 
 * Usage:
 * <pre>
 * AnalyticsClient analytics = new AnalyticsClient(ClientOptions.builder().apiKey("...").build());
 * analytics.track("signup", Map.of("plan", "pro"), TrackOptions.builder().userId("u1").build());
 * ...
 * analytics.shutdown();
 * </pre>
 * 
 * Buffered events go out as one /track/batch call when the queue reaches
 * batchSize, on every flushInterval tick, on {@link #flush()} and on
 * {@link #shutdown()}. A failed flush puts the drained events back at the
 * front of the queue in their original order, so no event is lost and
 * ordering is kept. A crash loses whatever is still queued.
 */
@Slf4j
public class AnalyticsClient {
    
    static final String IDENTIFY_EVENT = "user_identify";
    static final String PAGE_VIEW_EVENT = "page_view";
    
    private final ClientOptions options;
    private final AnalyticsTransport transport;
    private final Deque<ClientEvent> queue = new ArrayDeque<>();
    private final ScheduledExecutorService scheduler;
    private final ScheduledFuture<?> autoFlushTask;
    
    public AnalyticsClient(ClientOptions options) {
        this(options, new RestTemplateAnalyticsTransport(requireApiKey(options)));
    }
    
    public AnalyticsClient(ClientOptions options, AnalyticsTransport transport) {
        this.options = requireApiKey(options);
        this.transport = transport;
        
        if (options.isEnableBatching()) {
            this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "analytics-auto-flush");
                thread.setDaemon(true);
                return thread;
            });
            long intervalMs = options.getFlushInterval().toMillis();
            this.autoFlushTask = scheduler.scheduleAtFixedRate(
                    this::autoFlush, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        } else {
            this.scheduler = null;
            this.autoFlushTask = null;
        }
    }
    
    public TrackAck track(String event, Map<String, Object> properties) {
        return track(event, properties, TrackOptions.none());
    }
    
    /**
     * Send now (batching off for this call) and return the server's ack, or
     * enqueue and return {queued: true, queueSize}.
     * 
     * @throws AnalyticsClientException if an immediate send or a size-triggered flush fails
     */
    public TrackAck track(String event, Map<String, Object> properties, TrackOptions trackOptions) {
        TrackOptions callOptions = trackOptions != null ? trackOptions : TrackOptions.none();
        ClientEvent clientEvent = ClientEvent.builder()
                .event(event)
                .properties(properties != null ? properties : Map.of())
                .userId(callOptions.getUserId())
                .sessionId(callOptions.getSessionId())
                .timestamp(Instant.now().toString())
                .build();
        
        boolean batching = callOptions.getEnableBatching() != null
                ? callOptions.getEnableBatching()
                : options.isEnableBatching();
        if (!batching) {
            return transport.sendEvent(clientEvent);
        }
        
        int size;
        synchronized (queue) {
            queue.addLast(clientEvent);
            size = queue.size();
        }
        if (size >= options.getBatchSize()) {
            flush();
        }
        return TrackAck.queued(pendingCount());
    }
    
    /**
     * Record user traits as a user_identify event. Traits are kept under
     * "traits" and also flattened into the properties for querying.
     */
    public TrackAck identify(String userId, Map<String, Object> traits) {
        Map<String, Object> safeTraits = traits != null ? traits : Map.of();
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("userId", userId);
        properties.put("traits", safeTraits);
        properties.putAll(safeTraits);
        return track(IDENTIFY_EVENT, properties, TrackOptions.builder().userId(userId).build());
    }
    
    public TrackAck page(String name, Map<String, Object> properties, TrackOptions trackOptions) {
        Map<String, Object> pageProperties = new LinkedHashMap<>();
        pageProperties.put("page", name);
        if (properties != null) {
            pageProperties.putAll(properties);
        }
        return track(PAGE_VIEW_EVENT, pageProperties, trackOptions);
    }
    
    /**
     * Send everything queued as one batch.
     * 
     * @return the server's batch ack, or {success: true, count: 0} when nothing was queued
     * @throws AnalyticsClientException after re-queueing the drained events
     */
    public TrackAck flush() {
        List<ClientEvent> drained;
        synchronized (queue) {
            if (queue.isEmpty()) {
                return TrackAck.nothingToFlush();
            }
            drained = new ArrayList<>(queue);
            queue.clear();
        }
        
        try {
            TrackAck ack = transport.sendBatch(drained);
            log.debug("Flushed {} events", drained.size());
            return ack;
        } catch (RuntimeException e) {
            requeueFront(drained);
            throw e;
        }
    }
    
    public JsonNode query(EventQuery query) {
        return transport.getEvents(query != null ? query.toParams() : Map.of());
    }
    
    public JsonNode ping() {
        return transport.health();
    }
    
    /**
     * Snapshot of the queued events, oldest first.
     */
    public List<ClientEvent> pendingEvents() {
        synchronized (queue) {
            return List.copyOf(queue);
        }
    }
    
    /**
     * Stop the recurring flush, then send whatever is still queued.
     * 
     * @throws AnalyticsClientException if the final flush fails (events stay queued)
     */
    public void shutdown() {
        if (autoFlushTask != null) {
            autoFlushTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
        }
        flush();
    }
    
    void autoFlush() {
        if (pendingCount() == 0) {
            return;
        }
        try {
            flush();
        } catch (RuntimeException e) {
            log.warn("Analytics auto-flush failed: {}", e.getMessage());
        }
    }
    
    private int pendingCount() {
        synchronized (queue) {
            return queue.size();
        }
    }
    
    private void requeueFront(List<ClientEvent> drained) {
        synchronized (queue) {
            ListIterator<ClientEvent> it = drained.listIterator(drained.size());
            while (it.hasPrevious()) {
                queue.addFirst(it.previous());
            }
        }
    }
    
    private static ClientOptions requireApiKey(ClientOptions options) {
        if (options == null || options.getApiKey() == null || options.getApiKey().isBlank()) {
            throw new IllegalArgumentException("API key is required");
        }
        return options;
    }
}
