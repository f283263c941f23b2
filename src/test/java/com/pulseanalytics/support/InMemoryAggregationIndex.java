package com.pulseanalytics.support;

import com.pulseanalytics.domain.index.AggregationIndex;
import com.pulseanalytics.domain.index.IndexAggregation;
import com.pulseanalytics.domain.index.IndexHealth;
import com.pulseanalytics.domain.index.IndexSearchResult;
import com.pulseanalytics.domain.index.StepCount;
import com.pulseanalytics.domain.model.BucketInterval;
import com.pulseanalytics.domain.model.EventCount;
import com.pulseanalytics.domain.model.EventSearchCriteria;
import com.pulseanalytics.domain.model.EventView;
import com.pulseanalytics.domain.model.TimeBucket;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * AggregationIndex kept in memory, for tests that run the whole pipeline
 * without an OpenSearch cluster.
 */
public class InMemoryAggregationIndex implements AggregationIndex {
    
    private final Map<UUID, List<EventView>> documents = new ConcurrentHashMap<>();
    
    @Override
    public List<UUID> indexEvents(UUID tenantId, List<EventView> events) {
        documents.computeIfAbsent(tenantId, id -> new CopyOnWriteArrayList<>()).addAll(events);
        return List.of();
    }
    
    @Override
    public IndexSearchResult search(UUID tenantId, EventSearchCriteria criteria) {
        List<EventView> matches = tenantEvents(tenantId, criteria.getStartTime(), criteria.getEndTime())
                .filter(e -> criteria.getEventType() == null || criteria.getEventType().equals(e.getEventType()))
                .filter(e -> criteria.getUserId() == null || criteria.getUserId().equals(e.getUserId()))
                .filter(e -> criteria.getPropertyFilters().entrySet().stream()
                        .allMatch(f -> f.getValue().equals(String.valueOf(e.getProperties().get(f.getKey())))))
                .sorted(Comparator.comparing(EventView::getTimestamp).reversed())
                .collect(Collectors.toList());
        
        List<EventView> page = matches.stream()
                .skip(criteria.getOffset())
                .limit(criteria.getLimit())
                .collect(Collectors.toList());
        return new IndexSearchResult(page, matches.size(), 0);
    }
    
    @Override
    public IndexAggregation aggregate(UUID tenantId, Instant start, Instant end, BucketInterval interval, int topEvents) {
        List<EventView> inRange = tenantEvents(tenantId, start, end).collect(Collectors.toList());
        
        Map<Instant, Long> perBucket = inRange.stream()
                .collect(Collectors.groupingBy(e -> interval.truncate(e.getTimestamp()), TreeMap::new, Collectors.counting()));
        List<TimeBucket> buckets = perBucket.entrySet().stream()
                .map(entry -> new TimeBucket(entry.getKey(), entry.getValue()))
                .collect(Collectors.toList());
        
        List<EventCount> top = inRange.stream()
                .collect(Collectors.groupingBy(EventView::getEventType, Collectors.counting()))
                .entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
                .limit(topEvents)
                .map(entry -> new EventCount(entry.getKey(), entry.getValue()))
                .collect(Collectors.toList());
        
        return new IndexAggregation(inRange.size(), uniqueUsers(inRange), buckets, top);
    }
    
    @Override
    public StepCount countEventType(UUID tenantId, String eventType, Instant start, Instant end) {
        List<EventView> matches = tenantEvents(tenantId, start, end)
                .filter(e -> eventType.equals(e.getEventType()))
                .collect(Collectors.toList());
        return new StepCount(matches.size(), uniqueUsers(matches));
    }
    
    @Override
    public IndexHealth health() {
        return new IndexHealth("green", true, Map.of("documents", documentCount()));
    }
    
    public int documentCount() {
        return documents.values().stream().mapToInt(List::size).sum();
    }
    
    public void clear() {
        documents.clear();
    }
    
    private Stream<EventView> tenantEvents(UUID tenantId, Instant start, Instant end) {
        return documents.getOrDefault(tenantId, List.of()).stream()
                .filter(e -> tenantId.equals(e.getTenantId()))
                .filter(e -> start == null || !e.getTimestamp().isBefore(start))
                .filter(e -> end == null || !e.getTimestamp().isAfter(end));
    }
    
    private static long uniqueUsers(List<EventView> events) {
        return events.stream()
                .map(EventView::getUserId)
                .filter(Objects::nonNull)
                .distinct()
                .count();
    }
}
