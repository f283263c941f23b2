package com.pulseanalytics.infrastructure.search;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pulseanalytics.domain.exception.IndexUnavailableException;
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
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.opensearch.client.Request;
import org.opensearch.client.Response;
import org.opensearch.client.ResponseException;
import org.opensearch.client.RestClient;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * AggregationIndex on OpenSearch.
 * 
 * Layout:
 * - One index per tenant per UTC day: {prefix}-events-{tenantId}-{yyyy-MM-dd},
 *   chosen from the event's own timestamp
 * - Reads go to {prefix}-events-{tenantId}-* and still filter on tenant_id
 * - Documents use the event id as _id, so re-mirroring the same event
 *   overwrites instead of duplicating
 * 
 * Queries are plain JSON DSL bodies sent over the low-level REST client.
 * Backend errors surface as IndexUnavailableException. Reads share the
 * "opensearch" breaker; the bulk mirror uses "opensearch-mirror".
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpenSearchAggregationIndex implements AggregationIndex {
    
    private static final DateTimeFormatter INDEX_DAY =
            DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};
    
    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final OpenSearchProperties properties;
    
    /**
     * Install the index template for event indices.
     * 
     * A failure here is logged, not fatal: ingestion keeps working against
     * the relational store and the mirror simply fails until the cluster is back.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void initializeTemplates() {
        if (!properties.isInitializeTemplates()) {
            return;
        }
        try {
            Request request = new Request("PUT", "/_index_template/" + properties.getIndexPrefix() + "-events");
            request.setJsonEntity(write(eventTemplate()));
            perform(request, "template install");
            log.info("OpenSearch index template installed for {}-events-*", properties.getIndexPrefix());
        } catch (IndexUnavailableException e) {
            log.error("OpenSearch template install failed, aggregations may use dynamic mappings: {}", e.getMessage());
        }
    }
    
    /**
     * Writes go through their own breaker so a failing mirror never opens
     * the one guarding reads. Per-document rejections (mapping conflicts)
     * come back as a return value and do not count as breaker failures.
     */
    @Override
    @CircuitBreaker(name = "opensearch-mirror")
    public List<UUID> indexEvents(UUID tenantId, List<EventView> events) {
        if (events.isEmpty()) {
            return List.of();
        }
        
        StringBuilder body = new StringBuilder();
        for (EventView event : events) {
            ObjectNode action = objectMapper.createObjectNode();
            action.putObject("index")
                    .put("_index", eventIndex(tenantId, event.getTimestamp()))
                    .put("_id", event.getId().toString());
            body.append(write(action)).append('\n');
            body.append(write(toDocument(tenantId, event))).append('\n');
        }
        
        Request request = new Request("POST", "/_bulk");
        request.setJsonEntity(body.toString());
        JsonNode response = perform(request, "bulk index");
        
        if (!response.path("errors").asBoolean(false)) {
            log.debug("Indexed {} event(s) for tenant {}", events.size(), tenantId);
            return List.of();
        }
        
        List<UUID> rejected = new ArrayList<>();
        JsonNode items = response.path("items");
        for (int i = 0; i < items.size(); i++) {
            JsonNode result = items.get(i).path("index");
            JsonNode error = result.path("error");
            if (error.isMissingNode() || error.isNull()) {
                continue;
            }
            // Bulk items come back in request order; _id is the event id
            UUID id = i < events.size() ? events.get(i).getId() : uuidOrNull(result.path("_id"));
            rejected.add(id);
            log.warn("OpenSearch rejected event {} for tenant {}: {}",
                    id, tenantId, error.path("reason").asText(error.toString()));
        }
        return rejected;
    }
    
    @Override
    @CircuitBreaker(name = "opensearch")
    public IndexSearchResult search(UUID tenantId, EventSearchCriteria criteria) {
        ObjectNode body = objectMapper.createObjectNode();
        ArrayNode must = tenantFilter(body, tenantId);
        term(must, "event_type", criteria.getEventType());
        term(must, "user_id", criteria.getUserId());
        range(must, criteria.getStartTime(), criteria.getEndTime());
        if (criteria.getPropertyFilters() != null) {
            criteria.getPropertyFilters().forEach((key, value) -> term(must, "properties." + key, value));
        }
        body.putArray("sort").addObject().putObject("timestamp").put("order", "desc");
        body.put("size", criteria.getLimit());
        body.put("from", criteria.getOffset());
        body.put("track_total_hits", true);
        
        JsonNode response = perform(searchRequest(tenantId, body), "search");
        
        List<EventView> events = new ArrayList<>();
        for (JsonNode hit : response.path("hits").path("hits")) {
            events.add(fromDocument(hit.path("_source")));
        }
        
        return IndexSearchResult.builder()
                .events(events)
                .total(response.path("hits").path("total").path("value").asLong(0))
                .tookMs(response.path("took").asLong(0))
                .build();
    }
    
    @Override
    @CircuitBreaker(name = "opensearch")
    public IndexAggregation aggregate(UUID tenantId, Instant start, Instant end, BucketInterval interval, int topEvents) {
        ObjectNode body = objectMapper.createObjectNode();
        ArrayNode must = tenantFilter(body, tenantId);
        range(must, start, end);
        body.put("size", 0);
        body.put("track_total_hits", true);
        
        ObjectNode aggs = body.putObject("aggs");
        ObjectNode histogram = aggs.putObject("events_over_time").putObject("date_histogram");
        histogram.put("field", "timestamp");
        histogram.put("calendar_interval", interval.calendarName());
        histogram.put("time_zone", "UTC");
        histogram.put("min_doc_count", 0);
        histogram.putObject("extended_bounds")
                .put("min", interval.truncate(start).toEpochMilli())
                .put("max", end.toEpochMilli());
        aggs.putObject("top_events").putObject("terms")
                .put("field", "event_type")
                .put("size", topEvents);
        aggs.putObject("unique_users").putObject("cardinality")
                .put("field", "user_id");
        
        JsonNode response = perform(searchRequest(tenantId, body), "aggregate");
        JsonNode aggregations = response.path("aggregations");
        
        List<TimeBucket> buckets = new ArrayList<>();
        for (JsonNode bucket : aggregations.path("events_over_time").path("buckets")) {
            buckets.add(new TimeBucket(
                    Instant.ofEpochMilli(bucket.path("key").asLong()),
                    bucket.path("doc_count").asLong(0)));
        }
        
        List<EventCount> top = new ArrayList<>();
        for (JsonNode bucket : aggregations.path("top_events").path("buckets")) {
            top.add(new EventCount(bucket.path("key").asText(), bucket.path("doc_count").asLong(0)));
        }
        
        return IndexAggregation.builder()
                .totalEvents(response.path("hits").path("total").path("value").asLong(0))
                .uniqueUsers(aggregations.path("unique_users").path("value").asLong(0))
                .buckets(buckets)
                .topEvents(top)
                .build();
    }
    
    @Override
    @CircuitBreaker(name = "opensearch")
    public StepCount countEventType(UUID tenantId, String eventType, Instant start, Instant end) {
        ObjectNode body = objectMapper.createObjectNode();
        ArrayNode must = tenantFilter(body, tenantId);
        term(must, "event_type", eventType);
        range(must, start, end);
        body.put("size", 0);
        body.put("track_total_hits", true);
        body.putObject("aggs").putObject("unique_users").putObject("cardinality").put("field", "user_id");
        
        JsonNode response = perform(searchRequest(tenantId, body), "funnel step");
        
        return StepCount.builder()
                .count(response.path("hits").path("total").path("value").asLong(0))
                .uniqueUsers(response.path("aggregations").path("unique_users").path("value").asLong(0))
                .build();
    }
    
    @Override
    public IndexHealth health() {
        try {
            JsonNode response = perform(new Request("GET", "/_cluster/health"), "health");
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("clusterName", response.path("cluster_name").asText());
            details.put("numberOfNodes", response.path("number_of_nodes").asInt());
            details.put("activeShards", response.path("active_shards").asInt());
            String status = response.path("status").asText("unknown");
            return IndexHealth.builder()
                    .status(status)
                    .available(!"red".equals(status))
                    .details(details)
                    .build();
        } catch (IndexUnavailableException e) {
            log.warn("OpenSearch health check failed: {}", e.getMessage());
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("error", e.getMessage());
            return IndexHealth.builder()
                    .status("unreachable")
                    .available(false)
                    .details(details)
                    .build();
        }
    }
    
    String eventIndex(UUID tenantId, Instant timestamp) {
        return properties.getIndexPrefix() + "-events-" + tenantId + "-" + INDEX_DAY.format(timestamp);
    }
    
    String tenantPattern(UUID tenantId) {
        return properties.getIndexPrefix() + "-events-" + tenantId + "-*";
    }
    
    private Request searchRequest(UUID tenantId, ObjectNode body) {
        Request request = new Request("POST", "/" + tenantPattern(tenantId) + "/_search");
        // A tenant with no events yet has no indices: empty result, not an error
        request.addParameter("ignore_unavailable", "true");
        request.addParameter("allow_no_indices", "true");
        request.setJsonEntity(write(body));
        return request;
    }
    
    private ArrayNode tenantFilter(ObjectNode body, UUID tenantId) {
        ArrayNode must = body.putObject("query").putObject("bool").putArray("must");
        must.addObject().putObject("term").put("tenant_id", tenantId.toString());
        return must;
    }
    
    private static void term(ArrayNode must, String field, String value) {
        if (value != null && !value.isBlank()) {
            must.addObject().putObject("term").put(field, value);
        }
    }
    
    private static void range(ArrayNode must, Instant start, Instant end) {
        if (start == null && end == null) {
            return;
        }
        ObjectNode bounds = must.addObject().putObject("range").putObject("timestamp");
        if (start != null) {
            bounds.put("gte", start.toString());
        }
        if (end != null) {
            bounds.put("lte", end.toString());
        }
    }
    
    private ObjectNode toDocument(UUID tenantId, EventView event) {
        ObjectNode document = objectMapper.createObjectNode();
        document.put("event_id", event.getId().toString());
        document.put("tenant_id", tenantId.toString());
        document.put("event_type", event.getEventType());
        document.put("user_id", event.getUserId());
        document.put("session_id", event.getSessionId());
        document.put("timestamp", event.getTimestamp().toString());
        document.put("created_at", event.getCreatedAt() != null ? event.getCreatedAt().toString() : null);
        document.set("properties", objectMapper.valueToTree(
                event.getProperties() != null ? event.getProperties() : Map.of()));
        return document;
    }
    
    private EventView fromDocument(JsonNode source) {
        return EventView.builder()
                .id(uuidOrNull(source.path("event_id")))
                .tenantId(uuidOrNull(source.path("tenant_id")))
                .eventType(textOrNull(source.path("event_type")))
                .userId(textOrNull(source.path("user_id")))
                .sessionId(textOrNull(source.path("session_id")))
                .timestamp(instantOrNull(source.path("timestamp")))
                .createdAt(instantOrNull(source.path("created_at")))
                .properties(source.path("properties").isObject()
                        ? objectMapper.convertValue(source.path("properties"), MAP_TYPE)
                        : new LinkedHashMap<>())
                .build();
    }
    
    private ObjectNode eventTemplate() {
        ObjectNode template = objectMapper.createObjectNode();
        template.putArray("index_patterns").add(properties.getIndexPrefix() + "-events-*");
        
        ObjectNode inner = template.putObject("template");
        inner.putObject("settings")
                .put("number_of_shards", properties.getNumberOfShards())
                .put("number_of_replicas", properties.getNumberOfReplicas())
                .put("index.refresh_interval", "5s");
        
        ObjectNode mappings = inner.putObject("mappings");
        // String properties are exact-match filters, not full text
        mappings.putArray("dynamic_templates").addObject()
                .putObject("property_strings")
                .put("path_match", "properties.*")
                .put("match_mapping_type", "string")
                .putObject("mapping").put("type", "keyword");
        
        ObjectNode fields = mappings.putObject("properties");
        for (String keyword : List.of("event_id", "tenant_id", "event_type", "user_id", "session_id")) {
            fields.putObject(keyword).put("type", "keyword");
        }
        fields.putObject("timestamp").put("type", "date");
        fields.putObject("created_at").put("type", "date");
        fields.putObject("properties").put("type", "object").put("dynamic", true);
        return template;
    }
    
    private JsonNode perform(Request request, String operation) {
        try {
            Response response = restClient.performRequest(request);
            if (response.getEntity() == null) {
                return objectMapper.createObjectNode();
            }
            try (InputStream content = response.getEntity().getContent()) {
                return objectMapper.readTree(content);
            }
        } catch (ResponseException e) {
            throw new IndexUnavailableException(
                    "OpenSearch " + operation + " rejected with HTTP " + e.getResponse().getStatusLine().getStatusCode(), e);
        } catch (IOException e) {
            throw new IndexUnavailableException("OpenSearch " + operation + " failed: " + e.getMessage(), e);
        }
    }
    
    private String write(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize OpenSearch request body", e);
        }
    }
    
    private static String textOrNull(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }
    
    private static UUID uuidOrNull(JsonNode node) {
        String text = textOrNull(node);
        return text == null ? null : UUID.fromString(text);
    }
    
    private static Instant instantOrNull(JsonNode node) {
        String text = textOrNull(node);
        return text == null ? null : Instant.parse(text);
    }
}
