package com.pulseanalytics.domain.index;

import com.pulseanalytics.domain.model.BucketInterval;
import com.pulseanalytics.domain.model.EventSearchCriteria;
import com.pulseanalytics.domain.model.EventView;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Secondary store optimised for filtering and aggregation.
 * 
 * Every call is scoped to one tenant. Implementations throw
 * IndexUnavailableException for any backend failure; callers decide whether
 * that is fatal (queries) or not (ingestion mirror).
 */
public interface AggregationIndex {
    
    /**
     * Index already-committed events. One document per event.
     * 
     * @return ids of events the index refused individually (for example a
     *         field mapping conflict); empty when every document was accepted.
     *         A failure of the whole request is thrown instead.
     */
    List<UUID> indexEvents(UUID tenantId, List<EventView> events);
    
    IndexSearchResult search(UUID tenantId, EventSearchCriteria criteria);
    
    /**
     * Totals, unique users, histogram and top event types for [start, end].
     * The histogram may omit empty buckets.
     */
    IndexAggregation aggregate(UUID tenantId, Instant start, Instant end, BucketInterval interval, int topEvents);
    
    /**
     * Occurrences and distinct users of one event type in [start, end].
     */
    StepCount countEventType(UUID tenantId, String eventType, Instant start, Instant end);
    
    IndexHealth health();
}
