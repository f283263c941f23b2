package com.pulseanalytics.domain.service;

import com.pulseanalytics.domain.exception.IndexUnavailableException;
import com.pulseanalytics.domain.exception.InvalidQueryException;
import com.pulseanalytics.domain.index.AggregationIndex;
import com.pulseanalytics.domain.index.IndexAggregation;
import com.pulseanalytics.domain.index.IndexSearchResult;
import com.pulseanalytics.domain.index.StepCount;
import com.pulseanalytics.domain.model.AnalyticsSummary;
import com.pulseanalytics.domain.model.BucketInterval;
import com.pulseanalytics.domain.model.EventQueryRequest;
import com.pulseanalytics.domain.model.EventQueryResponse;
import com.pulseanalytics.domain.model.EventSearchCriteria;
import com.pulseanalytics.domain.model.EventSearchResponse;
import com.pulseanalytics.domain.model.EventView;
import com.pulseanalytics.domain.model.FunnelReport;
import com.pulseanalytics.domain.model.FunnelStep;
import com.pulseanalytics.domain.model.TimeBucket;
import com.pulseanalytics.domain.model.UsageReport;
import com.pulseanalytics.infrastructure.cache.QueryCacheService;
import com.pulseanalytics.infrastructure.persistence.entity.EventEntity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Query and aggregation façade for dashboards and the API.
 * 
 * Every operation is read-only and scoped to the resolved tenant.
 * 
 * Sources:
 * - listEvents reads the relational store (simplified path)
 * - searchEvents, getAnalytics, getUsage and getFunnel read the aggregation index
 * 
 * Failure Handling:
 * - Any index error fails the whole query with IndexUnavailableException;
 *   no partial or degraded result is returned
 * 
 * Caching:
 * - Analytics, usage and funnel results are cached per tenant for
 *   app.cache.ttl.analytics seconds
 * - Search and listing are not cached (callers page through them)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryService {
    
    static final int TOP_EVENTS = 20;
    static final int MAX_BUCKETS = 10_000;
    static final int MAX_USAGE_DAYS = 365;
    static final String DEFAULT_FUNNEL_WINDOW = "1d";
    private static final String DEFAULT_BOUND = "default";
    private static final String OPEN_END = "now";
    
    private static final Pattern WINDOW = Pattern.compile("^(\\d{1,6})([mhdw])$");
    
    private final DurableEventStore eventStore;
    private final AggregationIndex aggregationIndex;
    private final QueryCacheService cacheService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    
    @Value("${app.cache.ttl.analytics:30}")
    private long analyticsTtl;
    
    @Value("${app.query.default-range-days:7}")
    private int defaultRangeDays;
    
    /**
     * Relational listing, newest first, limit/offset pagination.
     */
    public EventQueryResponse listEvents(UUID tenantId, EventQueryRequest request) {
        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();
        
        List<EventEntity> rows = eventStore.findEvents(tenantId, request);
        long total = eventStore.countEvents(tenantId, request);
        
        List<EventView> events = rows.stream().map(EventView::from).collect(Collectors.toList());
        long queryTime = System.currentTimeMillis() - startTime;
        
        sample.stop(Timer.builder("query.latency")
                .tag("type", "list")
                .register(meterRegistry));
        
        log.info("Listed {} of {} events for tenant {} in {} ms", events.size(), total, tenantId, queryTime);
        
        return EventQueryResponse.builder()
                .events(events)
                .count(events.size())
                .offset(request.getOffset())
                .limit(request.getLimit())
                .total(total)
                .queryTimeMs(queryTime)
                .build();
    }
    
    /**
     * Index-backed search. Filters are ANDed; sort is timestamp desc and not configurable.
     */
    public EventSearchResponse searchEvents(UUID tenantId, EventSearchCriteria criteria) {
        if (criteria.getStartTime() != null && criteria.getEndTime() != null
                && criteria.getStartTime().isAfter(criteria.getEndTime())) {
            throw new InvalidQueryException("start_date must not be after end_date");
        }
        
        Timer.Sample sample = Timer.start(meterRegistry);
        IndexSearchResult result = fromIndex("search", () -> aggregationIndex.search(tenantId, criteria));
        sample.stop(Timer.builder("query.latency")
                .tag("type", "search")
                .register(meterRegistry));
        
        return EventSearchResponse.builder()
                .events(result.getEvents())
                .total(result.getTotal())
                .count(result.getEvents().size())
                .latency(result.getTookMs())
                .build();
    }
    
    /**
     * Totals, unique users, zero-filled time series and top 20 event types.
     * 
     * Missing bounds default to the last app.query.default-range-days days.
     */
    public AnalyticsSummary getAnalytics(UUID tenantId, Instant start, Instant end, BucketInterval interval) {
        Instant rangeEnd = end != null ? end : clock.instant();
        Instant rangeStart = start != null ? start : rangeEnd.minus(defaultRangeDays, ChronoUnit.DAYS);
        BucketInterval bucketInterval = interval != null ? interval : BucketInterval.DAY;
        
        // Defaulted bounds move with the clock; key them by name so the TTL still applies
        String cacheKey = cacheService.tenantKey(tenantId, "analytics",
                start != null ? start : DEFAULT_BOUND, end != null ? end : OPEN_END, bucketInterval);
        Optional<AnalyticsSummary> cached = cacheService.get(cacheKey, AnalyticsSummary.class);
        if (cached.isPresent()) {
            countCache("analytics", "hit");
            return cached.get();
        }
        countCache("analytics", "miss");
        
        AnalyticsSummary summary = computeAnalytics(tenantId, rangeStart, rangeEnd, bucketInterval);
        cacheService.set(cacheKey, summary, analyticsTtl);
        return summary;
    }
    
    /**
     * Analytics for the last {@code days} days, one bucket per UTC day
     * (today included), plus the half-over-half growth rate.
     */
    public UsageReport getUsage(UUID tenantId, int days) {
        if (days < 1 || days > MAX_USAGE_DAYS) {
            throw new InvalidQueryException("days must be between 1 and " + MAX_USAGE_DAYS);
        }
        
        String cacheKey = cacheService.tenantKey(tenantId, "usage", days);
        Optional<UsageReport> cached = cacheService.get(cacheKey, UsageReport.class);
        if (cached.isPresent()) {
            countCache("usage", "hit");
            return cached.get();
        }
        countCache("usage", "miss");
        
        Instant now = clock.instant();
        Instant start = BucketInterval.DAY.truncate(now).minus(days - 1L, ChronoUnit.DAYS);
        AnalyticsSummary summary = computeAnalytics(tenantId, start, now, BucketInterval.DAY);
        
        UsageReport report = UsageReport.builder()
                .analytics(summary)
                .growthRate(growthRate(summary.getEventsOverTime()))
                .days(days)
                .build();
        
        cacheService.set(cacheKey, report, analyticsTtl);
        return report;
    }
    
    /**
     * Per-step counts for an ordered list of event types within [now - window, now].
     * 
     * Each step is counted independently. This is not a sequential funnel:
     * users at step N need not have done step N-1.
     */
    public FunnelReport getFunnel(UUID tenantId, List<String> eventTypes, String window) {
        if (eventTypes == null || eventTypes.isEmpty()) {
            throw new InvalidQueryException("At least one funnel step is required");
        }
        String funnelWindow = window == null || window.isBlank() ? DEFAULT_FUNNEL_WINDOW : window.trim();
        Duration windowDuration = parseWindow(funnelWindow);
        
        String cacheKey = cacheService.tenantKey(tenantId, "funnel", String.join(",", eventTypes), funnelWindow);
        Optional<FunnelReport> cached = cacheService.get(cacheKey, FunnelReport.class);
        if (cached.isPresent()) {
            countCache("funnel", "hit");
            return cached.get();
        }
        countCache("funnel", "miss");
        
        Instant end = clock.instant();
        Instant start = end.minus(windowDuration);
        
        Timer.Sample sample = Timer.start(meterRegistry);
        List<FunnelStep> steps = new ArrayList<>(eventTypes.size());
        for (int i = 0; i < eventTypes.size(); i++) {
            String eventType = eventTypes.get(i);
            StepCount stepCount = fromIndex("funnel",
                    () -> aggregationIndex.countEventType(tenantId, eventType, start, end));
            steps.add(FunnelStep.builder()
                    .step(i + 1)
                    .event(eventType)
                    .count(stepCount.getCount())
                    .uniqueUsers(stepCount.getUniqueUsers())
                    .build());
        }
        applyConversionRates(steps);
        sample.stop(Timer.builder("query.latency")
                .tag("type", "funnel")
                .register(meterRegistry));
        
        FunnelReport report = FunnelReport.builder()
                .funnel(steps)
                .window(funnelWindow)
                .build();
        
        cacheService.set(cacheKey, report, analyticsTtl);
        return report;
    }
    
    private AnalyticsSummary computeAnalytics(UUID tenantId, Instant start, Instant end, BucketInterval interval) {
        if (start.isAfter(end)) {
            throw new InvalidQueryException("start_date must not be after end_date");
        }
        long buckets = Duration.between(interval.truncate(start), end).toMillis() / interval.duration().toMillis() + 1;
        if (buckets > MAX_BUCKETS) {
            throw new InvalidQueryException(
                    "Range needs " + buckets + " " + interval.calendarName() + " buckets, limit is " + MAX_BUCKETS);
        }
        
        Timer.Sample sample = Timer.start(meterRegistry);
        IndexAggregation aggregation = fromIndex("analytics",
                () -> aggregationIndex.aggregate(tenantId, start, end, interval, TOP_EVENTS));
        sample.stop(Timer.builder("query.latency")
                .tag("type", "analytics")
                .register(meterRegistry));
        
        log.info("Analytics for tenant {}: {} events, {} buckets ({})",
                tenantId, aggregation.getTotalEvents(), buckets, interval.calendarName());
        
        return AnalyticsSummary.builder()
                .totalEvents(aggregation.getTotalEvents())
                .uniqueUsers(aggregation.getUniqueUsers())
                .eventsOverTime(zeroFill(aggregation.getBuckets(), start, end, interval))
                .topEvents(aggregation.getTopEvents().stream().limit(TOP_EVENTS).collect(Collectors.toList()))
                .interval(interval)
                .startTime(start)
                .endTime(end)
                .build();
    }
    
    private <T> T fromIndex(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (IndexUnavailableException e) {
            countIndexFailure(operation);
            throw e;
        } catch (RuntimeException e) {
            countIndexFailure(operation);
            throw new IndexUnavailableException("Aggregation index " + operation + " query failed", e);
        }
    }
    
    private void countIndexFailure(String operation) {
        Counter.builder("query.executed")
                .tag("type", operation)
                .tag("result", "error")
                .register(meterRegistry)
                .increment();
    }
    
    private void countCache(String type, String result) {
        Counter.builder("query.cache")
                .tag("type", type)
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
    
    /**
     * One bucket per interval step from the truncated start through end,
     * zero where the index reported nothing.
     */
    static List<TimeBucket> zeroFill(List<TimeBucket> reported, Instant start, Instant end, BucketInterval interval) {
        Map<Instant, Long> counts = new HashMap<>();
        if (reported != null) {
            for (TimeBucket bucket : reported) {
                counts.merge(interval.truncate(bucket.getDate()), bucket.getCount(), Long::sum);
            }
        }
        
        List<TimeBucket> series = new ArrayList<>();
        for (Instant t = interval.truncate(start); !t.isAfter(end); t = t.plus(interval.duration())) {
            series.add(new TimeBucket(t, counts.getOrDefault(t, 0L)));
        }
        return series;
    }
    
    /**
     * Percent change of the second half's total over the first half's.
     * 
     * The first half is the first n/2 buckets. Returns 0 when the first half
     * is empty rather than dividing by zero.
     */
    static double growthRate(List<TimeBucket> series) {
        if (series == null || series.size() < 2) {
            return 0;
        }
        int half = series.size() / 2;
        long firstHalf = 0;
        long secondHalf = 0;
        for (int i = 0; i < series.size(); i++) {
            if (i < half) {
                firstHalf += series.get(i).getCount();
            } else {
                secondHalf += series.get(i).getCount();
            }
        }
        if (firstHalf == 0) {
            return 0;
        }
        return round2((secondHalf - firstHalf) * 100.0 / firstHalf);
    }
    
    /**
     * Step 1 is always 100; step i is 100 * count[i] / count[0], or 0 when
     * step 1 has no events.
     */
    static void applyConversionRates(List<FunnelStep> steps) {
        if (steps.isEmpty()) {
            return;
        }
        long base = steps.get(0).getCount();
        for (int i = 0; i < steps.size(); i++) {
            FunnelStep step = steps.get(i);
            if (i == 0) {
                step.setConversionRate(100);
            } else {
                step.setConversionRate(base > 0 ? round2(step.getCount() * 100.0 / base) : 0);
            }
        }
    }
    
    static Duration parseWindow(String window) {
        Matcher matcher = WINDOW.matcher(window.toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw new InvalidQueryException("Unsupported funnel window: " + window + " (expected e.g. 30m, 12h, 1d, 2w)");
        }
        long amount = Long.parseLong(matcher.group(1));
        if (amount < 1) {
            throw new InvalidQueryException("Funnel window must be positive");
        }
        switch (matcher.group(2)) {
            case "m":
                return Duration.ofMinutes(amount);
            case "h":
                return Duration.ofHours(amount);
            case "d":
                return Duration.ofDays(amount);
            default:
                return Duration.ofDays(amount * 7);
        }
    }
    
    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
