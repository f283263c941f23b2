package com.pulseanalytics.api;

import com.pulseanalytics.api.dto.DashboardConfig;
import com.pulseanalytics.domain.exception.InvalidQueryException;
import com.pulseanalytics.domain.model.AnalyticsSummary;
import com.pulseanalytics.domain.model.BucketInterval;
import com.pulseanalytics.domain.model.EventQueryRequest;
import com.pulseanalytics.domain.model.EventQueryResponse;
import com.pulseanalytics.domain.model.EventSearchCriteria;
import com.pulseanalytics.domain.model.EventSearchResponse;
import com.pulseanalytics.domain.model.FunnelReport;
import com.pulseanalytics.domain.model.UsageReport;
import com.pulseanalytics.domain.service.QueryService;
import com.pulseanalytics.domain.service.TenantResolver;
import com.pulseanalytics.infrastructure.persistence.entity.TenantEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * REST API for event queries and dashboard analytics.
 * 
 * Endpoints:
 * - GET /events - List events from the relational store
 * - GET /events/search - Search events in the aggregation index
 * - GET /analytics - Totals, unique users, time series, top events
 * - GET /analytics/usage - Last N days plus growth rate
 * - GET /analytics/funnel - Per-step counts for an ordered list of events
 * - GET /dashboard/config - Tenant info for the dashboard
 * 
 * Dates accept a full ISO-8601 instant or a plain date (yyyy-MM-dd). A plain
 * end date covers that whole day.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class AnalyticsController {
    
    private static final String PROPERTY_PARAM_PREFIX = "property.";
    
    private final QueryService queryService;
    private final TenantResolver tenantResolver;
    
    @Value("${app.query.default-range-days:7}")
    private int defaultRangeDays;
    
    /**
     * GET /events?event_type=xxx&user_id=xxx&start_date=xxx&end_date=xxx&limit=100&offset=0
     * 
     * Newest first. limit defaults to 100 (max 1000).
     */
    @GetMapping("/events")
    public ResponseEntity<EventQueryResponse> listEvents(
            @RequestAttribute(TenantAuthInterceptor.TENANT_ATTRIBUTE) UUID tenantId,
            @RequestParam(name = "event_type", required = false) String eventType,
            @RequestParam(name = "user_id", required = false) String userId,
            @RequestParam(name = "start_date", required = false) String startDate,
            @RequestParam(name = "end_date", required = false) String endDate,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {
        
        log.info("List events: tenant={}, eventType={}, limit={}, offset={}", tenantId, eventType, limit, offset);
        
        EventQueryRequest request = EventQueryRequest.builder()
                .eventType(blankToNull(eventType))
                .userId(blankToNull(userId))
                .startTime(parseTime(startDate, false))
                .endTime(parseTime(endDate, true))
                .limit(limit)
                .offset(offset)
                .build();
        
        return ResponseEntity.ok(queryService.listEvents(tenantId, request));
    }
    
    /**
     * GET /events/search?event_type=xxx&user_id=xxx&property.plan=premium&limit=50
     * 
     * Every property.{key}=value parameter adds an exact-match filter on
     * that event property. All filters are ANDed.
     */
    @GetMapping("/events/search")
    public ResponseEntity<EventSearchResponse> searchEvents(
            @RequestAttribute(TenantAuthInterceptor.TENANT_ATTRIBUTE) UUID tenantId,
            @RequestParam Map<String, String> params) {
        
        Map<String, String> propertyFilters = new LinkedHashMap<>();
        params.forEach((name, value) -> {
            if (name.startsWith(PROPERTY_PARAM_PREFIX) && name.length() > PROPERTY_PARAM_PREFIX.length()) {
                propertyFilters.put(name.substring(PROPERTY_PARAM_PREFIX.length()), value);
            }
        });
        
        EventSearchCriteria criteria = EventSearchCriteria.builder()
                .eventType(blankToNull(params.get("event_type")))
                .userId(blankToNull(params.get("user_id")))
                .startTime(parseTime(params.get("start_date"), false))
                .endTime(parseTime(params.get("end_date"), true))
                .propertyFilters(propertyFilters)
                .limit(parseInt(params.get("limit"), "limit"))
                .offset(parseInt(params.get("offset"), "offset"))
                .build();
        
        log.info("Search events: tenant={}, eventType={}, propertyFilters={}",
                tenantId, criteria.getEventType(), propertyFilters.keySet());
        
        return ResponseEntity.ok(queryService.searchEvents(tenantId, criteria));
    }
    
    /**
     * GET /analytics?start_date=xxx&end_date=xxx&interval=hour
     * 
     * interval: minute | hour | day (default day). Range defaults to the last 7 days.
     */
    @GetMapping("/analytics")
    public ResponseEntity<AnalyticsSummary> analytics(
            @RequestAttribute(TenantAuthInterceptor.TENANT_ATTRIBUTE) UUID tenantId,
            @RequestParam(name = "start_date", required = false) String startDate,
            @RequestParam(name = "end_date", required = false) String endDate,
            @RequestParam(required = false) String interval) {
        
        log.info("Analytics: tenant={}, start={}, end={}, interval={}", tenantId, startDate, endDate, interval);
        
        return ResponseEntity.ok(queryService.getAnalytics(
                tenantId,
                parseTime(startDate, false),
                parseTime(endDate, true),
                BucketInterval.parse(interval)));
    }
    
    /**
     * GET /analytics/usage?days=7
     */
    @GetMapping("/analytics/usage")
    public ResponseEntity<UsageReport> usage(
            @RequestAttribute(TenantAuthInterceptor.TENANT_ATTRIBUTE) UUID tenantId,
            @RequestParam(defaultValue = "7") int days) {
        
        log.info("Usage: tenant={}, days={}", tenantId, days);
        
        return ResponseEntity.ok(queryService.getUsage(tenantId, days));
    }
    
    /**
     * GET /analytics/funnel?events=page_view,signup,purchase&window=7d
     * 
     * Steps are counted independently (see FunnelReport).
     */
    @GetMapping("/analytics/funnel")
    public ResponseEntity<FunnelReport> funnel(
            @RequestAttribute(TenantAuthInterceptor.TENANT_ATTRIBUTE) UUID tenantId,
            @RequestParam(required = false) String events,
            @RequestParam(required = false) String window) {
        
        List<String> steps = events == null
                ? List.of()
                : Arrays.stream(events.split(","))
                        .map(String::trim)
                        .filter(step -> !step.isEmpty())
                        .collect(Collectors.toList());
        
        log.info("Funnel: tenant={}, steps={}, window={}", tenantId, steps, window);
        
        return ResponseEntity.ok(queryService.getFunnel(tenantId, steps, window));
    }
    
    /**
     * GET /dashboard/config
     */
    @GetMapping("/dashboard/config")
    public ResponseEntity<DashboardConfig> dashboardConfig(
            @RequestAttribute(TenantAuthInterceptor.TENANT_ATTRIBUTE) UUID tenantId) {
        
        TenantEntity tenant = tenantResolver.describe(tenantId);
        
        return ResponseEntity.ok(DashboardConfig.builder()
                .tenantId(tenant.getId())
                .tenantName(tenant.getName())
                .streamPath("/events/stream")
                .defaultRangeDays(defaultRangeDays)
                .intervals(Arrays.stream(BucketInterval.values())
                        .map(BucketInterval::calendarName)
                        .collect(Collectors.toList()))
                .build());
    }
    
    static Instant parseTime(String value, boolean endOfDay) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = value.trim();
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException notInstant) {
            try {
                return OffsetDateTime.parse(text).toInstant();
            } catch (DateTimeParseException notOffset) {
                try {
                    LocalDate date = LocalDate.parse(text);
                    return endOfDay
                            ? date.plusDays(1).atStartOfDay().toInstant(ZoneOffset.UTC).minusMillis(1)
                            : date.atStartOfDay().toInstant(ZoneOffset.UTC);
                } catch (DateTimeParseException e) {
                    throw new InvalidQueryException("Invalid date: " + value);
                }
            }
        }
    }
    
    private static Integer parseInt(String value, String name) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidQueryException(name + " must be a number");
        }
    }
    
    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
