package com.pulseanalytics.api;

import com.pulseanalytics.domain.exception.IndexUnavailableException;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = AnalyticsController.class)
class AnalyticsControllerTest {
    
    private static final String API_KEY = "demo-api-key-456";
    private static final UUID TENANT = UUID.fromString("33333333-3333-3333-3333-333333333333");
    
    @Autowired
    private MockMvc mockMvc;
    
    @MockBean
    private TenantResolver tenantResolver;
    
    @MockBean
    private QueryService queryService;
    
    @BeforeEach
    void setUp() {
        when(tenantResolver.resolve(API_KEY)).thenReturn(TENANT);
    }
    
    @Test
    void testListEvents_ParsesFilters() throws Exception {
        // Given
        when(queryService.listEvents(eq(TENANT), any())).thenReturn(EventQueryResponse.builder()
                .events(List.of())
                .limit(50)
                .build());
        
        // When
        mockMvc.perform(get("/events")
                        .header(TenantAuthInterceptor.API_KEY_HEADER, API_KEY)
                        .param("event_type", "signup")
                        .param("start_date", "2024-03-01")
                        .param("end_date", "2024-03-02")
                        .param("limit", "50"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.limit").value(50));
        
        // Then: a plain end date covers that whole day
        ArgumentCaptor<EventQueryRequest> request = ArgumentCaptor.forClass(EventQueryRequest.class);
        verify(queryService).listEvents(eq(TENANT), request.capture());
        assertEquals("signup", request.getValue().getEventType());
        assertEquals(Instant.parse("2024-03-01T00:00:00Z"), request.getValue().getStartTime());
        assertEquals(Instant.parse("2024-03-02T23:59:59.999Z"), request.getValue().getEndTime());
        assertEquals(50, request.getValue().getLimit());
    }
    
    @Test
    void testSearchEvents_PropertyFilters() throws Exception {
        // Given
        when(queryService.searchEvents(eq(TENANT), any())).thenReturn(EventSearchResponse.builder()
                .events(List.of())
                .total(0)
                .build());
        
        // When
        mockMvc.perform(get("/events/search")
                        .header(TenantAuthInterceptor.API_KEY_HEADER, API_KEY)
                        .param("user_id", "u1")
                        .param("property.plan", "premium")
                        .param("property.country", "DE"))
                .andExpect(status().isOk());
        
        // Then
        ArgumentCaptor<EventSearchCriteria> criteria = ArgumentCaptor.forClass(EventSearchCriteria.class);
        verify(queryService).searchEvents(eq(TENANT), criteria.capture());
        assertEquals("u1", criteria.getValue().getUserId());
        assertNull(criteria.getValue().getEventType());
        assertEquals(Map.of("plan", "premium", "country", "DE"), criteria.getValue().getPropertyFilters());
    }
    
    @Test
    void testAnalytics_UnsupportedInterval() throws Exception {
        mockMvc.perform(get("/analytics")
                        .header(TenantAuthInterceptor.API_KEY_HEADER, API_KEY)
                        .param("interval", "week"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_QUERY"));
        
        verifyNoInteractions(queryService);
    }
    
    @Test
    void testAnalytics_InvalidDate() throws Exception {
        mockMvc.perform(get("/analytics")
                        .header(TenantAuthInterceptor.API_KEY_HEADER, API_KEY)
                        .param("start_date", "last tuesday"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_QUERY"));
    }
    
    @Test
    void testAnalytics_IndexUnavailable() throws Exception {
        // Given
        when(queryService.getAnalytics(eq(TENANT), any(), any(), eq(BucketInterval.HOUR)))
                .thenThrow(new IndexUnavailableException("Aggregation index analytics query failed"));
        
        // When / Then
        mockMvc.perform(get("/analytics")
                        .header(TenantAuthInterceptor.API_KEY_HEADER, API_KEY)
                        .param("interval", "hour"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("AGGREGATION_UNAVAILABLE"));
    }
    
    @Test
    void testAnalytics_Ok() throws Exception {
        // Given
        when(queryService.getAnalytics(eq(TENANT), isNull(), isNull(), eq(BucketInterval.DAY)))
                .thenReturn(AnalyticsSummary.builder()
                        .totalEvents(2)
                        .uniqueUsers(2)
                        .eventsOverTime(List.of())
                        .topEvents(List.of())
                        .interval(BucketInterval.DAY)
                        .build());
        
        // When / Then
        mockMvc.perform(get("/analytics")
                        .header(TenantAuthInterceptor.API_KEY_HEADER, API_KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalEvents").value(2))
                .andExpect(jsonPath("$.uniqueUsers").value(2));
    }
    
    @Test
    void testUsage_FlattensAnalyticsFields() throws Exception {
        // Given
        when(queryService.getUsage(TENANT, 14)).thenReturn(UsageReport.builder()
                .analytics(AnalyticsSummary.builder()
                        .totalEvents(10)
                        .eventsOverTime(List.of())
                        .topEvents(List.of())
                        .build())
                .growthRate(12.5)
                .days(14)
                .build());
        
        // When / Then
        mockMvc.perform(get("/analytics/usage")
                        .header(TenantAuthInterceptor.API_KEY_HEADER, API_KEY)
                        .param("days", "14"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalEvents").value(10))
                .andExpect(jsonPath("$.growthRate").value(12.5))
                .andExpect(jsonPath("$.days").value(14));
    }
    
    @Test
    void testUsage_NonNumericDays() throws Exception {
        mockMvc.perform(get("/analytics/usage")
                        .header(TenantAuthInterceptor.API_KEY_HEADER, API_KEY)
                        .param("days", "seven"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_QUERY"));
    }
    
    @Test
    void testFunnel_SplitsSteps() throws Exception {
        // Given
        when(queryService.getFunnel(eq(TENANT), anyList(), any()))
                .thenReturn(FunnelReport.builder().funnel(List.of()).window("7d").build());
        
        // When
        mockMvc.perform(get("/analytics/funnel")
                        .header(TenantAuthInterceptor.API_KEY_HEADER, API_KEY)
                        .param("events", "page_view, signup,,purchase")
                        .param("window", "7d"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.window").value("7d"));
        
        // Then
        verify(queryService).getFunnel(TENANT, List.of("page_view", "signup", "purchase"), "7d");
    }
    
    @Test
    void testDashboardConfig() throws Exception {
        // Given
        when(tenantResolver.describe(TENANT)).thenReturn(TenantEntity.builder()
                .id(TENANT)
                .name("Demo Corp")
                .apiKey(API_KEY)
                .build());
        
        // When / Then
        mockMvc.perform(get("/dashboard/config")
                        .header(TenantAuthInterceptor.API_KEY_HEADER, API_KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tenantName").value("Demo Corp"))
                .andExpect(jsonPath("$.streamPath").value("/events/stream"))
                .andExpect(jsonPath("$.defaultRangeDays").value(7))
                .andExpect(jsonPath("$.intervals[1]").value("hour"));
    }
}
