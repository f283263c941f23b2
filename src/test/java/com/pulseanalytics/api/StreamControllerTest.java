package com.pulseanalytics.api;

import com.pulseanalytics.domain.exception.InvalidCredentialException;
import com.pulseanalytics.domain.exception.UnauthenticatedException;
import com.pulseanalytics.domain.realtime.EventChannel;
import com.pulseanalytics.domain.realtime.RealtimeFanoutHub;
import com.pulseanalytics.domain.service.TenantResolver;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * The stream endpoint is opened by EventSource clients, which always ask for
 * text/event-stream; auth errors must still come back as 401 JSON.
 */
@WebMvcTest(controllers = StreamController.class)
class StreamControllerTest {

    private static final String API_KEY = "test-api-key-123";
    private static final UUID TENANT = UUID.fromString("33333333-3333-3333-3333-333333333333");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TenantResolver tenantResolver;

    @MockBean
    private RealtimeFanoutHub fanoutHub;

    @Test
    void testStream_MissingApiKeyIs401() throws Exception {
        // Given
        when(tenantResolver.resolve(isNull())).thenThrow(new UnauthenticatedException());

        // When / Then
        mockMvc.perform(get("/events/stream").accept(MediaType.TEXT_EVENT_STREAM))
                .andExpect(status().isUnauthorized())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.code").value("UNAUTHENTICATED"));

        verifyNoInteractions(fanoutHub);
    }

    @Test
    void testStream_UnknownApiKeyIs401() throws Exception {
        // Given
        when(tenantResolver.resolve("nope")).thenThrow(new InvalidCredentialException());

        // When / Then
        mockMvc.perform(get("/events/stream")
                        .param(TenantAuthInterceptor.API_KEY_PARAM, "nope")
                        .accept(MediaType.TEXT_EVENT_STREAM))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_CREDENTIAL"));

        verifyNoInteractions(fanoutHub);
    }

    @Test
    void testStream_RegistersWithHub() throws Exception {
        // Given
        when(tenantResolver.resolve(API_KEY)).thenReturn(TENANT);
        when(fanoutHub.register(eq(TENANT), any(EventChannel.class))).thenReturn("conn-1");

        // When / Then
        mockMvc.perform(get("/events/stream")
                        .param(TenantAuthInterceptor.API_KEY_PARAM, API_KEY)
                        .accept(MediaType.TEXT_EVENT_STREAM))
                .andExpect(request().asyncStarted());

        verify(fanoutHub).register(eq(TENANT), any(EventChannel.class));
    }
}
