package com.pulseanalytics.domain.realtime;

import com.pulseanalytics.domain.model.EventView;
import com.pulseanalytics.domain.model.StreamMessage;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RealtimeFanoutHubTest {
    
    private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");
    private static final UUID TENANT_A = UUID.randomUUID();
    private static final UUID TENANT_B = UUID.randomUUID();
    
    @Mock
    private TaskScheduler taskScheduler;
    
    @Mock
    private ScheduledFuture<Object> heartbeat;
    
    private MeterRegistry meterRegistry;
    private RealtimeFanoutHub hub;
    
    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        lenient().doReturn(heartbeat).when(taskScheduler)
                .scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        hub = new RealtimeFanoutHub(taskScheduler, Clock.fixed(NOW, ZoneOffset.UTC), meterRegistry, 30_000);
    }
    
    @Test
    void testRegister_AcknowledgesThenSchedulesHeartbeat() {
        // Given
        RecordingChannel channel = new RecordingChannel();
        
        // When
        String connectionId = hub.register(TENANT_A, channel);
        
        // Then
        assertEquals(1, channel.messages.size());
        assertEquals(StreamMessage.CONNECTED, channel.messages.get(0).getType());
        assertEquals(connectionId, channel.messages.get(0).getConnectionId());
        assertEquals(1, hub.connectionCount(TENANT_A));
        
        verify(taskScheduler).scheduleAtFixedRate(any(Runnable.class),
                eq(NOW.plus(Duration.ofSeconds(30))), eq(Duration.ofSeconds(30)));
    }
    
    @Test
    void testRegister_ChannelClosedBeforeAck() {
        // Given
        RecordingChannel channel = new RecordingChannel();
        channel.failing = true;
        
        // When
        hub.register(TENANT_A, channel);
        
        // Then
        assertEquals(0, hub.connectionCount());
        assertTrue(channel.closed);
        verifyNoInteractions(taskScheduler);
    }
    
    @Test
    void testBroadcast_OnlyReachesSameTenant() {
        // Given
        RecordingChannel a1 = new RecordingChannel();
        RecordingChannel a2 = new RecordingChannel();
        RecordingChannel b1 = new RecordingChannel();
        hub.register(TENANT_A, a1);
        hub.register(TENANT_A, a2);
        hub.register(TENANT_B, b1);
        
        // When
        int delivered = hub.broadcast(TENANT_A, event(TENANT_A, "signup"));
        
        // Then
        assertEquals(2, delivered);
        assertEquals(StreamMessage.EVENT, a1.last().getType());
        assertEquals("signup", a1.last().getData().getEventType());
        assertEquals("signup", a2.last().getData().getEventType());
        
        // Tenant B only ever saw its own ack
        assertEquals(1, b1.messages.size());
        assertEquals(StreamMessage.CONNECTED, b1.last().getType());
    }
    
    @Test
    void testBroadcast_RefusesEventOfAnotherTenant() {
        // Given
        RecordingChannel a1 = new RecordingChannel();
        hub.register(TENANT_A, a1);
        
        // When
        int delivered = hub.broadcast(TENANT_A, event(TENANT_B, "leak"));
        
        // Then
        assertEquals(0, delivered);
        assertEquals(1, a1.messages.size());
    }
    
    @Test
    void testBroadcast_BrokenChannelIsDropped() {
        // Given
        RecordingChannel healthy = new RecordingChannel();
        RecordingChannel other = new RecordingChannel();
        RecordingChannel broken = new RecordingChannel();
        hub.register(TENANT_A, healthy);
        hub.register(TENANT_A, other);
        String brokenId = hub.register(TENANT_A, broken);
        broken.failing = true;
        
        // When
        int delivered = hub.broadcast(TENANT_A, event(TENANT_A, "purchase"));
        
        // Then
        assertEquals(2, delivered);
        assertEquals("purchase", healthy.last().getData().getEventType());
        assertEquals("purchase", other.last().getData().getEventType());
        assertTrue(broken.closed);
        assertEquals(2, hub.connectionCount(TENANT_A));
        assertFalse(hub.unregister(brokenId));
        assertEquals(1.0, meterRegistry.counter("stream.delivery.failures").count());
        verify(heartbeat).cancel(false);
    }
    
    @Test
    void testUnregister_IsIdempotent() {
        // Given
        String connectionId = hub.register(TENANT_A, new RecordingChannel());
        
        // When / Then
        assertTrue(hub.unregister(connectionId));
        assertFalse(hub.unregister(connectionId));
        assertFalse(hub.unregister("never-registered"));
        assertEquals(0, hub.connectionCount());
        verify(heartbeat, times(1)).cancel(false);
    }
    
    @Test
    void testPulse_SendsHeartbeat() {
        // Given
        RecordingChannel channel = new RecordingChannel();
        String connectionId = hub.register(TENANT_A, channel);
        
        // When
        hub.pulse(connectionId);
        
        // Then
        assertEquals(StreamMessage.HEARTBEAT, channel.last().getType());
        assertEquals(NOW, channel.last().getTimestamp());
    }
    
    @Test
    void testShutdown_ClosesEveryChannel() {
        // Given
        RecordingChannel a1 = new RecordingChannel();
        RecordingChannel b1 = new RecordingChannel();
        hub.register(TENANT_A, a1);
        hub.register(TENANT_B, b1);
        
        // When
        hub.shutdown();
        
        // Then
        assertTrue(a1.closed);
        assertTrue(b1.closed);
        assertEquals(0, hub.connectionCount());
        assertEquals(0.0, meterRegistry.get("stream.connections").gauge().value());
    }
    
    private static EventView event(UUID tenantId, String type) {
        return EventView.builder()
                .id(UUID.randomUUID())
                .tenantId(tenantId)
                .eventType(type)
                .userId("u1")
                .properties(Map.of())
                .timestamp(NOW)
                .createdAt(NOW)
                .build();
    }
    
    private static class RecordingChannel implements EventChannel {
        
        private final List<StreamMessage> messages = new ArrayList<>();
        private boolean failing;
        private boolean closed;
        
        @Override
        public void send(StreamMessage message) throws IOException {
            if (failing) {
                throw new IOException("Broken pipe");
            }
            messages.add(message);
        }
        
        @Override
        public void close() {
            closed = true;
        }
        
        StreamMessage last() {
            return messages.get(messages.size() - 1);
        }
    }
}
