package com.pulseanalytics.domain.realtime;

import com.pulseanalytics.domain.exception.DeliveryFailureException;
import com.pulseanalytics.domain.model.EventView;
import com.pulseanalytics.domain.model.StreamMessage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * In-process registry of open realtime streams, keyed by connection id.
 * 
 * Lifecycle of a subscription:
 * 1. register: "connected" acknowledgment is sent, then the subscription is
 *    added and its heartbeat task scheduled
 * 2. heartbeat: fixed-rate liveness message on the shared TaskScheduler
 * 3. broadcast: "event" messages for the subscription's tenant only
 * 4. unregister: on client disconnect, timeout, or the first failed write
 * 
 * Tenant isolation: broadcast(tenantId, event) only ever writes to
 * subscriptions registered for that same tenantId.
 * 
 * No replay. A subscription sees events broadcast while it is registered and
 * nothing from before.
 * 
 * Single process only; subscribers connected to another node see nothing.
 */
@Slf4j
@Component
public class RealtimeFanoutHub {
    
    private final Map<String, Subscription> connections = new ConcurrentHashMap<>();
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final Duration heartbeatInterval;
    private final Counter deliveryFailures;
    
    public RealtimeFanoutHub(TaskScheduler taskScheduler,
                             Clock clock,
                             MeterRegistry meterRegistry,
                             @Value("${app.stream.heartbeat-interval-ms:30000}") long heartbeatIntervalMs) {
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.heartbeatInterval = Duration.ofMillis(heartbeatIntervalMs);
        this.deliveryFailures = Counter.builder("stream.delivery.failures").register(meterRegistry);
        Gauge.builder("stream.connections", connections, Map::size).register(meterRegistry);
    }
    
    /**
     * Open a subscription for a resolved tenant.
     * 
     * @return the connection id, used to unregister
     */
    public String register(UUID tenantId, EventChannel channel) {
        String connectionId = UUID.randomUUID().toString();
        Subscription subscription = new Subscription(connectionId, tenantId, channel);
        
        // Ack first: a channel that cannot take the ack is never registered
        if (!deliver(subscription, StreamMessage.connected(connectionId, clock.instant()))) {
            return connectionId;
        }
        
        connections.put(connectionId, subscription);
        subscription.heartbeat = taskScheduler.scheduleAtFixedRate(
                () -> pulse(connectionId),
                clock.instant().plus(heartbeatInterval),
                heartbeatInterval);
        
        // Closed while we were scheduling
        if (!connections.containsKey(connectionId)) {
            subscription.cancelHeartbeat();
        }
        
        log.info("Stream opened: connection={}, tenant={}, open={}", connectionId, tenantId, connections.size());
        return connectionId;
    }
    
    /**
     * Remove a subscription and stop its heartbeat. Safe to call repeatedly.
     */
    public boolean unregister(String connectionId) {
        Subscription removed = connections.remove(connectionId);
        if (removed == null) {
            return false;
        }
        removed.cancelHeartbeat();
        log.info("Stream closed: connection={}, tenant={}, open={}",
                connectionId, removed.tenantId, connections.size());
        return true;
    }
    
    /**
     * Deliver an event to every open subscription of the event's tenant.
     * 
     * A broken channel is dropped and does not stop delivery to the rest.
     * 
     * @return number of subscriptions the event was written to
     */
    public int broadcast(UUID tenantId, EventView event) {
        if (event.getTenantId() != null && !event.getTenantId().equals(tenantId)) {
            log.error("Refusing broadcast: event {} belongs to tenant {}, not {}",
                    event.getId(), event.getTenantId(), tenantId);
            return 0;
        }
        
        StreamMessage message = StreamMessage.event(event, clock.instant());
        int delivered = 0;
        
        for (Subscription subscription : connections.values()) {
            if (!subscription.tenantId.equals(tenantId)) {
                continue;
            }
            if (deliver(subscription, message)) {
                delivered++;
            }
        }
        
        log.debug("Broadcast event {} for tenant {} to {} connection(s)", event.getId(), tenantId, delivered);
        return delivered;
    }
    
    public int connectionCount() {
        return connections.size();
    }
    
    public int connectionCount(UUID tenantId) {
        return (int) connections.values().stream()
                .filter(subscription -> subscription.tenantId.equals(tenantId))
                .count();
    }
    
    @PreDestroy
    public void shutdown() {
        log.info("Closing {} open stream(s)", connections.size());
        for (String connectionId : connections.keySet()) {
            Subscription subscription = connections.remove(connectionId);
            if (subscription != null) {
                subscription.cancelHeartbeat();
                subscription.channel.close();
            }
        }
    }
    
    void pulse(String connectionId) {
        Subscription subscription = connections.get(connectionId);
        if (subscription != null) {
            deliver(subscription, StreamMessage.heartbeat(clock.instant()));
        }
    }
    
    private boolean deliver(Subscription subscription, StreamMessage message) {
        try {
            subscription.channel.send(message);
            return true;
        } catch (Exception e) {
            DeliveryFailureException failure = new DeliveryFailureException(subscription.connectionId, e);
            log.warn("{} ({} message): {}", failure.getMessage(), message.getType(), e.getMessage());
            deliveryFailures.increment();
            unregister(subscription.connectionId);
            subscription.channel.close();
            return false;
        }
    }
    
    private static final class Subscription {
        private final String connectionId;
        private final UUID tenantId;
        private final EventChannel channel;
        private volatile ScheduledFuture<?> heartbeat;
        
        private Subscription(String connectionId, UUID tenantId, EventChannel channel) {
            this.connectionId = connectionId;
            this.tenantId = tenantId;
            this.channel = channel;
        }
        
        private void cancelHeartbeat() {
            ScheduledFuture<?> task = heartbeat;
            if (task != null) {
                task.cancel(false);
            }
        }
    }
}
