package com.pulseanalytics.domain.realtime;

import com.pulseanalytics.domain.model.StreamMessage;

import java.io.IOException;

/**
 * Server-to-client push channel behind one stream subscription.
 */
public interface EventChannel {
    
    /**
     * @throws IOException if the client is gone; the hub drops the subscription
     */
    void send(StreamMessage message) throws IOException;
    
    void close();
}
