package com.pulseanalytics.domain.exception;

import org.springframework.http.HttpStatus;

/**
 * A single stream subscriber's channel broke. Isolated to that subscriber;
 * never propagated to the ingesting caller.
 */
public class DeliveryFailureException extends AnalyticsException {
    public DeliveryFailureException(String connectionId, Throwable cause) {
        super("DELIVERY_FAILURE", HttpStatus.INTERNAL_SERVER_ERROR,
                "Delivery to connection " + connectionId + " failed", cause);
    }
}
