package com.pulseanalytics.domain.exception;

import org.springframework.http.HttpStatus;

/**
 * Durable event store transaction failed. The whole batch was rolled back.
 */
public class StoreUnavailableException extends AnalyticsException {
    public StoreUnavailableException(String message, Throwable cause) {
        super("STORE_UNAVAILABLE", HttpStatus.SERVICE_UNAVAILABLE, message, cause);
    }
}
