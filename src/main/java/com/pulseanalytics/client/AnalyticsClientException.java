package com.pulseanalytics.client;

/**
 * A failed call to the analytics service.
 * 
 * status is the HTTP status when the server answered, 0 when it could not
 * be reached.
 */
public class AnalyticsClientException extends RuntimeException {
    
    private final int status;
    
    public AnalyticsClientException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }
    
    public AnalyticsClientException(String message, Throwable cause) {
        this(message, 0, cause);
    }
    
    public int getStatus() {
        return status;
    }
}
