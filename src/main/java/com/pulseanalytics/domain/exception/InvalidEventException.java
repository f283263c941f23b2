package com.pulseanalytics.domain.exception;

import org.springframework.http.HttpStatus;

/**
 * Rejected event input: missing type, oversized field or malformed batch.
 * Always raised before anything is written.
 */
public class InvalidEventException extends AnalyticsException {
    public InvalidEventException(String message) {
        super("INVALID_EVENT", HttpStatus.BAD_REQUEST, message);
    }
}
