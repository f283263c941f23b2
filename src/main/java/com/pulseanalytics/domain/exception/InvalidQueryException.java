package com.pulseanalytics.domain.exception;

import org.springframework.http.HttpStatus;

public class InvalidQueryException extends AnalyticsException {
    public InvalidQueryException(String message) {
        super("INVALID_QUERY", HttpStatus.BAD_REQUEST, message);
    }
}
