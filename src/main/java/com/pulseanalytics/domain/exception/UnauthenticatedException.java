package com.pulseanalytics.domain.exception;

import org.springframework.http.HttpStatus;

public class UnauthenticatedException extends AnalyticsException {
    public UnauthenticatedException() {
        super("UNAUTHENTICATED", HttpStatus.UNAUTHORIZED, "API key required");
    }
}
