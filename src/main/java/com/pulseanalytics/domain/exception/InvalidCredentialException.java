package com.pulseanalytics.domain.exception;

import org.springframework.http.HttpStatus;

public class InvalidCredentialException extends AnalyticsException {
    public InvalidCredentialException() {
        super("INVALID_CREDENTIAL", HttpStatus.UNAUTHORIZED, "Invalid API key");
    }
}
