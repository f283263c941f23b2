package com.pulseanalytics.domain.exception;

import org.springframework.http.HttpStatus;

/**
 * Base type for every failure the service reports to a caller.
 *
 * Carries a stable error code and the HTTP status the API layer maps it to,
 * so services can throw without knowing about the web layer.
 */
public abstract class AnalyticsException extends RuntimeException {

    private final String code;
    private final HttpStatus status;

    protected AnalyticsException(String code, HttpStatus status, String message) {
        super(message);
        this.code = code;
        this.status = status;
    }

    protected AnalyticsException(String code, HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.status = status;
    }

    public String getCode() {
        return code;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
