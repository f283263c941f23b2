package com.pulseanalytics.domain.exception;

import org.springframework.http.HttpStatus;

/**
 * Aggregation index could not be written or queried.
 *
 * Non-fatal for ingestion (the mirror is best-effort), fatal for queries:
 * a query that hits this never returns a partial result.
 */
public class IndexUnavailableException extends AnalyticsException {

    public IndexUnavailableException(String message) {
        super("AGGREGATION_UNAVAILABLE", HttpStatus.SERVICE_UNAVAILABLE, message);
    }

    public IndexUnavailableException(String message, Throwable cause) {
        super("AGGREGATION_UNAVAILABLE", HttpStatus.SERVICE_UNAVAILABLE, message, cause);
    }
}
