package com.pulseanalytics.api;

import com.pulseanalytics.api.dto.ErrorResponse;
import com.pulseanalytics.domain.exception.AnalyticsException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestValueException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.async.AsyncRequestTimeoutException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/**
 * Maps the service's exception taxonomy onto HTTP responses:
 * {"error": "...", "code": "...", "timestamp": "..."}.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {
    
    @ExceptionHandler(AnalyticsException.class)
    public ResponseEntity<ErrorResponse> handleAnalytics(AnalyticsException e) {
        if (e.getStatus().is5xxServerError()) {
            log.error("{}: {}", e.getCode(), e.getMessage());
        } else {
            log.debug("{}: {}", e.getCode(), e.getMessage());
        }
        return error(e.getStatus(), e.getCode(), e.getMessage());
    }
    
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_EVENT", "Malformed request body");
    }
    
    @ExceptionHandler({MethodArgumentTypeMismatchException.class, MissingRequestValueException.class})
    public ResponseEntity<ErrorResponse> handleBadParameter(Exception e) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_QUERY", e.getMessage());
    }
    
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) throws Exception {
        if (e instanceof AsyncRequestTimeoutException) {
            // Let Spring complete the SSE response itself
            throw e;
        }
        log.error("Unhandled error: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Internal server error");
    }
    
    // Content type is fixed: stream clients send Accept: text/event-stream
    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(ErrorResponse.builder()
                        .error(message)
                        .code(code)
                        .timestamp(Instant.now())
                        .build());
    }
}
