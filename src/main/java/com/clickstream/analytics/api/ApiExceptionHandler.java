package com.clickstream.analytics.api;

import com.clickstream.analytics.exception.AnalyticsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);
    static final String MALFORMED_REQUEST = "MALFORMED_REQUEST";

    @ExceptionHandler(AnalyticsException.class)
    public ResponseEntity<ErrorResponse> handleAnalytics(AnalyticsException e) {
        log.warn("Rejected analytics request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(e.getErrorCode(), e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Rejected unreadable request body: {}", e.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(MALFORMED_REQUEST, "Request body is not valid JSON for this endpoint"));
    }

    public record ErrorResponse(String code, String message) {}
}
