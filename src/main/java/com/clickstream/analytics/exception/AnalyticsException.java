package com.clickstream.analytics.exception;

public class AnalyticsException extends RuntimeException {

    private final String errorCode;

    public AnalyticsException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public AnalyticsException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
