package com.clickstream.analytics.exception;

public class CsvIoException extends AnalyticsException {

    public static final String ERROR_CODE = "CSV_IO_FAILED";

    public CsvIoException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
