package com.clickstream.analytics.exception;

public class MissingColumnException extends AnalyticsException {

    public static final String ERROR_CODE = "MISSING_COLUMN";

    private final String column;

    public MissingColumnException(String column) {
        super(ERROR_CODE, String.format("Required column not found in event table: %s", column));
        this.column = column;
    }

    public String getColumn() {
        return column;
    }
}
