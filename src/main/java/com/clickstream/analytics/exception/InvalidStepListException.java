package com.clickstream.analytics.exception;

public class InvalidStepListException extends AnalyticsException {

    public static final String ERROR_CODE = "INVALID_STEP_LIST";

    public InvalidStepListException(String reason) {
        super(ERROR_CODE, String.format("Invalid funnel step list: %s", reason));
    }
}
