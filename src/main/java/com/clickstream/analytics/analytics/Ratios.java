package com.clickstream.analytics.analytics;

public final class Ratios {

    private Ratios() {}

    public static double ratio(double numerator, double denominator) {
        if (denominator <= 0) return Double.NaN;
        return numerator / denominator;
    }
}
