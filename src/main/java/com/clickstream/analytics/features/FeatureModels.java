package com.clickstream.analytics.features;

import java.time.Instant;
import java.time.LocalDate;

public class FeatureModels {
    public record SessionAggregate(String sessionId,
                                   Instant sessionStart,
                                   Instant sessionEnd,
                                   long eventsCount,
                                   double sessionDurationSeconds) {}

    public record SessionEvent(String userId,
                               String sessionId,
                               Instant timestamp,
                               LocalDate date,
                               String action,
                               Double value,
                               String category,
                               int sessionStepNumber,
                               String prevAction,
                               String nextAction,
                               Instant prevTimestamp,
                               Instant nextTimestamp,
                               boolean productToCart,
                               int basketSize,
                               double avgTimeBetweenCartAndCheckout,
                               double sessionDurationSeconds,
                               double cartValue,
                               double checkoutValue) {}

    public record ProductToCartTransition(String userId,
                                          String sessionId,
                                          String prevAction,
                                          String action,
                                          Instant timestamp) {}
}
