package com.clickstream.analytics.analytics;

import com.clickstream.analytics.cohort.CohortModels;
import com.clickstream.analytics.features.FeatureModels;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class AnalyticsModels {
    public record EventIngestRequest(List<EventIn> events) {}

    public record EventIn(String userId,
                          String sessionId,
                          String timestamp,
                          String action,
                          Double value,
                          String category) {}

    public record EventAck(int accepted, int rejected) {}

    public record SessionStep(String action, Instant timestamp, String userId) {}

    /**
     * Events of one session sorted by timestamp, ties in input order, missing timestamps last.
     */
    public record SessionSequence(String sessionId, String userId, List<SessionStep> steps) {
        public List<SessionStep> orderedSteps() {
            return steps.stream().filter(s -> s.timestamp() != null).toList();
        }

        public List<String> orderedActions() {
            return orderedSteps().stream().map(SessionStep::action).toList();
        }
    }

    public record ReachedSteps(String sessionId, String userId, Set<String> reached) {}

    public record FunnelRow(String step, long sessionsReached, long uniqueUsersReached) {}

    public record TransitionRow(String action, String nextAction, long users) {}

    public record ConversionRow(LocalDate cohortDate,
                                Map<String, Long> stepUsers,
                                Map<String, Double> ratios,
                                double crFull) {}

    public record ConversionTable(List<String> columns, List<ConversionRow> rows) {}

    public record DailyKpi(LocalDate date,
                           long ordersCount,
                           double gmv,
                           long sessionsCount,
                           long buyersCount,
                           long dau,
                           double aov) {}

    public record AnalyticsReport(List<FunnelRow> funnel,
                                  List<TransitionRow> transitions,
                                  ConversionTable conversionDaily,
                                  List<FeatureModels.SessionAggregate> sessions,
                                  List<FeatureModels.SessionEvent> sessionEvents,
                                  List<FeatureModels.ProductToCartTransition> productToCart,
                                  List<DailyKpi> kpisByDate,
                                  List<CohortModels.UserActivity> activity,
                                  List<CohortModels.RetentionRow> retention) {}
}
