package com.clickstream.analytics.cohort;

import java.time.LocalDate;

public class CohortModels {
    public enum ActivitySegment {
        NEW("New"),
        RETURNING("Returning"),
        CHURN_RISK("Churn-risk"),
        ACTIVE("Active");

        private final String label;

        ActivitySegment(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public record ActivityThresholds(int churnDays, int activeMinSessions, int activeRecencyDays) {
        public static ActivityThresholds defaults() {
            return new ActivityThresholds(90, 5, 30);
        }
    }

    public record UserActivity(String userId,
                               LocalDate firstVisitDay,
                               LocalDate lastVisitDate,
                               long nSessions,
                               ActivitySegment segment) {}

    public record RetentionRow(LocalDate cohortMonth,
                               long cohortLifetimeDays,
                               long retainedUsers,
                               long cohortSize) {}
}
