package com.clickstream.analytics.config;

import com.clickstream.analytics.analytics.StepList;
import com.clickstream.analytics.cohort.CohortModels.ActivityThresholds;
import com.clickstream.analytics.domain.DomainModels.FieldNames;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

@ConfigurationProperties(prefix = "clickstream.analytics")
public record AnalyticsProperties(
        @DefaultValue({"search", "product", "category", "mainpage", "cart", "checkout", "confirmation"}) List<String> steps,
        @DefaultValue Fields fields,
        @DefaultValue("true") boolean requireStepIncrease,
        @DefaultValue("checkout") String ordersAction,
        @DefaultValue Activity activity) {

    public StepList stepList() {
        return StepList.of(steps);
    }

    public record Fields(@DefaultValue("sessionid") String session,
                         @DefaultValue("userid") String user,
                         @DefaultValue("timestamp") String timestamp,
                         @DefaultValue("action") String action,
                         @DefaultValue("value") String value,
                         @DefaultValue("category") String category) {
        public FieldNames toFieldNames() {
            return new FieldNames(session, user, timestamp, action, value, category);
        }
    }

    public record Activity(@DefaultValue("90") int churnDays,
                           @DefaultValue("5") int activeMinSessions,
                           @DefaultValue("30") int activeRecencyDays) {
        public ActivityThresholds toThresholds() {
            return new ActivityThresholds(churnDays, activeMinSessions, activeRecencyDays);
        }
    }
}
