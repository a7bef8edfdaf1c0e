package com.clickstream.analytics.export;

import com.clickstream.analytics.analytics.AnalyticsModels.AnalyticsReport;
import com.clickstream.analytics.analytics.AnalyticsModels.ConversionRow;
import com.clickstream.analytics.analytics.AnalyticsModels.ConversionTable;
import com.clickstream.analytics.analytics.AnalyticsModels.DailyKpi;
import com.clickstream.analytics.analytics.AnalyticsModels.FunnelRow;
import com.clickstream.analytics.analytics.AnalyticsModels.TransitionRow;
import com.clickstream.analytics.cohort.CohortModels.RetentionRow;
import com.clickstream.analytics.cohort.CohortModels.UserActivity;
import com.clickstream.analytics.features.FeatureModels.ProductToCartTransition;
import com.clickstream.analytics.features.FeatureModels.SessionAggregate;
import com.clickstream.analytics.features.FeatureModels.SessionEvent;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public final class ReportTables {

    private ReportTables() {}

    public record CsvTable(String fileName, List<String> columns, List<List<Object>> rows) {}

    public static List<CsvTable> all(AnalyticsReport report) {
        return List.of(
                cleanedEvents(report.sessionEvents()),
                sessions(report.sessions()),
                productToCart(report.productToCart()),
                funnel(report.funnel()),
                kpis(report.kpisByDate()),
                sankey(report.transitions()),
                conversion(report.conversionDaily()),
                activity(report.activity()),
                retention(report.retention()));
    }

    public static CsvTable funnel(List<FunnelRow> rows) {
        return new CsvTable("funnel.csv",
                List.of("step", "sessions_reached", "unique_users_reached"),
                rows.stream().map(r -> row(r.step(), r.sessionsReached(), r.uniqueUsersReached())).toList());
    }

    public static CsvTable sankey(List<TransitionRow> rows) {
        return new CsvTable("sankey.csv",
                List.of("action", "next_action", "users"),
                rows.stream().map(r -> row(r.action(), r.nextAction(), r.users())).toList());
    }

    public static CsvTable conversion(ConversionTable table) {
        List<List<Object>> rows = new ArrayList<>();
        for (ConversionRow r : table.rows()) {
            List<Object> cells = new ArrayList<>();
            cells.add(r.cohortDate());
            cells.addAll(r.stepUsers().values());
            cells.addAll(r.ratios().values());
            cells.add(r.crFull());
            rows.add(cells);
        }
        return new CsvTable("conversion_daily.csv", table.columns(), rows);
    }

    public static CsvTable sessions(List<SessionAggregate> rows) {
        return new CsvTable("sessions.csv",
                List.of("sessionid", "session_start", "session_end", "events_count", "session_duration"),
                rows.stream().map(r -> row(r.sessionId(), r.sessionStart(), r.sessionEnd(), r.eventsCount(), r.sessionDurationSeconds())).toList());
    }

    public static CsvTable kpis(List<DailyKpi> rows) {
        return new CsvTable("kpis_by_date.csv",
                List.of("date", "orders_count", "gmv", "sessions_count", "buyers_count", "dau", "aov"),
                rows.stream().map(r -> row(r.date(), r.ordersCount(), r.gmv(), r.sessionsCount(), r.buyersCount(), r.dau(), r.aov())).toList());
    }

    public static CsvTable productToCart(List<ProductToCartTransition> rows) {
        return new CsvTable("transitions_product_to_cart.csv",
                List.of("userid", "sessionid", "prev_action_in_session", "action", "timestamp"),
                rows.stream().map(r -> row(r.userId(), r.sessionId(), r.prevAction(), r.action(), r.timestamp())).toList());
    }

    public static CsvTable cleanedEvents(List<SessionEvent> rows) {
        return new CsvTable("cleaned_events.csv",
                List.of("userid", "sessionid", "timestamp", "date", "action", "value", "category",
                        "session_step_number", "prev_action_in_session", "next_action_in_session",
                        "prev_ts_in_session", "next_ts_in_session", "product_to_cart", "basket_size",
                        "avg_time_between_cart_and_checkout", "session_duration", "cart_value", "checkout_value"),
                rows.stream().map(r -> row(r.userId(), r.sessionId(), r.timestamp(), r.date(), r.action(), r.value(), r.category(),
                        r.sessionStepNumber(), r.prevAction(), r.nextAction(), r.prevTimestamp(), r.nextTimestamp(),
                        r.productToCart() ? 1 : 0, r.basketSize(), r.avgTimeBetweenCartAndCheckout(),
                        r.sessionDurationSeconds(), r.cartValue(), r.checkoutValue())).toList());
    }

    public static CsvTable activity(List<UserActivity> rows) {
        return new CsvTable("activity_labeled.csv",
                List.of("userid", "first_visit_day", "last_visit_date", "n_sessions", "activity_segment"),
                rows.stream().map(r -> row(r.userId(), r.firstVisitDay(), r.lastVisitDate(), r.nSessions(), r.segment().label())).toList());
    }

    public static CsvTable retention(List<RetentionRow> rows) {
        return new CsvTable("cohort_retention.csv",
                List.of("cohort_month", "cohort_lifetime_days", "retained_users", "cohort_size"),
                rows.stream().map(r -> row(r.cohortMonth(), r.cohortLifetimeDays(), r.retainedUsers(), r.cohortSize())).toList());
    }

    private static List<Object> row(Object... cells) {
        return Arrays.asList(cells);
    }
}
