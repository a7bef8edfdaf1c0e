package com.clickstream.analytics.cohort;

import com.clickstream.analytics.cohort.CohortModels.ActivitySegment;
import com.clickstream.analytics.cohort.CohortModels.ActivityThresholds;
import com.clickstream.analytics.cohort.CohortModels.RetentionRow;
import com.clickstream.analytics.cohort.CohortModels.UserActivity;
import com.clickstream.analytics.domain.DomainModels;
import com.clickstream.analytics.domain.DomainModels.Event;
import com.clickstream.analytics.domain.EventTable;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.BinaryOperator;
import java.util.stream.Collectors;

@Service
public class CohortService {

    public List<UserActivity> activitySegments(EventTable table, LocalDate today, ActivityThresholds thresholds) {
        Map<String, List<Event>> byUser = table.events().stream()
                .filter(e -> e.date() != null)
                .collect(Collectors.groupingBy(Event::userId, TreeMap::new, Collectors.toList()));

        return byUser.entrySet().stream()
                .map(e -> {
                    List<Event> events = e.getValue();
                    LocalDate first = events.stream().map(Event::date).min(Comparator.naturalOrder()).orElseThrow();
                    LocalDate last = events.stream().map(Event::date).max(Comparator.naturalOrder()).orElseThrow();
                    long sessions = events.stream().map(Event::sessionId).distinct().count();
                    return new UserActivity(e.getKey(), first, last, sessions, segment(first, last, sessions, today, thresholds));
                })
                .toList();
    }

    public List<RetentionRow> cohortMonthRetention(EventTable table) {
        List<Event> timed = table.events().stream().filter(Event::hasTimestamp).toList();
        Map<String, Instant> firstByUser = timed.stream()
                .collect(Collectors.toMap(Event::userId, Event::timestamp, BinaryOperator.minBy(Comparator.naturalOrder())));

        Map<LocalDate, Long> cohortSizes = firstByUser.values().stream()
                .collect(Collectors.groupingBy(this::cohortMonth, Collectors.counting()));

        Map<LocalDate, Map<Long, Set<String>>> retained = new TreeMap<>();
        for (Event event : timed) {
            LocalDate month = cohortMonth(firstByUser.get(event.userId()));
            long lifetimeDays = ChronoUnit.DAYS.between(month.atStartOfDay(DomainModels.EVENT_ZONE).toInstant(), event.timestamp());
            retained.computeIfAbsent(month, m -> new TreeMap<>())
                    .computeIfAbsent(lifetimeDays, d -> new HashSet<>())
                    .add(event.userId());
        }

        return retained.entrySet().stream()
                .flatMap(m -> m.getValue().entrySet().stream()
                        .map(d -> new RetentionRow(m.getKey(), d.getKey(), d.getValue().size(), cohortSizes.get(m.getKey()))))
                .toList();
    }

    private ActivitySegment segment(LocalDate first, LocalDate last, long sessions, LocalDate today, ActivityThresholds t) {
        // later rules override earlier ones
        ActivitySegment segment = ActivitySegment.RETURNING;
        if (first.equals(today)) segment = ActivitySegment.NEW;
        if (last.isBefore(today.minusDays(t.churnDays()))) segment = ActivitySegment.CHURN_RISK;
        if (sessions >= t.activeMinSessions() && !last.isBefore(today.minusDays(t.activeRecencyDays()))) {
            segment = ActivitySegment.ACTIVE;
        }
        return segment;
    }

    private LocalDate cohortMonth(Instant firstTimestamp) {
        return DomainModels.toDate(firstTimestamp).withDayOfMonth(1);
    }
}
