package com.clickstream.analytics.analytics;

import com.clickstream.analytics.analytics.AnalyticsModels.ConversionRow;
import com.clickstream.analytics.analytics.AnalyticsModels.ConversionTable;
import com.clickstream.analytics.domain.DomainModels;
import com.clickstream.analytics.domain.DomainModels.Event;
import com.clickstream.analytics.domain.DomainModels.FieldNames;
import com.clickstream.analytics.domain.EventTable;
import com.clickstream.analytics.validation.EventTableValidator;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.BinaryOperator;
import java.util.stream.Collectors;

@Component
public class CohortConversionCalculator {
    public static final String COHORT_DATE_COLUMN = "cohort_date";
    public static final String FULL_RATIO_COLUMN = "cr_full";

    private final EventTableValidator validator;

    public CohortConversionCalculator(EventTableValidator validator) {
        this.validator = validator;
    }

    public ConversionTable compute(EventTable table, StepList steps, FieldNames fields) {
        validator.requireColumns(table, fields.user(), fields.action(), fields.timestamp());

        List<Event> funnelEvents = table.events().stream()
                .filter(Event::hasTimestamp)
                .filter(e -> steps.contains(e.action()))
                .toList();

        Map<String, Instant> entryByUser = funnelEvents.stream()
                .filter(e -> steps.first().equals(e.action()))
                .collect(Collectors.toMap(Event::userId, Event::timestamp, BinaryOperator.minBy(Comparator.naturalOrder())));

        Map<LocalDate, Map<String, Set<String>>> usersByCohort = new TreeMap<>();
        for (Event event : funnelEvents) {
            Instant entry = entryByUser.get(event.userId());
            if (entry == null || event.timestamp().isBefore(entry)) continue;
            usersByCohort.computeIfAbsent(DomainModels.toDate(entry), d -> new HashMap<>())
                    .computeIfAbsent(event.action(), a -> new HashSet<>())
                    .add(event.userId());
        }

        List<ConversionRow> rows = new ArrayList<>(usersByCohort.size());
        usersByCohort.forEach((cohortDate, usersByStep) -> {
            Map<String, Long> counts = new HashMap<>();
            usersByStep.forEach((step, users) -> counts.put(step, (long) users.size()));
            rows.add(toRow(cohortDate, counts, steps));
        });
        return new ConversionTable(columns(steps), rows);
    }

    public ConversionRow toRow(LocalDate cohortDate, Map<String, Long> counts, StepList steps) {
        Map<String, Long> stepUsers = new LinkedHashMap<>();
        for (String step : steps.steps()) {
            stepUsers.put(step, counts.getOrDefault(step, 0L));
        }

        Map<String, Double> ratios = new LinkedHashMap<>();
        for (StepList.StepPair pair : steps.adjacentPairs()) {
            ratios.put(pair.ratioColumn(), Ratios.ratio(stepUsers.get(pair.to()), stepUsers.get(pair.from())));
        }
        double full = Ratios.ratio(stepUsers.get(steps.last()), stepUsers.get(steps.first()));

        return new ConversionRow(cohortDate,
                Collections.unmodifiableMap(stepUsers),
                Collections.unmodifiableMap(ratios),
                full);
    }

    public List<String> columns(StepList steps) {
        List<String> columns = new ArrayList<>();
        columns.add(COHORT_DATE_COLUMN);
        columns.addAll(steps.steps());
        steps.adjacentPairs().forEach(p -> columns.add(p.ratioColumn()));
        columns.add(FULL_RATIO_COLUMN);
        return List.copyOf(columns);
    }
}
