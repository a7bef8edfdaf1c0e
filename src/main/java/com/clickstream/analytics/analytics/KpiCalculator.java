package com.clickstream.analytics.analytics;

import com.clickstream.analytics.analytics.AnalyticsModels.DailyKpi;
import com.clickstream.analytics.domain.DomainModels.Event;
import com.clickstream.analytics.domain.EventTable;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

@Component
public class KpiCalculator {

    public List<DailyKpi> kpisByDate(EventTable table, String ordersAction) {
        Map<LocalDate, List<Event>> byDate = table.events().stream()
                .filter(e -> e.date() != null)
                .collect(Collectors.groupingBy(Event::date, TreeMap::new, Collectors.toList()));

        return byDate.entrySet().stream()
                .map(e -> toKpi(e.getKey(), e.getValue(), ordersAction))
                .toList();
    }

    private DailyKpi toKpi(LocalDate date, List<Event> events, String ordersAction) {
        List<Event> orders = events.stream().filter(e -> ordersAction.equals(e.action())).toList();
        double gmv = orders.stream().map(Event::value).filter(Objects::nonNull).mapToDouble(Double::doubleValue).sum();
        long sessions = events.stream().map(Event::sessionId).distinct().count();
        long buyers = orders.stream().map(Event::userId).distinct().count();
        long dau = events.stream().map(Event::userId).distinct().count();
        return new DailyKpi(date, orders.size(), gmv, sessions, buyers, dau, Ratios.ratio(gmv, orders.size()));
    }
}
