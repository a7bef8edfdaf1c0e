package com.clickstream.analytics.analytics;

import com.clickstream.analytics.analytics.AnalyticsModels.SessionSequence;
import com.clickstream.analytics.analytics.AnalyticsModels.SessionStep;
import com.clickstream.analytics.domain.DomainModels.Event;
import com.clickstream.analytics.domain.DomainModels.FieldNames;
import com.clickstream.analytics.domain.EventTable;
import com.clickstream.analytics.validation.EventTableValidator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

@Component
public class SessionGrouper {
    private static final Comparator<Event> BY_TIMESTAMP =
            Comparator.comparing(Event::timestamp, Comparator.nullsLast(Comparator.naturalOrder()));

    private final EventTableValidator validator;

    public SessionGrouper(EventTableValidator validator) {
        this.validator = validator;
    }

    public List<SessionSequence> group(EventTable table, FieldNames fields) {
        List<SessionSequence> sessions = new ArrayList<>();
        sortedEventsBySession(table, fields).forEach((sessionId, events) -> sessions.add(toSequence(sessionId, events)));
        return sessions;
    }

    public Map<String, List<Event>> sortedEventsBySession(EventTable table, FieldNames fields) {
        validator.requireColumns(table, fields.session(), fields.user(), fields.action(), fields.timestamp());

        Map<String, List<Event>> bySession = table.events().stream()
                .collect(Collectors.groupingBy(Event::sessionId, TreeMap::new, Collectors.toList()));
        bySession.replaceAll((sessionId, events) -> {
            List<Event> sorted = new ArrayList<>(events);
            sorted.sort(BY_TIMESTAMP);
            return List.copyOf(sorted);
        });
        return bySession;
    }

    private SessionSequence toSequence(String sessionId, List<Event> sorted) {
        List<SessionStep> steps = sorted.stream()
                .map(e -> new SessionStep(e.action(), e.timestamp(), e.userId()))
                .toList();
        return new SessionSequence(sessionId, sorted.get(0).userId(), steps);
    }
}
