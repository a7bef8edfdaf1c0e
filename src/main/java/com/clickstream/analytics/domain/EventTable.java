package com.clickstream.analytics.domain;

import com.clickstream.analytics.domain.DomainModels.Event;
import com.clickstream.analytics.domain.DomainModels.FieldNames;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class EventTable {
    private final Set<String> columns;
    private final List<Event> events;

    private EventTable(Collection<String> columns, List<Event> events) {
        this.columns = Collections.unmodifiableSet(new LinkedHashSet<>(columns));
        this.events = List.copyOf(events);
    }

    public static EventTable of(Collection<String> columns, List<Event> events) {
        return new EventTable(columns, events);
    }

    public static EventTable of(FieldNames fields, List<Event> events) {
        return new EventTable(fields.all(), events);
    }

    public static EventTable empty(FieldNames fields) {
        return new EventTable(fields.all(), List.of());
    }

    public Set<String> columns() {
        return columns;
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public List<Event> events() {
        return events;
    }

    public int size() {
        return events.size();
    }
}
