package com.clickstream.analytics.repository;

import com.clickstream.analytics.domain.DomainModels.Event;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

@Repository
public class InMemoryEventRepository {
    private final List<Event> events = new CopyOnWriteArrayList<>();

    public void saveEvents(List<Event> batch) {
        events.addAll(batch);
    }

    public List<Event> loadEvents() {
        return List.copyOf(events);
    }

    public int count() {
        return events.size();
    }

    public void clear() {
        events.clear();
    }
}
