package com.clickstream.analytics.features;

import com.clickstream.analytics.analytics.SessionGrouper;
import com.clickstream.analytics.domain.DomainModels.Event;
import com.clickstream.analytics.domain.DomainModels.FieldNames;
import com.clickstream.analytics.domain.EventTable;
import com.clickstream.analytics.features.FeatureModels.ProductToCartTransition;
import com.clickstream.analytics.features.FeatureModels.SessionAggregate;
import com.clickstream.analytics.features.FeatureModels.SessionEvent;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

@Service
public class SessionFeatureService {
    public static final String PRODUCT = "product";
    public static final String CART = "cart";
    public static final String CHECKOUT = "checkout";

    private final SessionGrouper grouper;

    public SessionFeatureService(SessionGrouper grouper) {
        this.grouper = grouper;
    }

    public List<SessionAggregate> sessionAggregates(EventTable table, FieldNames fields) {
        return grouper.sortedEventsBySession(table, fields).entrySet().stream()
                .map(e -> aggregate(e.getKey(), e.getValue()))
                .toList();
    }

    public List<SessionEvent> enrich(EventTable table, FieldNames fields) {
        List<SessionEvent> out = new ArrayList<>(table.size());
        grouper.sortedEventsBySession(table, fields)
                .forEach((sessionId, events) -> out.addAll(enrichSession(sessionId, events)));
        return out;
    }

    public List<ProductToCartTransition> productToCartTransitions(List<SessionEvent> enriched) {
        return enriched.stream()
                .filter(SessionEvent::productToCart)
                .map(e -> new ProductToCartTransition(e.userId(), e.sessionId(), e.prevAction(), e.action(), e.timestamp()))
                .toList();
    }

    private SessionAggregate aggregate(String sessionId, List<Event> events) {
        List<Instant> timestamps = events.stream().map(Event::timestamp).filter(Objects::nonNull).toList();
        Instant start = timestamps.stream().min(Comparator.naturalOrder()).orElse(null);
        Instant end = timestamps.stream().max(Comparator.naturalOrder()).orElse(null);
        double duration = start == null ? 0.0 : seconds(start, end);
        return new SessionAggregate(sessionId, start, end, timestamps.size(), duration);
    }

    private List<SessionEvent> enrichSession(String sessionId, List<Event> events) {
        int n = events.size();
        boolean[] productToCart = new boolean[n];
        int basketSize = 0;
        for (int i = 1; i < n; i++) {
            if (CART.equals(events.get(i).action()) && PRODUCT.equals(events.get(i - 1).action())) {
                productToCart[i] = true;
                basketSize++;
            }
        }
        double duration = aggregate(sessionId, events).sessionDurationSeconds();
        double avgCartToCheckout = avgCartToCheckoutSeconds(events);

        List<SessionEvent> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Event e = events.get(i);
            Event prev = i > 0 ? events.get(i - 1) : null;
            Event next = i + 1 < n ? events.get(i + 1) : null;
            double value = e.value() == null ? 0.0 : e.value();
            out.add(new SessionEvent(
                    e.userId(), sessionId, e.timestamp(), e.date(), e.action(), e.value(), e.category(),
                    i + 1,
                    prev == null ? null : prev.action(),
                    next == null ? null : next.action(),
                    prev == null ? null : prev.timestamp(),
                    next == null ? null : next.timestamp(),
                    productToCart[i],
                    basketSize,
                    avgCartToCheckout,
                    duration,
                    CART.equals(e.action()) ? value : 0.0,
                    CHECKOUT.equals(e.action()) ? value : 0.0));
        }
        return out;
    }

    // mean gap from the previous cart or checkout to each checkout
    private double avgCartToCheckoutSeconds(List<Event> events) {
        Instant previous = null;
        double total = 0.0;
        int count = 0;
        for (Event e : events) {
            boolean cartOrCheckout = CART.equals(e.action()) || CHECKOUT.equals(e.action());
            if (!e.hasTimestamp() || !cartOrCheckout) continue;
            if (CHECKOUT.equals(e.action()) && previous != null) {
                total += seconds(previous, e.timestamp());
                count++;
            }
            previous = e.timestamp();
        }
        return count == 0 ? 0.0 : total / count;
    }

    private double seconds(Instant from, Instant to) {
        return Duration.between(from, to).toMillis() / 1000.0;
    }
}
