package com.clickstream.analytics;

import com.clickstream.analytics.analytics.AnalyticsModels.FunnelRow;
import com.clickstream.analytics.analytics.AnalyticsModels.ReachedSteps;
import com.clickstream.analytics.analytics.AnalyticsModels.SessionSequence;
import com.clickstream.analytics.analytics.FunnelAggregator;
import com.clickstream.analytics.analytics.OrderedFunnelMatcher;
import com.clickstream.analytics.analytics.SessionGrouper;
import com.clickstream.analytics.analytics.StepList;
import com.clickstream.analytics.analytics.TransitionExtractor;
import com.clickstream.analytics.domain.DomainModels.Event;
import com.clickstream.analytics.domain.DomainModels.FieldNames;
import com.clickstream.analytics.domain.EventTable;
import com.clickstream.analytics.exception.MissingColumnException;
import com.clickstream.analytics.validation.EventTableValidator;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FunnelAnalysisTest {
    private static final FieldNames FIELDS = FieldNames.defaults();
    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private final SessionGrouper grouper = new SessionGrouper(new EventTableValidator());
    private final OrderedFunnelMatcher matcher = new OrderedFunnelMatcher();
    private final FunnelAggregator aggregator = new FunnelAggregator();

    @Test
    void matchStopsAtFirstStepMissingAfterCursor() {
        EventTable table = EventTable.of(FIELDS, session("s1", "u1", "search", "cart", "product", "checkout"));
        SessionSequence session = grouper.group(table, FIELDS).get(0);

        ReachedSteps reached = matcher.match(session, StepList.of("search", "product", "cart", "checkout"));

        assertEquals(Set.of("search", "product"), reached.reached());
    }

    @Test
    void reachedSetOnlyGrowsWhenStepListIsExtended() {
        EventTable table = EventTable.of(FIELDS, session("s1", "u1", "search", "product", "mainpage", "cart"));
        SessionSequence session = grouper.group(table, FIELDS).get(0);

        Set<String> shorter = matcher.match(session, StepList.of("search", "product")).reached();
        Set<String> longer = matcher.match(session, StepList.of("search", "product", "cart", "checkout")).reached();

        assertTrue(longer.containsAll(shorter));
        assertEquals(Set.of("search", "product", "cart"), longer);
    }

    @Test
    void sessionWithoutFirstStepReachesNothing() {
        EventTable table = EventTable.of(FIELDS, session("s1", "u1", "product", "cart"));
        SessionSequence session = grouper.group(table, FIELDS).get(0);

        assertTrue(matcher.match(session, StepList.of("search", "product")).reached().isEmpty());
    }

    @Test
    void groupingKeepsInputOrderForEqualTimestampsAndPutsMissingLast() {
        List<Event> events = List.of(
                Event.of("u1", "s1", null, "broken"),
                Event.of("u1", "s1", T0.plusSeconds(5), "cart"),
                Event.of("u1", "s1", T0, "search"),
                Event.of("u1", "s1", T0, "product"));

        SessionSequence session = grouper.group(EventTable.of(FIELDS, events), FIELDS).get(0);

        assertEquals(List.of("search", "product", "cart", "broken"),
                session.steps().stream().map(s -> s.action()).toList());
        assertEquals(List.of("search", "product", "cart"), session.orderedActions());
    }

    @Test
    void sessionsComeBackOrderedById() {
        List<Event> events = new ArrayList<>(session("s2", "u2", "search"));
        events.addAll(session("s1", "u1", "search"));

        List<String> ids = grouper.group(EventTable.of(FIELDS, events), FIELDS).stream()
                .map(SessionSequence::sessionId)
                .toList();

        assertEquals(List.of("s1", "s2"), ids);
    }

    @Test
    void groupingRequiresSessionColumn() {
        EventTable table = EventTable.of(List.of("userid", "timestamp", "action"), List.of());

        MissingColumnException ex = assertThrows(MissingColumnException.class, () -> grouper.group(table, FIELDS));
        assertEquals("sessionid", ex.getColumn());
    }

    @Test
    void groupingRequiresUserColumn() {
        EventTable table = EventTable.of(List.of("sessionid", "timestamp", "action"),
                session("s1", "u1", "search"));

        MissingColumnException ex = assertThrows(MissingColumnException.class, () -> grouper.group(table, FIELDS));
        assertEquals("userid", ex.getColumn());
    }

    @Test
    void emptyTableFlowsThroughMatcherAndExtractor() {
        StepList steps = StepList.of("search", "product");
        List<SessionSequence> sessions = grouper.group(EventTable.empty(FIELDS), FIELDS);

        assertTrue(sessions.isEmpty());
        assertTrue(matcher.matchAll(sessions, steps).isEmpty());
        assertTrue(new TransitionExtractor().extract(sessions, steps.rankMap(), true).isEmpty());
        assertTrue(aggregator.aggregate(matcher.matchAll(sessions, steps), steps).isEmpty());
    }

    @Test
    void aggregatesSessionsAndDistinctUsersInStepOrder() {
        List<Event> events = new ArrayList<>();
        events.addAll(session("s1", "u1", "search", "product", "cart"));
        events.addAll(session("s2", "u1", "search", "product"));
        events.addAll(session("s3", "u2", "search"));
        StepList steps = StepList.of("search", "product", "cart", "checkout");

        List<ReachedSteps> reached = matcher.matchAll(grouper.group(EventTable.of(FIELDS, events), FIELDS), steps);
        List<FunnelRow> funnel = aggregator.aggregate(reached, steps);

        assertEquals(List.of(
                new FunnelRow("search", 3, 2),
                new FunnelRow("product", 2, 1),
                new FunnelRow("cart", 1, 1)), funnel);
        for (FunnelRow row : funnel) {
            assertTrue(row.uniqueUsersReached() <= row.sessionsReached());
        }
    }

    @Test
    void emptyInputGivesEmptyFunnel() {
        assertTrue(aggregator.aggregate(List.of(), StepList.of("search")).isEmpty());
    }

    private static List<Event> session(String sessionId, String userId, String... actions) {
        List<Event> events = new ArrayList<>();
        for (int i = 0; i < actions.length; i++) {
            events.add(Event.of(userId, sessionId, T0.plusSeconds(10L * i), actions[i]));
        }
        return events;
    }
}
