package com.clickstream.analytics;

import com.clickstream.analytics.analytics.AnalyticsModels;
import com.clickstream.analytics.analytics.AnalyticsService;
import com.clickstream.analytics.exception.InvalidStepListException;
import com.clickstream.analytics.repository.InMemoryEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class AnalyticsServiceTest {
    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    @Autowired
    private AnalyticsService analyticsService;

    @Autowired
    private InMemoryEventRepository repository;

    @BeforeEach
    void resetEvents() {
        repository.clear();
    }

    @Test
    void ingestsEventsAndBuildsFunnel() {
        var ack = analyticsService.ingest(request(
                new AnalyticsModels.EventIn("u1", "s1", at(0), "search", null, "books"),
                new AnalyticsModels.EventIn("u1", "s1", at(5), "product", null, "books"),
                new AnalyticsModels.EventIn("u2", "s2", at(0), "search", null, null)));
        assertEquals(3, ack.accepted());
        assertEquals(0, ack.rejected());

        analyticsService.recompute();

        assertEquals(List.of(
                new AnalyticsModels.FunnelRow("search", 2, 2),
                new AnalyticsModels.FunnelRow("product", 1, 1)), analyticsService.funnel(null));
        assertEquals(List.of(new AnalyticsModels.TransitionRow("search", "product", 1)),
                analyticsService.transitions(null, null));
    }

    @Test
    void rejectsEventsWithoutIdentifiers() {
        var ack = analyticsService.ingest(request(
                new AnalyticsModels.EventIn("u1", "s1", at(0), "search", null, null),
                new AnalyticsModels.EventIn("", "s1", at(0), "search", null, null),
                new AnalyticsModels.EventIn("u1", "s1", at(0), null, null, null)));

        assertEquals(1, ack.accepted());
        assertEquals(2, ack.rejected());
        assertEquals(1, repository.count());
    }

    @Test
    void recomputeIsIdempotent() {
        analyticsService.ingest(request(
                new AnalyticsModels.EventIn("u1", "s1", at(0), "search", null, null),
                new AnalyticsModels.EventIn("u1", "s1", at(3), "cart", 10.0, null),
                new AnalyticsModels.EventIn("u1", "s1", at(9), "checkout", 10.0, null)));

        var first = analyticsService.recompute().report();
        var second = analyticsService.recompute().report();

        assertEquals(first, second);
    }

    @Test
    void customStepsAreComputedOnLatestSnapshot() {
        analyticsService.ingest(request(
                new AnalyticsModels.EventIn("u1", "s1", at(0), "cart", null, null),
                new AnalyticsModels.EventIn("u1", "s1", at(1), "search", null, null)));
        analyticsService.recompute();

        assertEquals(List.of(new AnalyticsModels.TransitionRow("cart", "search", 1)),
                analyticsService.transitions(List.of("search", "cart"), false));
        assertTrue(analyticsService.transitions(List.of("search", "cart"), true).isEmpty());
        assertEquals(1, analyticsService.conversion(List.of("cart", "search")).rows().size());
        assertThrows(InvalidStepListException.class, () -> analyticsService.funnel(List.of("cart", "cart")));
    }

    @Test
    void unparseableTimestampDegradesOnlyItsOwnRow() {
        var ack = analyticsService.ingest(request(
                new AnalyticsModels.EventIn("u1", "s1", "2024-03-01 10:00:00", "search", null, null),
                new AnalyticsModels.EventIn("u1", "s1", "garbage", "product", null, null),
                new AnalyticsModels.EventIn("u1", "s1", "2024-03-01 10:00:30", "product", null, null)));
        assertEquals(3, ack.accepted());

        analyticsService.recompute();

        assertEquals(List.of(
                new AnalyticsModels.FunnelRow("search", 1, 1),
                new AnalyticsModels.FunnelRow("product", 1, 1)), analyticsService.funnel(null));
        assertEquals(List.of(new AnalyticsModels.TransitionRow("search", "product", 1)),
                analyticsService.transitions(null, null));
        assertEquals(2, analyticsService.sessions().get(0).eventsCount());
    }

    private static String at(long seconds) {
        return T0.plusSeconds(seconds).toString();
    }

    private static AnalyticsModels.EventIngestRequest request(AnalyticsModels.EventIn... events) {
        return new AnalyticsModels.EventIngestRequest(List.of(events));
    }
}
