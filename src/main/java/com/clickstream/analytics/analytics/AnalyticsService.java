package com.clickstream.analytics.analytics;

import com.clickstream.analytics.analytics.AnalyticsModels.AnalyticsReport;
import com.clickstream.analytics.analytics.AnalyticsModels.ConversionTable;
import com.clickstream.analytics.analytics.AnalyticsModels.DailyKpi;
import com.clickstream.analytics.analytics.AnalyticsModels.EventAck;
import com.clickstream.analytics.analytics.AnalyticsModels.EventIn;
import com.clickstream.analytics.analytics.AnalyticsModels.EventIngestRequest;
import com.clickstream.analytics.analytics.AnalyticsModels.FunnelRow;
import com.clickstream.analytics.analytics.AnalyticsModels.TransitionRow;
import com.clickstream.analytics.analytics.ClickstreamAnalyzer.AnalysisOptions;
import com.clickstream.analytics.domain.DomainModels.Event;
import com.clickstream.analytics.domain.DomainModels.FieldNames;
import com.clickstream.analytics.domain.EventTable;
import com.clickstream.analytics.features.FeatureModels.SessionAggregate;
import com.clickstream.analytics.parser.TimestampParser;
import com.clickstream.analytics.repository.InMemoryEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

@Service
public class AnalyticsService {
    private static final Logger log = LoggerFactory.getLogger(AnalyticsService.class);

    private final InMemoryEventRepository repository;
    private final ClickstreamAnalyzer analyzer;
    private final Clock clock;
    private final AtomicReference<ReportSnapshot> latest = new AtomicReference<>();

    public AnalyticsService(InMemoryEventRepository repository, ClickstreamAnalyzer analyzer, Clock clock) {
        this.repository = repository;
        this.analyzer = analyzer;
        this.clock = clock;
    }

    public EventAck ingest(EventIngestRequest request) {
        if (request == null || request.events() == null) return new EventAck(0, 0);
        List<Event> accepted = request.events().stream()
                .filter(Objects::nonNull)
                .filter(e -> notBlank(e.userId()) && notBlank(e.sessionId()) && notBlank(e.action()))
                .map(this::toEvent)
                .toList();
        repository.saveEvents(accepted);
        int rejected = request.events().size() - accepted.size();
        if (rejected > 0) {
            log.warn("Rejected {} of {} posted events without user, session or action", rejected, request.events().size());
        }
        long badTimestamps = accepted.stream().filter(e -> !e.hasTimestamp()).count();
        if (badTimestamps > 0) {
            log.warn("{} posted events carry a missing or unparseable timestamp and are excluded from ordering-sensitive metrics", badTimestamps);
        }
        return new EventAck(accepted.size(), rejected);
    }

    @Scheduled(fixedDelayString = "${clickstream.analytics.recompute.fixed-delay-ms:300000}",
            initialDelayString = "${clickstream.analytics.recompute.initial-delay-ms:60000}")
    public void scheduledRecompute() {
        recompute();
    }

    public ReportSnapshot recompute() {
        AnalysisOptions options = analyzer.defaultOptions();
        EventTable table = EventTable.of(options.fields(), repository.loadEvents());
        ReportSnapshot snapshot = new ReportSnapshot(table, options, analyzer.analyze(table, options), Instant.now(clock));
        latest.set(snapshot);
        return snapshot;
    }

    public List<FunnelRow> funnel(List<String> steps) {
        ReportSnapshot snapshot = current();
        if (steps == null || steps.isEmpty()) return snapshot.report().funnel();
        return analyzer.funnel(snapshot.table(), StepList.of(steps), snapshot.options().fields());
    }

    public List<TransitionRow> transitions(List<String> steps, Boolean requireStepIncrease) {
        ReportSnapshot snapshot = current();
        boolean increase = requireStepIncrease == null ? snapshot.options().requireStepIncrease() : requireStepIncrease;
        if ((steps == null || steps.isEmpty()) && increase == snapshot.options().requireStepIncrease()) {
            return snapshot.report().transitions();
        }
        StepList stepList = (steps == null || steps.isEmpty()) ? snapshot.options().steps() : StepList.of(steps);
        return analyzer.transitions(snapshot.table(), stepList, snapshot.options().fields(), increase);
    }

    public ConversionTable conversion(List<String> steps) {
        ReportSnapshot snapshot = current();
        if (steps == null || steps.isEmpty()) return snapshot.report().conversionDaily();
        return analyzer.conversionDaily(snapshot.table(), StepList.of(steps), snapshot.options().fields());
    }

    public List<DailyKpi> kpis() {
        return current().report().kpisByDate();
    }

    public List<SessionAggregate> sessions() {
        return current().report().sessions();
    }

    private ReportSnapshot current() {
        ReportSnapshot snapshot = latest.get();
        return snapshot != null ? snapshot : recompute();
    }

    private Event toEvent(EventIn in) {
        String category = notBlank(in.category()) ? in.category() : FieldNames.UNKNOWN_CATEGORY;
        return Event.of(in.userId(), in.sessionId(), TimestampParser.parse(in.timestamp()), in.action(), in.value(), category);
    }

    private boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    public record ReportSnapshot(EventTable table, AnalysisOptions options, AnalyticsReport report, Instant computedAt) {}
}
