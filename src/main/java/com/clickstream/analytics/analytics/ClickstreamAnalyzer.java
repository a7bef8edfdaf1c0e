package com.clickstream.analytics.analytics;

import com.clickstream.analytics.analytics.AnalyticsModels.AnalyticsReport;
import com.clickstream.analytics.analytics.AnalyticsModels.ConversionTable;
import com.clickstream.analytics.analytics.AnalyticsModels.FunnelRow;
import com.clickstream.analytics.analytics.AnalyticsModels.SessionSequence;
import com.clickstream.analytics.analytics.AnalyticsModels.TransitionRow;
import com.clickstream.analytics.cohort.CohortModels.ActivityThresholds;
import com.clickstream.analytics.cohort.CohortService;
import com.clickstream.analytics.config.AnalyticsProperties;
import com.clickstream.analytics.domain.DomainModels.FieldNames;
import com.clickstream.analytics.domain.EventTable;
import com.clickstream.analytics.features.FeatureModels.SessionEvent;
import com.clickstream.analytics.features.SessionFeatureService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

@Service
public class ClickstreamAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(ClickstreamAnalyzer.class);

    private final SessionGrouper grouper;
    private final OrderedFunnelMatcher matcher;
    private final FunnelAggregator aggregator;
    private final TransitionExtractor transitionExtractor;
    private final CohortConversionCalculator conversionCalculator;
    private final KpiCalculator kpiCalculator;
    private final SessionFeatureService featureService;
    private final CohortService cohortService;
    private final AnalyticsProperties properties;
    private final Clock clock;

    public ClickstreamAnalyzer(SessionGrouper grouper,
                               OrderedFunnelMatcher matcher,
                               FunnelAggregator aggregator,
                               TransitionExtractor transitionExtractor,
                               CohortConversionCalculator conversionCalculator,
                               KpiCalculator kpiCalculator,
                               SessionFeatureService featureService,
                               CohortService cohortService,
                               AnalyticsProperties properties,
                               Clock clock) {
        this.grouper = grouper;
        this.matcher = matcher;
        this.aggregator = aggregator;
        this.transitionExtractor = transitionExtractor;
        this.conversionCalculator = conversionCalculator;
        this.kpiCalculator = kpiCalculator;
        this.featureService = featureService;
        this.cohortService = cohortService;
        this.properties = properties;
        this.clock = clock;
    }

    public AnalysisOptions defaultOptions() {
        return new AnalysisOptions(
                properties.stepList(),
                properties.fields().toFieldNames(),
                properties.requireStepIncrease(),
                properties.ordersAction(),
                LocalDate.now(clock),
                properties.activity().toThresholds());
    }

    public List<FunnelRow> funnel(EventTable table, StepList steps, FieldNames fields) {
        return funnel(grouper.group(table, fields), steps);
    }

    public List<TransitionRow> transitions(EventTable table, StepList steps, FieldNames fields, boolean requireStepIncrease) {
        return transitionExtractor.extract(grouper.group(table, fields), steps.rankMap(), requireStepIncrease);
    }

    public ConversionTable conversionDaily(EventTable table, StepList steps, FieldNames fields) {
        return conversionCalculator.compute(table, steps, fields);
    }

    public AnalyticsReport analyze(EventTable table, AnalysisOptions options) {
        long started = System.nanoTime();
        List<SessionSequence> sessions = grouper.group(table, options.fields());
        List<FunnelRow> funnel = funnel(sessions, options.steps());
        List<TransitionRow> transitions = transitionExtractor.extract(sessions, options.steps().rankMap(), options.requireStepIncrease());
        ConversionTable conversion = conversionCalculator.compute(table, options.steps(), options.fields());
        log.debug("Core passes over {} sessions took {} ms", sessions.size(), (System.nanoTime() - started) / 1_000_000);

        List<SessionEvent> sessionEvents = featureService.enrich(table, options.fields());
        AnalyticsReport report = new AnalyticsReport(
                funnel,
                transitions,
                conversion,
                featureService.sessionAggregates(table, options.fields()),
                sessionEvents,
                featureService.productToCartTransitions(sessionEvents),
                kpiCalculator.kpisByDate(table, options.ordersAction()),
                cohortService.activitySegments(table, options.today(), options.activityThresholds()),
                cohortService.cohortMonthRetention(table));

        log.info("Analyzed {} events in {} sessions: {} funnel steps, {} transitions, {} cohort dates",
                table.size(), sessions.size(), funnel.size(), transitions.size(), conversion.rows().size());
        return report;
    }

    private List<FunnelRow> funnel(List<SessionSequence> sessions, StepList steps) {
        return aggregator.aggregate(matcher.matchAll(sessions, steps), steps);
    }

    public record AnalysisOptions(StepList steps,
                                  FieldNames fields,
                                  boolean requireStepIncrease,
                                  String ordersAction,
                                  LocalDate today,
                                  ActivityThresholds activityThresholds) {}
}
