package com.clickstream.analytics.analytics;

import com.clickstream.analytics.analytics.AnalyticsModels.FunnelRow;
import com.clickstream.analytics.analytics.AnalyticsModels.ReachedSteps;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class FunnelAggregator {

    public List<FunnelRow> aggregate(List<ReachedSteps> reached, StepList steps) {
        Map<String, Set<String>> sessionsByStep = new HashMap<>();
        Map<String, Set<String>> usersByStep = new HashMap<>();
        for (ReachedSteps session : reached) {
            for (String step : session.reached()) {
                sessionsByStep.computeIfAbsent(step, k -> new HashSet<>()).add(session.sessionId());
                usersByStep.computeIfAbsent(step, k -> new HashSet<>()).add(session.userId());
            }
        }

        // step list order, steps nobody reached are left out
        return steps.steps().stream()
                .filter(sessionsByStep::containsKey)
                .map(step -> new FunnelRow(step,
                        sessionsByStep.get(step).size(),
                        usersByStep.get(step).size()))
                .toList();
    }
}
