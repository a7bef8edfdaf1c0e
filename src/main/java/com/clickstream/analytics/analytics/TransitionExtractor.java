package com.clickstream.analytics.analytics;

import com.clickstream.analytics.analytics.AnalyticsModels.SessionSequence;
import com.clickstream.analytics.analytics.AnalyticsModels.SessionStep;
import com.clickstream.analytics.analytics.AnalyticsModels.TransitionRow;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

@Component
public class TransitionExtractor {
    private static final Comparator<Transition> ORDER =
            Comparator.comparing(Transition::action).thenComparing(Transition::nextAction);

    public List<TransitionRow> extract(List<SessionSequence> sessions,
                                       Map<String, Integer> rankMap,
                                       boolean requireStepIncrease) {
        Map<Transition, Set<String>> usersByTransition = new TreeMap<>(ORDER);
        for (SessionSequence session : sessions) {
            List<SessionStep> steps = session.orderedSteps();
            for (int i = 0; i + 1 < steps.size(); i++) {
                SessionStep current = steps.get(i);
                SessionStep next = steps.get(i + 1);
                Integer currentRank = rankMap.get(current.action());
                Integer nextRank = rankMap.get(next.action());
                if (currentRank == null || nextRank == null) continue;
                if (requireStepIncrease && nextRank < currentRank) continue;

                usersByTransition.computeIfAbsent(new Transition(current.action(), next.action()), k -> new HashSet<>())
                        .add(current.userId());
            }
        }

        return usersByTransition.entrySet().stream()
                .map(e -> new TransitionRow(e.getKey().action(), e.getKey().nextAction(), e.getValue().size()))
                .toList();
    }

    private record Transition(String action, String nextAction) {}
}
