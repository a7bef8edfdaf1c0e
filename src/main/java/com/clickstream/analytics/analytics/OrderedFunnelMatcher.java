package com.clickstream.analytics.analytics;

import com.clickstream.analytics.analytics.AnalyticsModels.ReachedSteps;
import com.clickstream.analytics.analytics.AnalyticsModels.SessionSequence;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Component
public class OrderedFunnelMatcher {

    public ReachedSteps match(SessionSequence session, StepList steps) {
        List<String> actions = session.orderedActions();
        Set<String> reached = new LinkedHashSet<>();
        // single forward cursor; the first step not found ends the match
        int pos = 0;
        for (String step : steps.steps()) {
            int found = indexOf(actions, step, pos);
            if (found < 0) break;
            reached.add(step);
            pos = found + 1;
        }
        return new ReachedSteps(session.sessionId(), session.userId(), Collections.unmodifiableSet(reached));
    }

    public List<ReachedSteps> matchAll(List<SessionSequence> sessions, StepList steps) {
        return sessions.stream().map(s -> match(s, steps)).toList();
    }

    private int indexOf(List<String> actions, String step, int from) {
        for (int i = from; i < actions.size(); i++) {
            if (step.equals(actions.get(i))) return i;
        }
        return -1;
    }
}
