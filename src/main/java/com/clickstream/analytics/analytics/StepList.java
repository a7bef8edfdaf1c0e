package com.clickstream.analytics.analytics;

import com.clickstream.analytics.exception.InvalidStepListException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class StepList {
    private final List<String> steps;
    private final Map<String, Integer> ranks;

    private StepList(List<String> steps) {
        this.steps = List.copyOf(steps);
        Map<String, Integer> byStep = new LinkedHashMap<>();
        for (int i = 0; i < steps.size(); i++) {
            byStep.put(steps.get(i), i);
        }
        this.ranks = Collections.unmodifiableMap(byStep);
    }

    public static StepList of(List<String> steps) {
        if (steps == null || steps.isEmpty()) {
            throw new InvalidStepListException("at least one step is required");
        }
        Set<String> seen = new HashSet<>();
        for (String step : steps) {
            if (step == null || step.isBlank()) {
                throw new InvalidStepListException("step names must not be blank");
            }
            if (!seen.add(step)) {
                throw new InvalidStepListException("duplicate step '" + step + "'");
            }
        }
        return new StepList(steps);
    }

    public static StepList of(String... steps) {
        return of(Arrays.asList(steps));
    }

    public List<String> steps() {
        return steps;
    }

    public String first() {
        return steps.get(0);
    }

    public String last() {
        return steps.get(steps.size() - 1);
    }

    public boolean contains(String step) {
        return ranks.containsKey(step);
    }

    public Map<String, Integer> rankMap() {
        return ranks;
    }

    public List<StepPair> adjacentPairs() {
        List<StepPair> pairs = new ArrayList<>();
        for (int i = 0; i + 1 < steps.size(); i++) {
            pairs.add(new StepPair(steps.get(i), steps.get(i + 1)));
        }
        return pairs;
    }

    public record StepPair(String from, String to) {
        public String ratioColumn() {
            return "cr_" + from + "_to_" + to;
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StepList other && steps.equals(other.steps);
    }

    @Override
    public int hashCode() {
        return steps.hashCode();
    }

    @Override
    public String toString() {
        return String.join(" -> ", steps);
    }
}
