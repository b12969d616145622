package com.hegel.fusion.core;

import java.util.*;

/**
 * Fuzzy rules and named objective functions a {@link FuzzyBayesianNetwork} runs with.
 */
public record FusionModel(List<FuzzyRule> rules, Map<String, ObjectiveFunction> objectives) {

    public static final String DEFAULT_OBJECTIVE = "default";

    public FusionModel {
        rules = rules == null ? List.of() : List.copyOf(rules);
        objectives = objectives == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(objectives));
    }

    public static FusionModel defaults() {
        Map<String, ObjectiveFunction> objectives = new LinkedHashMap<>();
        objectives.put(DEFAULT_OBJECTIVE, ObjectiveFunction.molecularIdentity());
        return new FusionModel(FuzzyRule.defaults(), objectives);
    }
}
