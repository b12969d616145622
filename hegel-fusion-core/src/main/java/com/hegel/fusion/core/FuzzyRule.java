package com.hegel.fusion.core;

import java.util.List;
import java.util.Locale;

/**
 * IF every condition holds THEN adjust the consequent variable. Activation uses the minimum t-norm
 * over the antecedent, scaled by {@code weight}.
 */
public record FuzzyRule(String id, List<Condition> antecedent, Consequent consequent, double weight) {

    /** Consequent variable that adjusts a node's posterior probability. */
    public static final String POSTERIOR = "posterior";

    public FuzzyRule {
        antecedent = antecedent == null ? List.of() : List.copyOf(antecedent);
    }

    public enum Operator {
        IS,
        IS_NOT,
        GREATER_THAN,
        LESS_THAN;

        public static Operator parse(String value) {
            return Operator.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        }
    }

    public record Condition(String variable, String term, Operator operator) {}

    public record Consequent(String variable, String term, double adjustment) {}

    public static List<FuzzyRule> defaults() {
        return List.of(
                new FuzzyRule("high_confidence_support",
                        List.of(new Condition(LinguisticVariable.CONFIDENCE, LinguisticVariable.HIGH, Operator.IS)),
                        new Consequent(POSTERIOR, "increase", 0.1),
                        1.0),
                new FuzzyRule("conflicting_evidence_penalty",
                        List.of(new Condition(LinguisticVariable.AGREEMENT, LinguisticVariable.CONFLICTING, Operator.IS)),
                        new Consequent(POSTERIOR, "decrease", -0.2),
                        1.0)
        );
    }
}
