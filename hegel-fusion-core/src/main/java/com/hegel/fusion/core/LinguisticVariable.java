package com.hegel.fusion.core;

import com.hegel.fusion.core.MembershipFunction.Trapezoidal;
import com.hegel.fusion.core.MembershipFunction.Triangular;

import java.util.*;

/**
 * A named fuzzy variable over a bounded universe. Terms keep their declaration order,
 * which ordered rule operators rely on.
 */
public final class LinguisticVariable {

    public static final String CONFIDENCE = "confidence";
    public static final String AGREEMENT = "agreement";

    public static final String VERY_LOW = "very_low";
    public static final String LOW = "low";
    public static final String MEDIUM = "medium";
    public static final String HIGH = "high";
    public static final String VERY_HIGH = "very_high";

    public static final String CONFLICTING = "conflicting";
    public static final String NEUTRAL = "neutral";
    public static final String SUPPORTING = "supporting";

    private final String name;
    private final double universeMin;
    private final double universeMax;
    private final Map<String, MembershipFunction> terms;

    public LinguisticVariable(String name, double universeMin, double universeMax,
                              Map<String, MembershipFunction> terms) {
        this.name = Objects.requireNonNull(name, "name");
        this.universeMin = universeMin;
        this.universeMax = universeMax;
        this.terms = Collections.unmodifiableMap(new LinkedHashMap<>(terms));
    }

    public static LinguisticVariable confidence() {
        Map<String, MembershipFunction> terms = new LinkedHashMap<>();
        terms.put(VERY_LOW, new Triangular(0.0, 0.0, 0.2));
        terms.put(LOW, new Triangular(0.0, 0.2, 0.4));
        terms.put(MEDIUM, new Triangular(0.2, 0.5, 0.8));
        terms.put(HIGH, new Triangular(0.6, 0.8, 1.0));
        terms.put(VERY_HIGH, new Triangular(0.8, 1.0, 1.0));
        return new LinguisticVariable(CONFIDENCE, 0.0, 1.0, terms);
    }

    public static LinguisticVariable agreement() {
        Map<String, MembershipFunction> terms = new LinkedHashMap<>();
        terms.put(CONFLICTING, new Trapezoidal(0.0, 0.0, 0.3, 0.5));
        terms.put(NEUTRAL, new Triangular(0.3, 0.5, 0.7));
        terms.put(SUPPORTING, new Trapezoidal(0.5, 0.7, 1.0, 1.0));
        return new LinguisticVariable(AGREEMENT, 0.0, 1.0, terms);
    }

    /**
     * The built-in variables keyed by name.
     */
    public static Map<String, LinguisticVariable> builtIns() {
        Map<String, LinguisticVariable> vars = new LinkedHashMap<>();
        vars.put(CONFIDENCE, confidence());
        vars.put(AGREEMENT, agreement());
        return Collections.unmodifiableMap(vars);
    }

    /**
     * Membership degree of {@code value} for every term, zero degrees included.
     */
    public Map<String, Double> fuzzify(double value) {
        Map<String, Double> out = new LinkedHashMap<>();
        terms.forEach((term, fn) -> out.put(term, fn.membership(value)));
        return out;
    }

    public List<String> termOrder() {
        return List.copyOf(terms.keySet());
    }

    public boolean hasTerm(String term) {
        return terms.containsKey(term);
    }

    public String name() { return name; }
    public double universeMin() { return universeMin; }
    public double universeMax() { return universeMax; }
    public Map<String, MembershipFunction> terms() { return terms; }
}
