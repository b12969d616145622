package com.hegel.fusion.core;

import java.util.*;

/**
 * A weighted multi-criteria objective over the evidence graph. Components without an explicit
 * weight count with weight 1.0.
 */
public record ObjectiveFunction(String name, List<Component> components, Map<String, Double> weights) {

    public static final String MOLECULAR_IDENTITY = "molecular_identity_validation";
    public static final double DEFAULT_WEIGHT = 1.0;

    public ObjectiveFunction {
        components = components == null ? List.of() : List.copyOf(components);
        weights = weights == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(weights));
    }

    public enum Kind {
        MAXIMIZE_CONFIDENCE,
        MINIMIZE_UNCERTAINTY,
        MAXIMIZE_CONSISTENCY,
        MINIMIZE_CONFLICTS,
        MAXIMIZE_NETWORK_COHERENCE;

        public static Kind parse(String value) {
            return Kind.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        }
    }

    public record Component(String name, Kind kind, Map<String, Double> parameters) {
        public Component {
            parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        }

        public Component(String name, Kind kind) {
            this(name, kind, Map.of());
        }
    }

    public double weightOf(String componentName) {
        return weights.getOrDefault(componentName, DEFAULT_WEIGHT);
    }

    public static ObjectiveFunction molecularIdentity() {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("confidence", 0.3);
        weights.put("uncertainty", 0.2);
        weights.put("consistency", 0.25);
        weights.put("conflicts", 0.15);
        weights.put("coherence", 0.1);
        return new ObjectiveFunction(MOLECULAR_IDENTITY, List.of(
                new Component("confidence", Kind.MAXIMIZE_CONFIDENCE),
                new Component("uncertainty", Kind.MINIMIZE_UNCERTAINTY),
                new Component("consistency", Kind.MAXIMIZE_CONSISTENCY),
                new Component("conflicts", Kind.MINIMIZE_CONFLICTS),
                new Component("coherence", Kind.MAXIMIZE_NETWORK_COHERENCE)
        ), weights);
    }
}
