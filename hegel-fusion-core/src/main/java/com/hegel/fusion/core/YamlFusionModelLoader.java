package com.hegel.fusion.core;

import com.hegel.fusion.core.FuzzyRule.Condition;
import com.hegel.fusion.core.FuzzyRule.Consequent;
import com.hegel.fusion.core.ObjectiveFunction.Component;
import com.hegel.fusion.exceptions.FusionModelException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Loads a {@link FusionModel} from a YAML file or classpath resource.
 * <pre>
 * rules:
 *   - id: high_confidence_support
 *     weight: 1.0
 *     when: [{ variable: confidence, term: high, operator: is }]
 *     then: { variable: posterior, term: increase, adjustment: 0.1 }
 * objectives:
 *   - name: default
 *     function: molecular_identity_validation
 *     components: [{ name: confidence, kind: maximize_confidence }]
 *     weights: { confidence: 0.3 }
 * </pre>
 */
public final class YamlFusionModelLoader {

    // DTOs mirroring YAML
    public record YModel(Integer version, List<YRule> rules, List<YObjective> objectives) {}
    public record YRule(String id, Double weight, List<YCondition> when, YConsequent then) {}
    public record YCondition(String variable, String term, String operator) {}
    public record YConsequent(String variable, String term, Double adjustment) {}
    public record YObjective(String name, String function, List<YComponent> components, Map<String, Double> weights) {}
    public record YComponent(String name, String kind, Map<String, Double> parameters) {}

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public FusionModel loadFromClasspath(String resourcePath) throws IOException {
        try (InputStream in = getClass().getResourceAsStream(resourcePath)) {
            if (in == null) throw new IOException("Resource not found: " + resourcePath);
            return toModel(mapper.readValue(in, YModel.class));
        }
    }

    public FusionModel loadFromPath(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return toModel(mapper.readValue(in, YModel.class));
        }
    }

    public FusionModel load(InputStream in) throws IOException {
        return toModel(mapper.readValue(in, YModel.class));
    }

    private FusionModel toModel(YModel y) {
        if (y == null) throw new FusionModelException("Empty fusion model document");

        List<FuzzyRule> rules = new ArrayList<>();
        for (YRule r : Optional.ofNullable(y.rules()).orElse(List.of())) {
            List<Condition> conditions = Optional.ofNullable(r.when()).orElse(List.of()).stream()
                    .map(c -> new Condition(c.variable(), c.term(), operator(c.operator(), r.id())))
                    .collect(Collectors.toList());
            YConsequent then = r.then();
            Consequent consequent = then == null ? null
                    : new Consequent(then.variable(), then.term(), Optional.ofNullable(then.adjustment()).orElse(0.0));
            rules.add(new FuzzyRule(r.id(), conditions, consequent, Optional.ofNullable(r.weight()).orElse(1.0)));
        }

        Map<String, ObjectiveFunction> objectives = new LinkedHashMap<>();
        for (YObjective o : Optional.ofNullable(y.objectives()).orElse(List.of())) {
            if (o.name() == null || o.name().isBlank()) {
                throw new FusionModelException("Objective name must be non-empty");
            }
            List<Component> components = Optional.ofNullable(o.components()).orElse(List.of()).stream()
                    .map(c -> new Component(c.name(), kind(c.kind(), c.name()), c.parameters()))
                    .collect(Collectors.toList());
            String function = o.function() == null || o.function().isBlank() ? o.name() : o.function();
            objectives.put(o.name(), new ObjectiveFunction(function, components, o.weights()));
        }

        FusionModel model = new FusionModel(rules, objectives);
        FusionModelValidator.validate(model);
        return model;
    }

    private static FuzzyRule.Operator operator(String value, String ruleId) {
        if (value == null || value.isBlank()) return FuzzyRule.Operator.IS;
        try {
            return FuzzyRule.Operator.parse(value);
        } catch (IllegalArgumentException iae) {
            throw new FusionModelException("Unknown operator '" + value + "' in rule '" + ruleId
                    + "'. Expected one of: " + Arrays.toString(FuzzyRule.Operator.values()), iae);
        }
    }

    private static ObjectiveFunction.Kind kind(String value, String componentName) {
        if (value == null || value.isBlank()) {
            throw new FusionModelException("Component '" + componentName + "' has no kind");
        }
        try {
            return ObjectiveFunction.Kind.parse(value);
        } catch (IllegalArgumentException iae) {
            throw new FusionModelException("Unknown objective kind '" + value + "' for component '" + componentName
                    + "'. Expected one of: " + Arrays.toString(ObjectiveFunction.Kind.values()), iae);
        }
    }
}
