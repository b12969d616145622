package com.hegel.fusion.core;

import com.hegel.fusion.core.FuzzyRule.Condition;
import com.hegel.fusion.core.ObjectiveFunction.Component;
import com.hegel.fusion.exceptions.FusionModelException;

import java.util.*;

/**
 * Validator for fusion models: rule references, weight ranges and objective consistency.
 */
public final class FusionModelValidator {
    private FusionModelValidator() {}

    public static void validate(FusionModel model) {
        validate(model, LinguisticVariable.builtIns());
    }

    public static void validate(FusionModel model, Map<String, LinguisticVariable> variables) {
        if (model == null) return;

        Set<String> ruleIds = new HashSet<>();
        for (FuzzyRule rule : model.rules()) {
            require(rule.id() != null && !rule.id().isBlank(), "Rule id must be non-empty");
            require(ruleIds.add(rule.id()), "Duplicate rule id '" + rule.id() + "'");
            require(rule.weight() >= 0.0 && rule.weight() <= 1.0,
                    "Weight of rule '" + rule.id() + "' must be within [0,1] but was " + rule.weight());
            require(!rule.antecedent().isEmpty(), "Rule '" + rule.id() + "' has no conditions");
            require(rule.consequent() != null, "Rule '" + rule.id() + "' has no consequent");
            for (Condition c : rule.antecedent()) {
                require(c.operator() != null, "Missing operator in rule '" + rule.id() + "'");
                LinguisticVariable v = variables.get(c.variable());
                require(v != null, "Unknown variable '" + c.variable() + "' in rule '" + rule.id() + "'");
                require(v.hasTerm(c.term()),
                        "Unknown term '" + c.term() + "' of variable '" + c.variable() + "' in rule '" + rule.id() + "'");
            }
        }

        for (Map.Entry<String, ObjectiveFunction> entry : model.objectives().entrySet()) {
            ObjectiveFunction fn = entry.getValue();
            require(fn != null, "Objective '" + entry.getKey() + "' is empty");
            Set<String> names = new HashSet<>();
            for (Component c : fn.components()) {
                require(c.kind() != null, "Component '" + c.name() + "' of objective '" + fn.name() + "' has no kind");
                require(names.add(c.name()), "Duplicate component '" + c.name() + "' in objective '" + fn.name() + "'");
            }
            fn.weights().forEach((name, weight) -> {
                require(names.contains(name), "Weight for unknown component '" + name + "' in objective '" + fn.name() + "'");
                require(weight != null && weight >= 0.0,
                        "Weight of component '" + name + "' in objective '" + fn.name() + "' must be non-negative");
            });
        }
    }

    private static void require(boolean cond, String msg) {
        if (!cond) throw new FusionModelException(msg);
    }
}
