package com.hegel.fusion.core;

import com.hegel.fusion.core.FuzzyRule.Condition;
import com.hegel.fusion.core.FuzzyRule.Consequent;
import com.hegel.fusion.core.FuzzyRule.Operator;
import com.hegel.fusion.core.ObjectiveFunction.Component;
import com.hegel.fusion.core.ObjectiveFunction.Kind;
import com.hegel.fusion.exceptions.FusionModelException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class FusionModelValidatorTest {

    private static final Condition HIGH = new Condition("confidence", "high", Operator.IS);
    private static final Consequent BOOST = new Consequent("posterior", "increase", 0.1);

    private static FusionModel rules(FuzzyRule... rules) {
        return new FusionModel(List.of(rules), Map.of());
    }

    private static FusionModel objective(ObjectiveFunction fn) {
        return new FusionModel(List.of(), Map.of("o", fn));
    }

    @Test
    public void testDefaultsAreValid() {
        assertDoesNotThrow(() -> FusionModelValidator.validate(FusionModel.defaults()));
    }

    @Test
    public void testRuleChecks() {
        assertThrows(FusionModelException.class, () -> FusionModelValidator.validate(
                rules(new FuzzyRule(" ", List.of(HIGH), BOOST, 1.0))));
        FusionModelException dup = assertThrows(FusionModelException.class, () -> FusionModelValidator.validate(
                rules(new FuzzyRule("r", List.of(HIGH), BOOST, 1.0), new FuzzyRule("r", List.of(HIGH), BOOST, 0.5))));
        assertTrue(dup.getMessage().contains("Duplicate rule id 'r'"));
        assertThrows(FusionModelException.class, () -> FusionModelValidator.validate(
                rules(new FuzzyRule("r", List.of(HIGH), BOOST, 1.5))));
        assertThrows(FusionModelException.class, () -> FusionModelValidator.validate(
                rules(new FuzzyRule("r", List.of(), BOOST, 1.0))));
        assertThrows(FusionModelException.class, () -> FusionModelValidator.validate(
                rules(new FuzzyRule("r", List.of(HIGH), null, 1.0))));
    }

    @Test
    public void testConditionReferencesMustResolve() {
        FusionModelException unknownVar = assertThrows(FusionModelException.class, () -> FusionModelValidator.validate(
                rules(new FuzzyRule("r", List.of(new Condition("pressure", "high", Operator.IS)), BOOST, 1.0))));
        assertTrue(unknownVar.getMessage().contains("pressure"));

        FusionModelException unknownTerm = assertThrows(FusionModelException.class, () -> FusionModelValidator.validate(
                rules(new FuzzyRule("r", List.of(new Condition("agreement", "high", Operator.IS)), BOOST, 1.0))));
        assertTrue(unknownTerm.getMessage().contains("Unknown term 'high'"));
    }

    @Test
    public void testObjectiveChecks() {
        Component conf = new Component("confidence", Kind.MAXIMIZE_CONFIDENCE);

        assertThrows(FusionModelException.class, () -> FusionModelValidator.validate(objective(
                new ObjectiveFunction("o", List.of(conf, conf), Map.of()))));
        assertThrows(FusionModelException.class, () -> FusionModelValidator.validate(objective(
                new ObjectiveFunction("o", List.of(conf), Map.of("coherence", 0.5)))));
        assertThrows(FusionModelException.class, () -> FusionModelValidator.validate(objective(
                new ObjectiveFunction("o", List.of(conf), Map.of("confidence", -0.1)))));
        assertDoesNotThrow(() -> FusionModelValidator.validate(objective(
                new ObjectiveFunction("o", List.of(conf), Map.of("confidence", 0.0)))));
    }
}
