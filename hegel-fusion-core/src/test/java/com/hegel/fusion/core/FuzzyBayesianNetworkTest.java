package com.hegel.fusion.core;

import com.hegel.fusion.core.FuzzyRule.Condition;
import com.hegel.fusion.core.FuzzyRule.Consequent;
import com.hegel.fusion.core.FuzzyRule.Operator;
import com.hegel.fusion.core.OptimizationRecommendation.Action;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class FuzzyBayesianNetworkTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final FusionModel BARE = new FusionModel(List.of(), Map.of());

    private static FuzzyEvidence evidence(String id, double raw) {
        return FuzzyEvidence.fromRawEvidence(id, "lab", EvidenceTypes.GENOMICS, raw, NOW, NOW, true);
    }

    private static FuzzyRule rule(String id, double weight, double adjustment, Condition... conditions) {
        return new FuzzyRule(id, List.of(conditions), new Consequent(FuzzyRule.POSTERIOR, "adjust", adjustment), weight);
    }

    private static Condition confidence(String term, Operator op) {
        return new Condition(LinguisticVariable.CONFIDENCE, term, op);
    }

    @Test
    public void testBayesUpdateWithoutRules() {
        FuzzyBayesianNetwork net = new FuzzyBayesianNetwork(BARE);
        EvidenceNode n = net.addEvidence(evidence("a", 0.8));
        net.updateNetwork();
        assertEquals(0.8, n.getPosteriorProbability(), 1e-9);
    }

    @Test
    public void testPosteriorsStayBounded() {
        FuzzyBayesianNetwork net = new FuzzyBayesianNetwork();
        for (int i = 0; i <= 20; i++) {
            net.addEvidence(evidence("e" + i, i / 20.0));
        }
        net.graph().addEdge(new EvidenceEdge("e0", "e20", EvidenceRelationship.CONTRADICTS, 1.0));
        net.graph().addEdge(new EvidenceEdge("e19", "e20", EvidenceRelationship.SUPPORTS, 0.9));
        net.updateNetwork();
        for (EvidenceNode n : net.graph().nodes()) {
            assertTrue(n.getPosteriorProbability() >= 0.0 && n.getPosteriorProbability() <= 1.0, n.toString());
        }
    }

    @Test
    public void testDegenerateBayesUpdateKeepsPosterior() {
        FuzzyBayesianNetwork net = new FuzzyBayesianNetwork(BARE);
        // a century of decay drives the likelihood to zero
        FuzzyEvidence ancient = FuzzyEvidence.fromRawEvidence("a", "lab", EvidenceTypes.GENOMICS, 0.8,
                NOW.minus(Duration.ofDays(36500)), NOW, true);
        EvidenceNode n = net.addEvidence(ancient);
        n.setPriorProbability(1.0);
        assertEquals(0.0, ancient.defuzzifiedConfidence());

        net.updateBayesianProbabilities();
        assertEquals(0.5, n.getPosteriorProbability());
    }

    @Test
    public void testDefaultRulesAndObjectiveForSingleItem() {
        FuzzyBayesianNetwork net = new FuzzyBayesianNetwork();
        EvidenceNode n = net.addEvidence(evidence("a", 0.8));

        net.applyFuzzyRules();
        assertEquals(0.1, n.getRuleAdjustment(), 1e-9);
        net.updateBayesianProbabilities();
        assertEquals(0.9, n.getPosteriorProbability(), 1e-9);

        net.propagateInfluence();
        net.optimizeWithObjectiveFunctions();
        assertEquals(1.0, n.getPosteriorProbability(), 1e-9);

        ObjectiveResult result = net.lastObjectiveResults().get(FusionModel.DEFAULT_OBJECTIVE);
        assertNotNull(result);
        assertEquals(0.25, result.componentScores().get("coherence"), 1e-9);
        assertEquals(1, result.recommendations().size());
        assertEquals("Improve coherence score from 0.25", result.recommendations().get(0).reasoning());
    }

    @Test
    public void testRepeatedUpdatesAreIdempotent() {
        FuzzyBayesianNetwork net = new FuzzyBayesianNetwork();
        EvidenceNode a = net.addEvidence(evidence("a", 0.8));
        EvidenceNode b = net.addEvidence(evidence("b", 0.4));
        net.graph().addEdge(new EvidenceEdge("a", "b", EvidenceRelationship.SUPPORTS, 0.6));

        net.updateNetwork();
        double posteriorA = a.getPosteriorProbability();
        double posteriorB = b.getPosteriorProbability();
        double influenceB = b.getNetworkInfluence();

        net.updateNetwork();
        assertEquals(posteriorA, a.getPosteriorProbability(), 1e-12);
        assertEquals(posteriorB, b.getPosteriorProbability(), 1e-12);
        assertEquals(influenceB, b.getNetworkInfluence(), 1e-12);
    }

    @Test
    public void testInfluenceByRelationship() {
        Map<EvidenceRelationship, Double> expected = Map.of(
                EvidenceRelationship.SUPPORTS, 0.4,
                EvidenceRelationship.CONTRADICTS, 0.1,
                EvidenceRelationship.CORROBORATES, 0.32,
                EvidenceRelationship.IMPLIES, 0.36,
                EvidenceRelationship.REQUIRES, 0.5);

        expected.forEach((relationship, influence) -> {
            FuzzyBayesianNetwork net = new FuzzyBayesianNetwork(BARE);
            EvidenceNode a = net.addEvidence(evidence("a", 0.8));
            EvidenceNode b = net.addEvidence(evidence("b", 0.8));
            a.setPosteriorProbability(0.8);
            net.graph().addEdge(new EvidenceEdge("a", "b", relationship, 0.5));

            net.propagateInfluence();
            assertEquals(influence, b.getNetworkInfluence(), 1e-9, relationship.name());
            assertEquals(0.0, a.getNetworkInfluence(), 1e-9);
        });
    }

    @Test
    public void testRequiresIsAStepFunction() {
        assertEquals(0.0, EvidenceRelationship.REQUIRES.influence(0.5));
        assertEquals(1.0, EvidenceRelationship.REQUIRES.influence(0.51));
    }

    @Test
    public void testInfluenceIsRebuiltEachCycle() {
        FuzzyBayesianNetwork net = new FuzzyBayesianNetwork(BARE);
        EvidenceNode a = net.addEvidence(evidence("a", 0.8));
        EvidenceNode b = net.addEvidence(evidence("b", 0.8));
        a.setPosteriorProbability(0.8);
        net.graph().addEdge(new EvidenceEdge("a", "b", EvidenceRelationship.SUPPORTS, 1.0));

        net.propagateInfluence();
        net.propagateInfluence();
        assertEquals(0.8, b.getNetworkInfluence(), 1e-9);
    }

    @Test
    public void testEdgesToMissingNodesAreSkipped() {
        FuzzyBayesianNetwork net = new FuzzyBayesianNetwork();
        EvidenceNode a = net.addEvidence(evidence("a", 0.8));
        net.graph().addEdge(new EvidenceEdge("a", "ghost", EvidenceRelationship.SUPPORTS, 0.9));
        net.graph().addEdge(new EvidenceEdge("phantom", "a", EvidenceRelationship.SUPPORTS, 0.9));

        assertDoesNotThrow(net::updateNetwork);
        assertEquals(0.0, a.getNetworkInfluence());
    }

    @Test
    public void testConditionOperators() {
        FuzzyBayesianNetwork net = new FuzzyBayesianNetwork(BARE);
        FuzzyEvidence e = evidence("a", 0.8);

        assertEquals(1.0, net.conditionSatisfaction(confidence("high", Operator.IS), e), 1e-9);
        assertEquals(0.0, net.conditionSatisfaction(confidence("high", Operator.IS_NOT), e), 1e-9);
        assertEquals(1.0, net.conditionSatisfaction(confidence("medium", Operator.GREATER_THAN), e), 1e-9);
        assertEquals(0.0, net.conditionSatisfaction(confidence("high", Operator.LESS_THAN), e), 1e-9);
        assertEquals(1.0, net.conditionSatisfaction(confidence("very_high", Operator.LESS_THAN), e), 1e-9);
        assertEquals(0.0, net.conditionSatisfaction(confidence("very_high", Operator.GREATER_THAN), e), 1e-9);
    }

    @Test
    public void testUnknownOrUnsetVariablesAreUnsatisfied() {
        FuzzyBayesianNetwork net = new FuzzyBayesianNetwork(BARE);
        FuzzyEvidence e = evidence("a", 0.8);

        assertEquals(0.0, net.conditionSatisfaction(new Condition("pressure", "high", Operator.IS), e));
        assertEquals(0.0, net.conditionSatisfaction(confidence("enormous", Operator.IS_NOT), e));
        // agreement is only known once the batch has been compared
        assertEquals(0.0, net.conditionSatisfaction(
                new Condition(LinguisticVariable.AGREEMENT, "conflicting", Operator.IS_NOT), e));
    }

    @Test
    public void testRuleActivationUsesMinimumAndWeight() {
        FuzzyBayesianNetwork net = new FuzzyBayesianNetwork(BARE);
        FuzzyEvidence e = evidence("a", 0.9);

        FuzzyRule weighted = rule("r1", 0.5, 0.1, confidence("high", Operator.IS));
        assertEquals(0.25, net.ruleActivation(weighted, e), 1e-6);

        FuzzyRule contradictory = rule("r2", 1.0, 0.1,
                confidence("high", Operator.IS), confidence("medium", Operator.IS));
        assertEquals(0.0, net.ruleActivation(contradictory, e), 1e-9);
    }

    @Test
    public void testRuleAdjustmentsAreSummedAndReset() {
        FusionModel model = new FusionModel(List.of(
                rule("boost", 1.0, 0.1, confidence("high", Operator.IS)),
                rule("boost_more", 0.5, 0.2, confidence("medium", Operator.GREATER_THAN))), Map.of());
        FuzzyBayesianNetwork net = new FuzzyBayesianNetwork(model);
        EvidenceNode n = net.addEvidence(evidence("a", 0.8));

        net.applyFuzzyRules();
        assertEquals(0.2, n.getRuleAdjustment(), 1e-9);
        net.applyFuzzyRules();
        assertEquals(0.2, n.getRuleAdjustment(), 1e-9);
    }

    @Test
    public void testConflictingAgreementIsPenalised() {
        FuzzyBayesianNetwork net = new FuzzyBayesianNetwork(new FusionModel(FuzzyRule.defaults(), Map.of()));
        FuzzyEvidence e = evidence("a", 0.5);
        e.updateAgreement(0.1);
        EvidenceNode n = net.addEvidence(e);

        net.updateNetwork();
        assertEquals(-0.2, n.getRuleAdjustment(), 1e-9);
        assertEquals(0.3, n.getPosteriorProbability(), 1e-9);
    }

    @Test
    public void testRulesOnOtherVariablesAreIgnored() {
        FuzzyRule other = new FuzzyRule("prior_rule", List.of(confidence("high", Operator.IS)),
                new Consequent("prior", "increase", 0.3), 1.0);
        FuzzyBayesianNetwork net = new FuzzyBayesianNetwork(new FusionModel(List.of(other), Map.of()));
        EvidenceNode n = net.addEvidence(evidence("a", 0.8));

        net.applyFuzzyRules();
        assertEquals(0.0, n.getRuleAdjustment());
    }

    @Test
    public void testRecommendationTargets() {
        FuzzyBayesianNetwork net = new FuzzyBayesianNetwork(BARE);
        EvidenceNode a = net.addEvidence(evidence("a", 0.8));
        EvidenceNode b = net.addEvidence(evidence("b", 0.8));
        EvidenceNode x = net.graph().addNode(EvidenceNode.placeholder("x", EvidenceTypes.GENOMICS));
        a.setPosteriorProbability(0.6);
        b.setPosteriorProbability(0.95);

        net.applyRecommendation(new OptimizationRecommendation(OptimizationRecommendation.GLOBAL,
                Action.ADJUST_CONFIDENCE, 0.1, "test"));
        assertEquals(0.7, a.getPosteriorProbability(), 1e-9);
        assertEquals(1.0, b.getPosteriorProbability(), 1e-9);
        assertEquals(0.5, x.getPosteriorProbability(), 1e-9);

        net.applyRecommendation(new OptimizationRecommendation("a", Action.ADJUST_CONFIDENCE, -0.2, "test"));
        assertEquals(0.5, a.getPosteriorProbability(), 1e-9);
        assertEquals(1.0, b.getPosteriorProbability(), 1e-9);

        net.applyRecommendation(new OptimizationRecommendation("a", Action.ADD_EDGE, 0.5, "test"));
        assertEquals(0.5, a.getPosteriorProbability(), 1e-9);
        assertEquals(0, net.graph().edgeCount());
    }

    @Test
    public void testPredictionFromNeighbours() {
        FuzzyBayesianNetwork net = new FuzzyBayesianNetwork(BARE);
        net.addEvidence(evidence("a", 0.8));
        net.addEvidence(evidence("b", 0.9));
        net.graph().addNode(EvidenceNode.placeholder("x", EvidenceTypes.GENOMICS));
        net.graph().addEdge(new EvidenceEdge("a", "x", EvidenceRelationship.CORROBORATES, 0.8));
        net.graph().addEdge(new EvidenceEdge("b", "x", EvidenceRelationship.CORROBORATES, 0.9));

        List<EvidencePrediction> predictions = net.predictMissingEvidence(List.of("a", "b"));
        assertEquals(1, predictions.size());

        EvidencePrediction p = predictions.get(0);
        assertEquals("x", p.nodeId());
        assertEquals(List.of("a", "b"), p.supportingEvidence());
        assertEquals("Predicted based on 2 connected evidence nodes", p.reasoning());
        assertEquals(1.405625 / 1.675, p.confidence(), 1e-9);
        assertEquals(1.4275 / 1.675, p.predictedValue(), 1e-9);
        assertTrue(p.confidence() >= 0.8 && p.confidence() <= 0.875);
    }

    @Test
    public void testPredictionSkipsKnownAndIsolatedNodes() {
        FuzzyBayesianNetwork net = new FuzzyBayesianNetwork(BARE);
        net.addEvidence(evidence("a", 0.8));
        net.graph().addNode(EvidenceNode.placeholder("lonely", EvidenceTypes.GENOMICS));

        assertTrue(net.predictMissingEvidence(List.of("a")).isEmpty());
        assertTrue(net.predictMissingEvidence(List.of()).isEmpty());
    }

    @Test
    public void testPredictionWithOnlyPlaceholderNeighbours() {
        FuzzyBayesianNetwork net = new FuzzyBayesianNetwork(BARE);
        net.graph().addNode(EvidenceNode.placeholder("x", EvidenceTypes.GENOMICS));
        net.graph().addNode(EvidenceNode.placeholder("y", EvidenceTypes.GENOMICS));
        net.graph().addEdge(new EvidenceEdge("x", "y", EvidenceRelationship.SUPPORTS, 0.5));

        List<EvidencePrediction> predictions = net.predictMissingEvidence(List.of());
        assertEquals(2, predictions.size());
        for (EvidencePrediction p : predictions) {
            assertEquals(0.0, p.confidence());
            assertEquals(0.0, p.predictedValue());
        }
    }

    @Test
    public void testPredictionsOrderedByConfidenceThenInsertion() {
        FuzzyBayesianNetwork net = new FuzzyBayesianNetwork(BARE);
        net.addEvidence(evidence("a", 0.8));
        net.addEvidence(evidence("b", 0.9));
        for (String id : List.of("x1", "x2", "y")) {
            net.graph().addNode(EvidenceNode.placeholder(id, EvidenceTypes.GENOMICS));
        }
        net.graph().addEdge(new EvidenceEdge("a", "x1", EvidenceRelationship.CORROBORATES, 0.8));
        net.graph().addEdge(new EvidenceEdge("a", "x2", EvidenceRelationship.CORROBORATES, 0.8));
        net.graph().addEdge(new EvidenceEdge("b", "y", EvidenceRelationship.CORROBORATES, 0.9));

        List<String> order = net.predictMissingEvidence(List.of("a", "b")).stream()
                .map(EvidencePrediction::nodeId).toList();
        assertEquals(List.of("y", "x1", "x2"), order);
    }
}
