package com.hegel.fusion.core;

import com.hegel.fusion.core.FuzzyRule.Condition;
import org.jboss.logging.Logger;

import java.util.*;

/**
 * Hybrid fuzzy-Bayesian evidence network. {@link #updateNetwork()} runs one inference cycle as a
 * fixed pipeline: fuzzy rules, Bayesian update, influence propagation, objective optimisation.
 * <p>
 * Every phase is total over the current graph state; nothing here throws for degenerate graphs.
 * A network is meant to be owned by a single fusion call and is not thread-safe.
 * </p>
 */
public final class FuzzyBayesianNetwork {

    private static final Logger LOG = Logger.getLogger(FuzzyBayesianNetwork.class);

    private final EvidenceGraph graph;
    private final FusionModel model;
    private final Map<String, LinguisticVariable> variables;
    private final Map<String, ObjectiveResult> lastObjectiveResults = new LinkedHashMap<>();

    public FuzzyBayesianNetwork() {
        this(FusionModel.defaults());
    }

    public FuzzyBayesianNetwork(FusionModel model) {
        this(new EvidenceGraph(), model);
    }

    public FuzzyBayesianNetwork(EvidenceGraph graph, FusionModel model) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.model = Objects.requireNonNull(model, "model");
        this.variables = LinguisticVariable.builtIns();
    }

    public EvidenceNode addEvidence(FuzzyEvidence evidence) {
        return graph.addEvidence(evidence);
    }

    public void updateNetwork() {
        applyFuzzyRules();
        updateBayesianProbabilities();
        propagateInfluence();
        optimizeWithObjectiveFunctions();
    }

    /**
     * Rules are evaluated per node against that node's own memberships. Adjustments of all rules are
     * summed into the node's rule adjustment, which is rebuilt from zero on every cycle.
     */
    void applyFuzzyRules() {
        for (EvidenceNode node : graph.nodes()) {
            node.setRuleAdjustment(0.0);
        }
        for (FuzzyRule rule : model.rules()) {
            if (!FuzzyRule.POSTERIOR.equals(rule.consequent().variable())) {
                LOG.debugf("Rule %s adjusts unsupported variable '%s'; skipped", rule.id(), rule.consequent().variable());
                continue;
            }
            for (EvidenceNode node : graph.nodes()) {
                Optional<FuzzyEvidence> evidence = node.fuzzyEvidence();
                if (evidence.isEmpty()) continue;
                double activation = ruleActivation(rule, evidence.get());
                if (activation > 0.0) {
                    node.addRuleAdjustment(activation * rule.consequent().adjustment());
                }
            }
        }
    }

    double ruleActivation(FuzzyRule rule, FuzzyEvidence evidence) {
        double activation = 1.0;
        for (Condition condition : rule.antecedent()) {
            activation = Math.min(activation, conditionSatisfaction(condition, evidence));
        }
        return activation * rule.weight();
    }

    double conditionSatisfaction(Condition condition, FuzzyEvidence evidence) {
        LinguisticVariable variable = variables.get(condition.variable());
        Map<String, Double> memberships = evidence.membershipsFor(condition.variable());
        if (variable == null || memberships.isEmpty() || !variable.hasTerm(condition.term())) {
            return 0.0;
        }
        double degree = memberships.getOrDefault(condition.term(), 0.0);
        List<String> order = variable.termOrder();
        int index = order.indexOf(condition.term());
        return switch (condition.operator()) {
            case IS -> degree;
            case IS_NOT -> 1.0 - degree;
            case GREATER_THAN -> maxMembership(memberships, order.subList(index + 1, order.size()));
            case LESS_THAN -> maxMembership(memberships, order.subList(0, index));
        };
    }

    private static double maxMembership(Map<String, Double> memberships, List<String> terms) {
        double max = 0.0;
        for (String t : terms) {
            max = Math.max(max, memberships.getOrDefault(t, 0.0));
        }
        return max;
    }

    /**
     * Binary Bayes update with the defuzzified confidence as P(E|H) and 1 - confidence as P(E|not H).
     */
    void updateBayesianProbabilities() {
        for (EvidenceNode node : graph.nodes()) {
            Optional<FuzzyEvidence> evidence = node.fuzzyEvidence();
            if (evidence.isEmpty()) continue;
            double likelihood = evidence.get().defuzzifiedConfidence();
            double prior = node.getPriorProbability();
            double denominator = likelihood * prior + (1.0 - likelihood) * (1.0 - prior);
            if (denominator <= 0.0) {
                LOG.debugf("Degenerate Bayes update for node %s (likelihood=%.3f, prior=%.3f); posterior kept",
                        node.getId(), likelihood, prior);
                continue;
            }
            double posterior = likelihood * prior / denominator;
            node.setPosteriorProbability(clamp(posterior + node.getRuleAdjustment()));
        }
    }

    void propagateInfluence() {
        for (EvidenceNode node : graph.nodes()) {
            node.setNetworkInfluence(0.0);
        }
        for (EvidenceEdge edge : graph.edges()) {
            Optional<EvidenceNode> from = graph.node(edge.fromNode());
            Optional<EvidenceNode> to = graph.node(edge.toNode());
            if (from.isEmpty() || to.isEmpty()) {
                LOG.debugf("Edge %s -> %s references a missing node; skipped", edge.fromNode(), edge.toNode());
                continue;
            }
            double influence = edge.relationship().influence(from.get().getPosteriorProbability());
            to.get().addInfluence(influence * edge.strength());
        }
    }

    void optimizeWithObjectiveFunctions() {
        lastObjectiveResults.clear();
        ObjectiveEvaluator evaluator = new ObjectiveEvaluator(graph);
        for (Map.Entry<String, ObjectiveFunction> entry : model.objectives().entrySet()) {
            ObjectiveResult result = evaluator.evaluate(entry.getValue());
            lastObjectiveResults.put(entry.getKey(), result);
            LOG.debugf("Objective %s scored %.3f with %d recommendation(s)",
                    entry.getKey(), result.totalScore(), result.recommendations().size());
            for (OptimizationRecommendation r : result.recommendations()) {
                applyRecommendation(r);
            }
        }
    }

    void applyRecommendation(OptimizationRecommendation recommendation) {
        switch (recommendation.action()) {
            case ADJUST_CONFIDENCE -> {
                if (recommendation.isGlobal()) {
                    for (EvidenceNode node : graph.nodes()) {
                        if (node.hasFuzzyEvidence()) adjustPosterior(node, recommendation.adjustment());
                    }
                } else {
                    graph.node(recommendation.targetNode())
                            .ifPresent(node -> adjustPosterior(node, recommendation.adjustment()));
                }
            }
            case ADD_EDGE, REMOVE_EDGE, UPDATE_WEIGHT ->
                    LOG.debugf("Recommendation %s for %s is advisory only", recommendation.action(), recommendation.targetNode());
        }
    }

    private static void adjustPosterior(EvidenceNode node, double delta) {
        node.setPosteriorProbability(clamp(node.getPosteriorProbability() + delta));
    }

    /**
     * Predicts every node that is not in {@code knownIds} from its neighbours, weighting each
     * neighbour by its defuzzified confidence. Nodes without neighbours are skipped. The result is
     * ordered by confidence, highest first.
     */
    public List<EvidencePrediction> predictMissingEvidence(Collection<String> knownIds) {
        Set<String> known = new HashSet<>(knownIds);
        List<EvidencePrediction> predictions = new ArrayList<>();
        for (EvidenceNode node : graph.nodes()) {
            if (known.contains(node.getId())) continue;
            List<EvidenceNode> neighbours = graph.neighbours(node.getId());
            if (neighbours.isEmpty()) continue;
            predictions.add(predict(node, neighbours));
        }
        predictions.sort(Comparator.comparingDouble(EvidencePrediction::confidence).reversed());
        return predictions;
    }

    private EvidencePrediction predict(EvidenceNode target, List<EvidenceNode> neighbours) {
        double value = 0.0;
        double confidence = 0.0;
        double totalWeight = 0.0;
        for (EvidenceNode n : neighbours) {
            Optional<FuzzyEvidence> evidence = n.fuzzyEvidence();
            if (evidence.isEmpty()) continue;
            double weight = evidence.get().defuzzifiedConfidence();
            confidence += evidence.get().defuzzifiedConfidence() * weight;
            value += evidence.get().getRawValue() * weight;
            totalWeight += weight;
        }
        if (totalWeight > 0.0) {
            confidence /= totalWeight;
            value /= totalWeight;
        }
        List<String> supporting = neighbours.stream().map(EvidenceNode::getId).toList();
        return new EvidencePrediction(target.getId(), value, confidence, supporting,
                String.format(Locale.ROOT, "Predicted based on %d connected evidence nodes", neighbours.size()));
    }

    static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }

    public EvidenceGraph graph() {
        return graph;
    }

    public FusionModel model() {
        return model;
    }

    public Map<String, LinguisticVariable> linguisticVariables() {
        return variables;
    }

    /**
     * Objective evaluations of the most recent {@link #updateNetwork()} call, keyed by objective name.
     */
    public Map<String, ObjectiveResult> lastObjectiveResults() {
        return Collections.unmodifiableMap(lastObjectiveResults);
    }
}
