package com.hegel.fusion.core;

import com.hegel.fusion.core.ObjectiveFunction.Component;
import com.hegel.fusion.core.ObjectiveFunction.Kind;

import java.util.*;

/**
 * Scores an {@link EvidenceGraph} against objective functions and turns weak components into
 * recommendations.
 */
public final class ObjectiveEvaluator {

    /** Components scoring below this value produce a recommendation. */
    public static final double RECOMMENDATION_THRESHOLD = 0.5;
    public static final double CONFIDENCE_STEP = 0.1;
    public static final double NEUTRAL_SCORE = 0.5;

    private final EvidenceGraph graph;

    public ObjectiveEvaluator(EvidenceGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    public ObjectiveResult evaluate(ObjectiveFunction objective) {
        Map<String, Double> scores = new LinkedHashMap<>();
        List<OptimizationRecommendation> recommendations = new ArrayList<>();
        double total = 0.0;
        for (Component c : objective.components()) {
            double score = score(c.kind());
            scores.put(c.name(), score);
            total += score * objective.weightOf(c.name());
            if (score < RECOMMENDATION_THRESHOLD) {
                recommendations.add(new OptimizationRecommendation(
                        OptimizationRecommendation.GLOBAL,
                        OptimizationRecommendation.Action.ADJUST_CONFIDENCE,
                        CONFIDENCE_STEP,
                        String.format(Locale.ROOT, "Improve %s score from %.2f", c.name(), score)));
            }
        }
        return new ObjectiveResult(objective.name(), total, scores, recommendations);
    }

    public double score(Kind kind) {
        return switch (kind) {
            case MAXIMIZE_CONFIDENCE -> confidence();
            case MINIMIZE_UNCERTAINTY -> 1.0 - meanUncertainty();
            case MAXIMIZE_CONSISTENCY -> consistency();
            case MINIMIZE_CONFLICTS -> 1.0 - (double) graph.countEdges(EvidenceRelationship.CONTRADICTS)
                    / Math.max(graph.edgeCount(), 1);
            case MAXIMIZE_NETWORK_COHERENCE -> (connectivity() + consistency()) / 2.0;
        };
    }

    double confidence() {
        List<FuzzyEvidence> evidence = graph.fuzzyEvidence();
        if (evidence.isEmpty()) return NEUTRAL_SCORE;
        return evidence.stream().mapToDouble(FuzzyEvidence::defuzzifiedConfidence).average().orElse(NEUTRAL_SCORE);
    }

    double meanUncertainty() {
        return graph.fuzzyEvidence().stream().mapToDouble(FuzzyEvidence::uncertaintyWidth).average().orElse(0.0);
    }

    double consistency() {
        List<EvidenceEdge> edges = graph.resolvedEdges();
        if (edges.isEmpty()) return NEUTRAL_SCORE;
        double sum = 0.0;
        for (EvidenceEdge e : edges) {
            double from = graph.node(e.fromNode()).map(EvidenceNode::getPosteriorProbability).orElse(NEUTRAL_SCORE);
            double to = graph.node(e.toNode()).map(EvidenceNode::getPosteriorProbability).orElse(NEUTRAL_SCORE);
            sum += switch (e.relationship()) {
                case SUPPORTS -> 1.0 - Math.abs(from - to);
                case CONTRADICTS -> Math.abs(from - to);
                case CORROBORATES, IMPLIES, REQUIRES -> NEUTRAL_SCORE;
            };
        }
        return sum / edges.size();
    }

    double connectivity() {
        double n = Math.max(graph.nodeCount(), 1);
        return graph.edgeCount() / (n * n);
    }
}
