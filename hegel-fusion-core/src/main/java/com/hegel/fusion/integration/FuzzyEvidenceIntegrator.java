package com.hegel.fusion.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.hegel.fusion.core.*;
import com.hegel.fusion.exceptions.EvidenceConversionException;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Bridges evidence records into a fuzzy-Bayesian network and reads back enhanced confidences,
 * predictions and a coherence score.
 * <p>
 * Every call builds its own network, so one integrator may serve concurrent callers. Per-record
 * problems are reported in {@link FuzzyIntegrationResult#integrationErrors()}; a call always returns
 * a result.
 * </p>
 */
public class FuzzyEvidenceIntegrator {

    private static final Logger LOG = Logger.getLogger(FuzzyEvidenceIntegrator.class);

    public static final double FUZZY_WEIGHT = 0.4;
    public static final double BAYESIAN_WEIGHT = 0.4;
    public static final double NETWORK_WEIGHT = 0.2;

    public static final double COHERENCE_CONFIDENCE_WEIGHT = 0.6;
    public static final double COHERENCE_CONSISTENCY_WEIGHT = 0.4;

    private final EvidenceProcessor processor;
    private final IntegrationConfig config;
    private final FusionModel model;
    private final EvidenceRelationshipResolver resolver = new EvidenceRelationshipResolver();
    private final Clock clock;

    public FuzzyEvidenceIntegrator(IntegrationConfig config) {
        this(config, FusionModel.defaults());
    }

    public FuzzyEvidenceIntegrator(IntegrationConfig config, FusionModel model) {
        this(new EvidenceProcessor(EvidenceProcessingOptions.defaults()
                        .withConfidenceThreshold(config.confidenceThreshold())),
                config, model, Clock.systemUTC());
    }

    public FuzzyEvidenceIntegrator(EvidenceProcessor processor, IntegrationConfig config,
                                   FusionModel model, Clock clock) {
        this.processor = Objects.requireNonNull(processor, "processor");
        this.config = Objects.requireNonNull(config, "config");
        this.model = Objects.requireNonNull(model, "model");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public FuzzyIntegrationResult integrateEvidence(List<Evidence> evidence) {
        return integrateEvidence(evidence, List.of());
    }

    /**
     * @param expected evidence that was anticipated but not collected; each becomes a bare node the
     *                 network can predict
     */
    public FuzzyIntegrationResult integrateEvidence(List<Evidence> evidence, List<ExpectedEvidence> expected) {
        List<Evidence> batch = evidence == null ? List.of() : evidence;
        List<ExpectedEvidence> placeholders = expected == null ? List.of() : expected;
        LOG.infof("Integrating %d evidence items into fuzzy network", batch.size());

        Instant now = clock.instant();
        FuzzyBayesianNetwork network = new FuzzyBayesianNetwork(model);
        List<String> errors = new ArrayList<>();
        Map<String, Evidence> accepted = new LinkedHashMap<>();

        for (Evidence e : batch) {
            try {
                FuzzyEvidence fuzzy = convertToFuzzyEvidence(e, now);
                if (accepted.containsKey(fuzzy.getId())) {
                    LOG.warnf("Duplicate evidence id %s; the later record replaces the earlier one", fuzzy.getId());
                    accepted.remove(fuzzy.getId());
                }
                network.addEvidence(fuzzy);
                accepted.put(fuzzy.getId(), e);
            } catch (EvidenceConversionException ex) {
                LOG.warnf("Failed to convert evidence %s: %s", ex.getEvidenceId(), ex.getMessage());
                errors.add("Evidence " + ex.getEvidenceId() + ": " + ex.getMessage());
            }
        }

        List<Evidence> items = new ArrayList<>(accepted.values());
        Collection<ExpectedEvidence> unobserved = addPlaceholders(network.graph(), placeholders, accepted.keySet());
        buildEvidenceRelationships(network.graph(), items);
        linkPlaceholders(network.graph(), unobserved, items);
        assignAgreement(network.graph(), items);

        network.updateNetwork();

        List<EvidencePrediction> predictions = List.of();
        if (config.enableNetworkLearning()) {
            predictions = generateEvidencePredictions(network, accepted.keySet());
        }

        Map<String, EnhancedConfidence> enhanced = calculateEnhancedConfidences(network.graph(), items);
        double coherence = calculateNetworkCoherence(network.graph());

        List<Evidence> qualified = processor.filterByConfidence(items);
        List<EvidenceConflict> conflicts = processor.detectConflicts(qualified);
        double aggregate = processor.aggregateConfidence(qualified, conflicts);

        return new FuzzyIntegrationResult(
                batch.size(),
                network.graph().nodeCount(),
                predictions,
                enhanced,
                errors,
                coherence,
                statistics(network.graph(), coherence),
                conflicts,
                aggregate);
    }

    /**
     * Validates the record and fuzzifies its confidence. The record timestamp is used when present,
     * otherwise the evidence counts as observed at {@code now}.
     */
    public FuzzyEvidence convertToFuzzyEvidence(Evidence evidence, Instant now) {
        if (evidence == null) {
            throw new EvidenceConversionException("<null>", "evidence record is null");
        }
        String id = evidence.id();
        if (id == null || id.isBlank()) {
            throw new EvidenceConversionException(String.valueOf(id), "evidence id is missing");
        }
        if (evidence.source() == null || evidence.source().isBlank()) {
            throw new EvidenceConversionException(id, "evidence source is missing");
        }
        double confidence = evidence.confidence();
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new EvidenceConversionException(id, "confidence " + confidence + " is outside [0,1]");
        }
        String type = evidence.evidenceType() == null || evidence.evidenceType().isBlank()
                ? EvidenceTypes.OTHER : evidence.evidenceType();
        Instant timestamp = evidence.timestamp() != null ? evidence.timestamp() : now;

        FuzzyEvidence fuzzy = FuzzyEvidence.fromRawEvidence(id, evidence.source(), type, confidence,
                timestamp, now, config.enableTemporalDecay());
        JsonNode data = evidence.data();
        if (data != null && data.isObject()) {
            data.fields().forEachRemaining(f -> {
                if (f.getValue().isNumber()) fuzzy.putContextualFactor(f.getKey(), f.getValue().asDouble());
            });
        }
        return fuzzy;
    }

    void buildEvidenceRelationships(EvidenceGraph graph, List<Evidence> items) {
        LOG.debugf("Building evidence relationships for %d evidence items", items.size());
        for (int i = 0; i < items.size(); i++) {
            for (int j = i + 1; j < items.size(); j++) {
                Evidence a = items.get(i);
                Evidence b = items.get(j);
                EvidenceRelationshipResolver.Inferred inferred = resolver.determine(a, b);
                if (inferred.meaningful()) {
                    graph.addEdge(resolver.edge(a, b, inferred));
                }
            }
        }
        LOG.debugf("Built %d evidence relationships", graph.edgeCount());
    }

    /**
     * Adds one bare node per distinct expected id that was not accepted from the batch. A repeated id
     * keeps its last entry.
     *
     * @return the expected items that became placeholder nodes, one per id
     */
    private Collection<ExpectedEvidence> addPlaceholders(EvidenceGraph graph, List<ExpectedEvidence> expected,
                                                         Set<String> observedIds) {
        Map<String, ExpectedEvidence> unobserved = new LinkedHashMap<>();
        for (ExpectedEvidence x : expected) {
            if (x == null || x.id() == null || x.id().isBlank()) continue;
            if (observedIds.contains(x.id())) {
                LOG.debugf("Expected evidence %s was observed; no placeholder added", x.id());
                continue;
            }
            unobserved.put(x.id(), x);
        }
        for (ExpectedEvidence x : unobserved.values()) {
            graph.addNode(EvidenceNode.placeholder(x.id(), x.evidenceType()));
        }
        return unobserved.values();
    }

    /**
     * Each observed item of the same evidence type corroborates an expected item, with the item's
     * confidence as strength.
     */
    private void linkPlaceholders(EvidenceGraph graph, Collection<ExpectedEvidence> placeholders, List<Evidence> items) {
        for (ExpectedEvidence x : placeholders) {
            for (Evidence e : items) {
                if (Objects.equals(e.evidenceType(), x.evidenceType())
                        && e.confidence() > EvidenceRelationshipResolver.NOISE_FLOOR) {
                    graph.addEdge(new EvidenceEdge(e.id(), x.id(), EvidenceRelationship.CORROBORATES, e.confidence()));
                }
            }
        }
    }

    /**
     * Agreement of an item is its mean confidence similarity to every other item of the batch.
     */
    private void assignAgreement(EvidenceGraph graph, List<Evidence> items) {
        if (items.size() < 2) return;
        for (Evidence a : items) {
            double sum = 0.0;
            for (Evidence b : items) {
                if (a != b) sum += 1.0 - Math.abs(a.confidence() - b.confidence());
            }
            double agreement = sum / (items.size() - 1);
            graph.node(a.id()).flatMap(EvidenceNode::fuzzyEvidence).ifPresent(f -> f.updateAgreement(agreement));
        }
    }

    /**
     * Only accepted records count as known; an expected id whose record failed conversion is predicted
     * like any other missing item.
     */
    private List<EvidencePrediction> generateEvidencePredictions(FuzzyBayesianNetwork network, Set<String> known) {
        List<EvidencePrediction> predictions = network.predictMissingEvidence(known).stream()
                .filter(p -> p.confidence() >= config.predictionThreshold())
                .toList();
        LOG.infof("Generated %d high-confidence evidence predictions", predictions.size());
        return predictions;
    }

    private Map<String, EnhancedConfidence> calculateEnhancedConfidences(EvidenceGraph graph, List<Evidence> items) {
        Map<String, EnhancedConfidence> out = new LinkedHashMap<>();
        for (Evidence e : items) {
            graph.node(e.id()).ifPresent(node -> {
                Optional<FuzzyEvidence> fuzzy = node.fuzzyEvidence();
                double fuzzyConfidence = fuzzy.map(FuzzyEvidence::defuzzifiedConfidence).orElse(e.confidence());
                out.put(e.id(), new EnhancedConfidence(
                        e.confidence(),
                        fuzzyConfidence,
                        node.getPosteriorProbability(),
                        node.getNetworkInfluence(),
                        finalConfidence(node),
                        fuzzy.map(FuzzyEvidence::getUncertaintyLow).orElse(e.confidence() * 0.9),
                        fuzzy.map(FuzzyEvidence::getUncertaintyHigh).orElse(e.confidence() * 1.1)));
            });
        }
        return out;
    }

    static double finalConfidence(EvidenceNode node) {
        double fuzzy = node.fuzzyEvidence()
                .map(FuzzyEvidence::defuzzifiedConfidence)
                .orElse(FuzzyEvidence.NEUTRAL_CONFIDENCE);
        double value = fuzzy * FUZZY_WEIGHT
                + node.getPosteriorProbability() * BAYESIAN_WEIGHT
                + Math.abs(node.getNetworkInfluence()) * NETWORK_WEIGHT;
        return clamp(value);
    }

    /**
     * Blend of mean defuzzified confidence and strength-weighted edge consistency; 0.0 for a graph
     * without observed evidence, placeholders alone included.
     */
    public static double calculateNetworkCoherence(EvidenceGraph graph) {
        List<FuzzyEvidence> observed = graph.fuzzyEvidence();
        if (observed.isEmpty()) return 0.0;

        double avgConfidence = observed.stream()
                .mapToDouble(FuzzyEvidence::defuzzifiedConfidence)
                .average()
                .orElse(FuzzyEvidence.NEUTRAL_CONFIDENCE);

        double sum = 0.0;
        int count = 0;
        for (EvidenceEdge edge : graph.resolvedEdges()) {
            double from = graph.node(edge.fromNode()).map(EvidenceNode::getPosteriorProbability).orElseThrow();
            double to = graph.node(edge.toNode()).map(EvidenceNode::getPosteriorProbability).orElseThrow();
            double consistency = switch (edge.relationship()) {
                case SUPPORTS, CORROBORATES -> 1.0 - Math.abs(from - to);
                case CONTRADICTS -> Math.abs(from - to);
                case IMPLIES, REQUIRES -> 0.5;
            };
            sum += consistency * edge.strength();
            count++;
        }
        double avgConsistency = count > 0 ? sum / count : 0.5;

        return clamp(avgConfidence * COHERENCE_CONFIDENCE_WEIGHT + avgConsistency * COHERENCE_CONSISTENCY_WEIGHT);
    }

    static NetworkStatistics statistics(EvidenceGraph graph, double coherence) {
        if (graph.isEmpty()) return NetworkStatistics.empty();
        double avgConfidence = graph.fuzzyEvidence().stream()
                .mapToDouble(FuzzyEvidence::defuzzifiedConfidence)
                .average()
                .orElse(0.0);
        return new NetworkStatistics(graph.nodeCount(), graph.edgeCount(), avgConfidence,
                graph.countEdges(EvidenceRelationship.CONTRADICTS), coherence);
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }

    public IntegrationConfig getConfig() {
        return config;
    }

    public FusionModel getModel() {
        return model;
    }
}
