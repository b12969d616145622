package com.hegel.fusion.integration;

import com.fasterxml.jackson.databind.JsonNode;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Batch-level checks that do not need the network: confidence filtering, conflict detection over
 * payload attributes, and a priority-weighted aggregate confidence.
 */
public class EvidenceProcessor {

    private static final Logger LOG = Logger.getLogger(EvidenceProcessor.class);

    public static final double CONFLICT_SPREAD = 0.3;
    public static final double PRIORITY_WEIGHT = 2.0;
    public static final double CONFLICT_PENALTY = 0.5;

    private static final List<String> SUGGESTIONS = List.of(
            "Consider additional experiments",
            "Prioritize higher confidence evidence");

    private final EvidenceProcessingOptions options;
    private final Clock clock;

    public EvidenceProcessor(EvidenceProcessingOptions options) {
        this(options, Clock.systemUTC());
    }

    public EvidenceProcessor(EvidenceProcessingOptions options, Clock clock) {
        this.options = Objects.requireNonNull(options, "options");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public IntegratedEvidence process(String entityId, List<Evidence> evidence) {
        LOG.debugf("Processing %d evidence items for %s", evidence.size(), entityId);
        List<Evidence> accepted = filterByConfidence(evidence);
        List<EvidenceConflict> conflicts = detectConflicts(accepted);
        double aggregate = aggregateConfidence(accepted, conflicts);
        LOG.debugf("%d items passed the threshold, %d conflicts, aggregate confidence %.2f",
                Integer.valueOf(accepted.size()), Integer.valueOf(conflicts.size()), Double.valueOf(aggregate));
        return new IntegratedEvidence(entityId, accepted, aggregate, conflicts, clock.instant());
    }

    public List<Evidence> filterByConfidence(List<Evidence> evidence) {
        return evidence.stream()
                .filter(Objects::nonNull)
                .filter(e -> e.confidence() >= options.confidenceThreshold())
                .toList();
    }

    /**
     * Groups records by the top-level field names of their payload. A group whose confidences spread
     * by more than {@link #CONFLICT_SPREAD} is a conflict.
     */
    public List<EvidenceConflict> detectConflicts(List<Evidence> evidence) {
        Map<String, List<Evidence>> byProperty = new TreeMap<>();
        for (Evidence e : evidence) {
            JsonNode data = e.data();
            if (data == null || !data.isObject()) continue;
            Iterator<String> names = data.fieldNames();
            while (names.hasNext()) {
                byProperty.computeIfAbsent(names.next(), k -> new ArrayList<>()).add(e);
            }
        }

        List<EvidenceConflict> conflicts = new ArrayList<>();
        for (Map.Entry<String, List<Evidence>> entry : byProperty.entrySet()) {
            List<Evidence> items = entry.getValue();
            if (items.size() < 2) continue;
            double max = items.stream().mapToDouble(Evidence::confidence).max().orElse(0.0);
            double min = items.stream().mapToDouble(Evidence::confidence).min().orElse(0.0);
            if (max - min > CONFLICT_SPREAD) {
                conflicts.add(new EvidenceConflict(
                        "Conflicting evidence for property '" + entry.getKey() + "'",
                        items.stream().map(Evidence::id).toList(),
                        max - min,
                        SUGGESTIONS));
            }
        }

        if (conflicts.size() > options.maxConflicts()) {
            conflicts.sort(Comparator.comparingDouble(EvidenceConflict::severity).reversed());
            return new ArrayList<>(conflicts.subList(0, options.maxConflicts()));
        }
        return conflicts;
    }

    public double aggregateConfidence(List<Evidence> evidence, List<EvidenceConflict> conflicts) {
        if (evidence.isEmpty()) return 0.0;
        double weightedSum = 0.0;
        double totalWeight = 0.0;
        for (Evidence e : evidence) {
            double weight = options.priorityTypes().contains(e.evidenceType()) ? PRIORITY_WEIGHT : 1.0;
            weightedSum += e.confidence() * weight;
            totalWeight += weight;
        }
        double aggregate = weightedSum / totalWeight;
        if (!conflicts.isEmpty()) {
            double meanSeverity = conflicts.stream().mapToDouble(EvidenceConflict::severity).average().orElse(0.0);
            aggregate *= 1.0 - CONFLICT_PENALTY * meanSeverity;
        }
        return Math.max(0.0, Math.min(1.0, aggregate));
    }

    public EvidenceProcessingOptions getOptions() {
        return options;
    }
}
