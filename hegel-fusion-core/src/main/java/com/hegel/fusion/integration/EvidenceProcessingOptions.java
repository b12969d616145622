package com.hegel.fusion.integration;

import com.hegel.fusion.core.EvidenceTypes;

import java.util.Set;

/**
 * @param confidenceThreshold records below this confidence are left out of conflict detection and aggregation
 * @param maxConflicts        at most this many conflicts are reported, most severe first
 * @param priorityTypes       evidence types that count double in the aggregate confidence
 */
public record EvidenceProcessingOptions(double confidenceThreshold, int maxConflicts, Set<String> priorityTypes) {

    public EvidenceProcessingOptions {
        priorityTypes = priorityTypes == null ? Set.of() : Set.copyOf(priorityTypes);
    }

    public static EvidenceProcessingOptions defaults() {
        return new EvidenceProcessingOptions(0.5, 10, Set.of(EvidenceTypes.GENOMICS, EvidenceTypes.MASS_SPEC));
    }

    public EvidenceProcessingOptions withConfidenceThreshold(double threshold) {
        return new EvidenceProcessingOptions(threshold, maxConflicts, priorityTypes);
    }
}
