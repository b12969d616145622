package com.hegel.fusion.integration;

import com.hegel.fusion.core.EvidencePrediction;

import java.util.*;

/**
 * Outcome of one fusion call. {@code enhancedConfidences} keeps the order of the input batch.
 */
public record FuzzyIntegrationResult(int originalEvidenceCount,
                                     int integratedEvidenceCount,
                                     List<EvidencePrediction> predictions,
                                     Map<String, EnhancedConfidence> enhancedConfidences,
                                     List<String> integrationErrors,
                                     double networkCoherenceScore,
                                     NetworkStatistics statistics,
                                     List<EvidenceConflict> conflicts,
                                     double aggregateConfidence) {

    public FuzzyIntegrationResult {
        predictions = List.copyOf(predictions);
        enhancedConfidences = Collections.unmodifiableMap(new LinkedHashMap<>(enhancedConfidences));
        integrationErrors = List.copyOf(integrationErrors);
        conflicts = List.copyOf(conflicts);
    }

    public Optional<EnhancedConfidence> confidenceOf(String evidenceId) {
        return Optional.ofNullable(enhancedConfidences.get(evidenceId));
    }

    public boolean hasErrors() {
        return !integrationErrors.isEmpty();
    }
}
