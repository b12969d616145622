package com.hegel.fusion.core;

import java.util.List;

/**
 * Estimated value and confidence for an evidence node that was not part of the observed batch.
 */
public record EvidencePrediction(String nodeId,
                                 double predictedValue,
                                 double confidence,
                                 List<String> supportingEvidence,
                                 String reasoning) {

    public EvidencePrediction {
        supportingEvidence = supportingEvidence == null ? List.of() : List.copyOf(supportingEvidence);
    }
}
