package com.hegel.fusion.integration;

/**
 * Per-item explanation of how the final confidence was reached.
 */
public record EnhancedConfidence(double originalConfidence,
                                 double fuzzyConfidence,
                                 double bayesianPosterior,
                                 double networkInfluence,
                                 double finalConfidence,
                                 double uncertaintyLow,
                                 double uncertaintyHigh) {
}
