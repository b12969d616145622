package com.hegel.fusion.core;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * One evidence observation with its fuzzified confidence, temporal decay and uncertainty interval.
 * Instances are created through {@link #fromRawEvidence}; only the agreement memberships and the
 * contextual factors are filled in afterwards, during integration.
 */
public final class FuzzyEvidence {

    /** e-folding time of the temporal decay, in hours (~30 days). */
    public static final double DECAY_HOURS = 24.0 * 30.0;
    public static final double NEUTRAL_CONFIDENCE = 0.5;

    private static final Map<String, Double> TERM_REPRESENTATIVES = Map.of(
            LinguisticVariable.VERY_LOW, 0.1,
            LinguisticVariable.LOW, 0.3,
            LinguisticVariable.MEDIUM, 0.5,
            LinguisticVariable.HIGH, 0.8,
            LinguisticVariable.VERY_HIGH, 0.95
    );

    private static final LinguisticVariable CONFIDENCE_VARIABLE = LinguisticVariable.confidence();

    private final String id;
    private final String source;
    private final String evidenceType;
    private final double rawValue;
    private final Map<String, Double> confidenceMemberships;
    private final Map<String, Double> agreementMemberships = new LinkedHashMap<>();
    private final Map<String, Double> contextualFactors = new LinkedHashMap<>();
    private final double temporalDecay;
    private final double uncertaintyLow;
    private final double uncertaintyHigh;

    private FuzzyEvidence(String id, String source, String evidenceType, double rawValue,
                          Map<String, Double> confidenceMemberships, double temporalDecay) {
        this.id = id;
        this.source = source;
        this.evidenceType = evidenceType;
        this.rawValue = rawValue;
        this.confidenceMemberships = Collections.unmodifiableMap(confidenceMemberships);
        this.temporalDecay = temporalDecay;
        double halfWidth = EvidenceTypes.uncertaintyHalfWidth(evidenceType);
        this.uncertaintyLow = rawValue * (1.0 - halfWidth);
        this.uncertaintyHigh = rawValue * (1.0 + halfWidth);
    }

    public static FuzzyEvidence fromRawEvidence(String id, String source, String evidenceType,
                                                double rawValue, Instant timestamp) {
        return fromRawEvidence(id, source, evidenceType, rawValue, timestamp, Instant.now(), true);
    }

    /**
     * @param now            reference instant the evidence age is measured against
     * @param decayEnabled   when false the decay factor is fixed at 1.0
     */
    public static FuzzyEvidence fromRawEvidence(String id, String source, String evidenceType,
                                                double rawValue, Instant timestamp, Instant now,
                                                boolean decayEnabled) {
        double decay = 1.0;
        if (decayEnabled && timestamp != null) {
            double ageHours = Math.max(0L, Duration.between(timestamp, now).toMillis()) / 3_600_000.0;
            decay = Math.exp(-ageHours / DECAY_HOURS);
        }
        return new FuzzyEvidence(id, source, evidenceType, rawValue,
                CONFIDENCE_VARIABLE.fuzzify(rawValue), decay);
    }

    /**
     * Centroid of the confidence terms. Decay scales the numerator only, so old evidence is pulled
     * towards zero without shrinking the normalising weights.
     */
    public double defuzzifiedConfidence() {
        double numerator = 0.0;
        double denominator = 0.0;
        for (Map.Entry<String, Double> e : confidenceMemberships.entrySet()) {
            double representative = TERM_REPRESENTATIVES.getOrDefault(e.getKey(), NEUTRAL_CONFIDENCE);
            numerator += representative * e.getValue() * temporalDecay;
            denominator += e.getValue();
        }
        return denominator > 0.0 ? numerator / denominator : NEUTRAL_CONFIDENCE;
    }

    public double uncertaintyWidth() {
        return uncertaintyHigh - uncertaintyLow;
    }

    /**
     * Fuzzifies {@code agreement} against the agreement variable and stores the degrees.
     */
    public void updateAgreement(double agreement) {
        agreementMemberships.clear();
        agreementMemberships.putAll(LinguisticVariable.agreement().fuzzify(agreement));
    }

    public void putContextualFactor(String name, double value) {
        contextualFactors.put(name, value);
    }

    /**
     * Membership map for the named linguistic variable, empty for unknown variables.
     */
    public Map<String, Double> membershipsFor(String variable) {
        if (LinguisticVariable.CONFIDENCE.equals(variable)) return confidenceMemberships;
        if (LinguisticVariable.AGREEMENT.equals(variable)) return Collections.unmodifiableMap(agreementMemberships);
        return Map.of();
    }

    public String getId() { return id; }
    public String getSource() { return source; }
    public String getEvidenceType() { return evidenceType; }
    public double getRawValue() { return rawValue; }
    public Map<String, Double> getConfidenceMemberships() { return confidenceMemberships; }
    public Map<String, Double> getAgreementMemberships() { return Collections.unmodifiableMap(agreementMemberships); }
    public Map<String, Double> getContextualFactors() { return Collections.unmodifiableMap(contextualFactors); }
    public double getTemporalDecay() { return temporalDecay; }
    public double getUncertaintyLow() { return uncertaintyLow; }
    public double getUncertaintyHigh() { return uncertaintyHigh; }

    @Override
    public String toString() {
        return "FuzzyEvidence{id='" + id + "', source='" + source + "', type='" + evidenceType
                + "', raw=" + rawValue + ", decay=" + temporalDecay + "}";
    }
}
