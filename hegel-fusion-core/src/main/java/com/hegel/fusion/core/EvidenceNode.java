package com.hegel.fusion.core;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.Optional;

/**
 * Graph node for one evidence item. A node may exist without fuzzy evidence, e.g. an expected
 * item that was never collected and is only present to receive a prediction.
 */
@Getter
@ToString
public class EvidenceNode {

    public static final double NEUTRAL_PRIOR = 0.5;

    private final String id;
    private final String evidenceType;

    @ToString.Exclude
    @Getter(AccessLevel.NONE)
    private final FuzzyEvidence fuzzyEvidence;

    @Setter
    private double priorProbability = NEUTRAL_PRIOR;
    @Setter
    private double posteriorProbability = NEUTRAL_PRIOR;
    @Setter
    private double networkInfluence;
    @Setter
    private double ruleAdjustment;

    public EvidenceNode(String id, String evidenceType, FuzzyEvidence fuzzyEvidence) {
        this.id = id;
        this.evidenceType = evidenceType;
        this.fuzzyEvidence = fuzzyEvidence;
    }

    public static EvidenceNode of(FuzzyEvidence evidence) {
        return new EvidenceNode(evidence.getId(), evidence.getEvidenceType(), evidence);
    }

    public static EvidenceNode placeholder(String id, String evidenceType) {
        return new EvidenceNode(id, evidenceType, null);
    }

    public Optional<FuzzyEvidence> fuzzyEvidence() {
        return Optional.ofNullable(fuzzyEvidence);
    }

    public boolean hasFuzzyEvidence() {
        return fuzzyEvidence != null;
    }

    void addInfluence(double delta) {
        networkInfluence += delta;
    }

    void addRuleAdjustment(double delta) {
        ruleAdjustment += delta;
    }
}
