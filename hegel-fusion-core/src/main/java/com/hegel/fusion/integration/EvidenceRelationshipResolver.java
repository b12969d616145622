package com.hegel.fusion.integration;

import com.hegel.fusion.core.EvidenceEdge;
import com.hegel.fusion.core.EvidenceRelationship;
import com.hegel.fusion.core.EvidenceTypes;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Infers the relationship between two evidence records from their sources, confidences and types.
 */
public final class EvidenceRelationshipResolver {

    /** Edges at or below this strength are noise and not added to the network. */
    public static final double NOISE_FLOOR = 0.1;

    static final double CORROBORATION_DIFF = 0.2;
    static final double CORROBORATION_BASE = 0.8;
    static final double SUPPORT_SIMILARITY = 0.7;
    static final double CONTRADICTION_SIMILARITY = 0.3;

    private static final double GENOMICS_IMPLIES_PROTEOMICS = 0.6;
    private static final double PROTEOMICS_IMPLIES_METABOLOMICS = 0.5;
    private static final double LITERATURE_SUPPORT = 0.4;

    public record Inferred(EvidenceRelationship relationship, double strength) {
        public boolean meaningful() {
            return strength > NOISE_FLOOR;
        }
    }

    public Inferred determine(Evidence a, Evidence b) {
        double diff = Math.abs(a.confidence() - b.confidence());
        if (a.source() != null && a.source().equals(b.source())) {
            if (diff < CORROBORATION_DIFF) {
                return new Inferred(EvidenceRelationship.CORROBORATES, CORROBORATION_BASE - diff);
            }
            return new Inferred(EvidenceRelationship.CONTRADICTS, diff);
        }

        double similarity = 1.0 - diff;
        if (similarity > SUPPORT_SIMILARITY) {
            return new Inferred(EvidenceRelationship.SUPPORTS, similarity);
        }
        if (similarity < CONTRADICTION_SIMILARITY) {
            return new Inferred(EvidenceRelationship.CONTRADICTS, 1.0 - similarity);
        }
        if (EvidenceTypes.GENOMICS.equals(a.evidenceType()) && EvidenceTypes.PROTEOMICS.equals(b.evidenceType())) {
            return new Inferred(EvidenceRelationship.IMPLIES, GENOMICS_IMPLIES_PROTEOMICS);
        }
        if (EvidenceTypes.PROTEOMICS.equals(a.evidenceType()) && EvidenceTypes.METABOLOMICS.equals(b.evidenceType())) {
            return new Inferred(EvidenceRelationship.IMPLIES, PROTEOMICS_IMPLIES_METABOLOMICS);
        }
        if (EvidenceTypes.LITERATURE.equals(a.evidenceType())) {
            return new Inferred(EvidenceRelationship.SUPPORTS, LITERATURE_SUPPORT);
        }
        return new Inferred(EvidenceRelationship.SUPPORTS, similarity);
    }

    /**
     * Qualitative strength: weak grows with disagreement, strong only when both are close and high.
     */
    public Map<String, Double> fuzzyStrength(Evidence a, Evidence b) {
        double diff = Math.abs(a.confidence() - b.confidence());
        double avg = (a.confidence() + b.confidence()) / 2.0;
        Map<String, Double> out = new LinkedHashMap<>();
        out.put(EvidenceEdge.WEAK, diff > 0.5 ? 1.0 : diff * 2.0);
        out.put(EvidenceEdge.MODERATE, diff < 0.3 && avg > 0.4 ? 1.0 : 0.5);
        out.put(EvidenceEdge.STRONG, diff < 0.1 && avg > 0.7 ? 1.0 : 0.0);
        return out;
    }

    public EvidenceEdge edge(Evidence a, Evidence b, Inferred inferred) {
        return new EvidenceEdge(a.id(), b.id(), inferred.relationship(), inferred.strength(), fuzzyStrength(a, b));
    }
}
