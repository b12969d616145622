package com.hegel.fusion.core;

/**
 * Kinds of directed relationship between two evidence items.
 */
public enum EvidenceRelationship {
    SUPPORTS,
    CONTRADICTS,
    CORROBORATES,
    IMPLIES,
    REQUIRES;

    public static final double CORROBORATION_FACTOR = 0.8;
    public static final double IMPLICATION_FACTOR = 0.9;
    public static final double REQUIREMENT_THRESHOLD = 0.5;

    /**
     * Influence a source node with the given posterior exerts through an edge of this kind,
     * before scaling by the edge strength.
     */
    public double influence(double sourcePosterior) {
        return switch (this) {
            case SUPPORTS -> sourcePosterior;
            case CONTRADICTS -> 1.0 - sourcePosterior;
            case CORROBORATES -> sourcePosterior * CORROBORATION_FACTOR;
            case IMPLIES -> sourcePosterior * IMPLICATION_FACTOR;
            case REQUIRES -> sourcePosterior > REQUIREMENT_THRESHOLD ? 1.0 : 0.0;
        };
    }
}
