package com.hegel.fusion.core;

import java.util.Map;

/**
 * Directed, weighted relationship between two evidence nodes.
 *
 * @param fuzzyStrength degrees for the qualitative terms {@code weak}, {@code moderate}, {@code strong}
 */
public record EvidenceEdge(String fromNode,
                           String toNode,
                           EvidenceRelationship relationship,
                           double strength,
                           Map<String, Double> fuzzyStrength) {

    public static final String WEAK = "weak";
    public static final String MODERATE = "moderate";
    public static final String STRONG = "strong";

    public EvidenceEdge {
        fuzzyStrength = fuzzyStrength == null ? Map.of() : Map.copyOf(fuzzyStrength);
    }

    public EvidenceEdge(String fromNode, String toNode, EvidenceRelationship relationship, double strength) {
        this(fromNode, toNode, relationship, strength, Map.of());
    }

    public boolean touches(String nodeId) {
        return fromNode.equals(nodeId) || toNode.equals(nodeId);
    }

    public String otherEnd(String nodeId) {
        return fromNode.equals(nodeId) ? toNode : fromNode;
    }
}
