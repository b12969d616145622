package com.hegel.fusion.core;

/**
 * Adjustment proposed by an objective evaluation. {@link #GLOBAL} targets every node that carries
 * fuzzy evidence; any other target names a single node.
 */
public record OptimizationRecommendation(String targetNode, Action action, double adjustment, String reasoning) {

    public static final String GLOBAL = "global";

    public enum Action {
        ADJUST_CONFIDENCE,
        ADD_EDGE,
        REMOVE_EDGE,
        UPDATE_WEIGHT
    }

    public boolean isGlobal() {
        return GLOBAL.equals(targetNode);
    }
}
