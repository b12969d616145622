package com.hegel.fusion.core;

import java.util.List;
import java.util.Map;

public record ObjectiveResult(String objectiveName,
                              double totalScore,
                              Map<String, Double> componentScores,
                              List<OptimizationRecommendation> recommendations) {

    public ObjectiveResult {
        componentScores = Map.copyOf(componentScores);
        recommendations = List.copyOf(recommendations);
    }
}
