package com.hegel.fusion.integration;

public record NetworkStatistics(int nodeCount,
                                int edgeCount,
                                double avgConfidence,
                                long conflictCount,
                                double coherenceScore) {

    public static NetworkStatistics empty() {
        return new NetworkStatistics(0, 0, 0.0, 0, 0.0);
    }
}
