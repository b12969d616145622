package com.hegel.fusion.integration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

@ConfigMapping(prefix = "hegel.fusion.integration")
public interface IntegrationConfig {

    /** Minimum confidence for a record to take part in conflict detection and aggregation. */
    @WithDefault("0.5")
    double confidenceThreshold();

    /** Predictions below this confidence are dropped from the result. */
    @WithDefault("0.7")
    double predictionThreshold();

    /** Reserved for iterative prediction refinement; a single pass is run today. */
    @WithDefault("10")
    int maxPredictionIterations();

    @WithDefault("true")
    boolean enableTemporalDecay();

    /** Gates missing-evidence prediction. */
    @WithDefault("true")
    boolean enableNetworkLearning();
}
