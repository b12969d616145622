package com.hegel.fusion.integration;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;

import java.util.HashMap;
import java.util.Map;

/**
 * Builds {@link IntegrationConfig} instances outside of a CDI container, from the default
 * MicroProfile sources plus optional overrides.
 */
public final class IntegrationConfigs {
    private IntegrationConfigs() {}

    public static final String PREFIX = "hegel.fusion.integration";
    private static final int OVERRIDE_ORDINAL = 500;

    public static IntegrationConfig defaults() {
        return from(Map.of());
    }

    /**
     * @param overrides property values keyed either by full name
     *                  ({@code hegel.fusion.integration.prediction-threshold}) or by the name
     *                  relative to the prefix ({@code prediction-threshold})
     */
    public static IntegrationConfig from(Map<String, String> overrides) {
        Map<String, String> props = new HashMap<>();
        overrides.forEach((k, v) -> props.put(k.startsWith(PREFIX + ".") ? k : PREFIX + "." + k, v));
        SmallRyeConfig config = new SmallRyeConfigBuilder()
                .addDefaultSources()
                .withSources(new PropertiesConfigSource(props, "hegel-fusion-overrides", OVERRIDE_ORDINAL))
                .withMapping(IntegrationConfig.class)
                .build();
        return config.getConfigMapping(IntegrationConfig.class);
    }
}
