package com.hegel.fusion.runtime;

import com.hegel.fusion.core.FusionModel;
import com.hegel.fusion.core.YamlFusionModelLoader;
import com.hegel.fusion.integration.FuzzyEvidenceIntegrator;
import com.hegel.fusion.integration.IntegrationConfig;
import com.hegel.fusion.integration.IntegrationConfigs;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;

/**
 * Loads the fusion model from the classpath and exposes the model, the integration settings and a
 * ready integrator for injection. The integration settings come from the container's
 * {@link IntegrationConfig} mapping when it provides one, otherwise from {@link IntegrationConfigs#defaults()}.
 * Hosts without a CDI container can construct it directly and call {@link #init()}.
 */
@ApplicationScoped
public class FusionEngineProducer {

    private static final Logger LOG = Logger.getLogger(FusionEngineProducer.class);

    private final String modelLocation;
    private final YamlFusionModelLoader loader;

    private FusionModel model;
    private IntegrationConfig config;
    private FuzzyEvidenceIntegrator integrator;

    @Inject
    public FusionEngineProducer(@ConfigProperty(name = "hegel.fusion.model", defaultValue = "fusion/default-model.yaml")
                                String modelLocation,
                                Instance<IntegrationConfig> mappedConfig) {
        this(modelLocation, new YamlFusionModelLoader(), mappedConfig.isResolvable() ? mappedConfig.get() : null);
    }

    public FusionEngineProducer(String modelLocation) {
        this(modelLocation, new YamlFusionModelLoader(), null);
    }

    /**
     * @param config integration settings, or {@code null} to build the defaults on {@link #init()}
     */
    FusionEngineProducer(String modelLocation, YamlFusionModelLoader loader, IntegrationConfig config) {
        this.modelLocation = modelLocation;
        this.loader = loader;
        this.config = config;
    }

    @PostConstruct
    public void init() {
        this.model = loadModel();
        if (config == null) {
            config = IntegrationConfigs.defaults();
        }
        this.integrator = new FuzzyEvidenceIntegrator(config, model);
        LOG.infof("Fusion model loaded from %s: %d rule(s), %d objective(s)",
                modelLocation, model.rules().size(), model.objectives().size());
    }

    @Produces
    public FusionModel fusionModel() {
        return model;
    }

    public IntegrationConfig integrationConfig() {
        return config;
    }

    @Produces
    public FuzzyEvidenceIntegrator integrator() {
        return integrator;
    }

    private FusionModel loadModel() {
        String path = modelLocation.startsWith("/") ? modelLocation : "/" + modelLocation;
        try {
            return loader.loadFromClasspath(path);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load fusion model from " + modelLocation, e);
        }
    }
}
