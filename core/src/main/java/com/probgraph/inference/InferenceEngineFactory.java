package com.probgraph.inference;

import com.probgraph.config.EngineConfig;
import com.probgraph.util.RandomSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class InferenceEngineFactory {

    private static final Logger logger = LoggerFactory.getLogger(InferenceEngineFactory.class);

    public static final String DEFAULT_ALGORITHM = "variable_elimination";

    public static InferenceEngine create(EngineConfig.ConfigRoot config) {
        EngineConfig.InferenceConfig inference = (config != null && config.inference != null) ? config.inference
                : new EngineConfig.InferenceConfig();
        String algorithm = inference.algorithm;

        if (config != null && config.seed != null) {
            RandomSource.setSeed(config.seed);
        }

        // Default to variable elimination if missing
        if (algorithm == null || algorithm.trim().isEmpty()) {
            logger.warn("Inference algorithm not specified, defaulting to '{}'", DEFAULT_ALGORITHM);
            algorithm = DEFAULT_ALGORITHM;
        }

        switch (algorithm.trim().toLowerCase()) {
            case "variable_elimination":
                return new VariableElimination();
            case "belief_propagation":
                return new BeliefPropagation(
                        orDefault(inference.bpIterations, BeliefPropagation.DEFAULT_MAX_ITERATIONS),
                        inference.bpTolerance != null ? inference.bpTolerance : BeliefPropagation.DEFAULT_TOLERANCE);
            case "importance_sampling":
                return new ImportanceSampling(orDefault(inference.samples, ImportanceSampling.DEFAULT_SAMPLES));
            case "metropolis_hastings":
                return new MetropolisHastings(
                        orDefault(inference.samples, MetropolisHastings.DEFAULT_SAMPLES),
                        orDefault(inference.burnIn, MetropolisHastings.DEFAULT_BURN_IN),
                        orDefault(inference.interval, MetropolisHastings.DEFAULT_INTERVAL));
            default:
                logger.warn("Unknown inference algorithm '{}', defaulting to '{}'", algorithm, DEFAULT_ALGORITHM);
                return new VariableElimination();
        }
    }

    public static InferenceEngine create(String algorithm) {
        EngineConfig.ConfigRoot cfg = new EngineConfig.ConfigRoot();
        cfg.inference = new EngineConfig.InferenceConfig();
        cfg.inference.algorithm = algorithm;
        return create(cfg);
    }

    private static int orDefault(Integer value, int fallback) {
        return value != null ? value : fallback;
    }
}
