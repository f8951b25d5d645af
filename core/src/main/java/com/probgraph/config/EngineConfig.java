package com.probgraph.config;

/**
 * JSON-mapped settings for inference and learning runs. Every field is
 * nullable; consumers apply their own defaults.
 */
public class EngineConfig {

    private EngineConfig() {
    }

    public static class InferenceConfig {
        public String algorithm;
        public Integer samples;
        public Integer burnIn;
        public Integer interval;
        public Integer bpIterations;
        public Double bpTolerance;
    }

    public static class LearningConfig {
        public Integer iterations;
    }

    public static class ConfigRoot {
        public InferenceConfig inference;
        public LearningConfig learning;
        public Long seed;
    }
}
