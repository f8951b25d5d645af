package com.probgraph.inference;

import com.probgraph.model.Element;
import com.probgraph.model.Universe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Likelihood weighting: forward-samples the whole model, forcing observed
 * stochastic elements to their observation, and weights each sample by the
 * product of the evidence weights.
 */
public class ImportanceSampling implements InferenceEngine {

    private static final Logger logger = LoggerFactory.getLogger(ImportanceSampling.class);

    public static final int DEFAULT_SAMPLES = 10000;

    private final int samples;

    public ImportanceSampling() {
        this(DEFAULT_SAMPLES);
    }

    public ImportanceSampling(int samples) {
        if (samples < 1) {
            throw new IllegalArgumentException("samples must be positive, got " + samples);
        }
        this.samples = samples;
    }

    @Override
    public String name() {
        return "importance_sampling";
    }

    @Override
    public InferenceResult infer(Universe universe, List<? extends Element<?, ?>> targets) {
        List<Map<Object, Double>> weights = new ArrayList<>(targets.size());
        for (int i = 0; i < targets.size(); i++) {
            weights.add(new LinkedHashMap<>());
        }
        double total = 0.0;
        int rejected = 0;
        for (int s = 0; s < samples; s++) {
            List<Element<?, ?>> visited = ForwardSampler.sample(universe, targets, true);
            double w = ForwardSampler.evidence(visited);
            if (w == 0.0) {
                rejected++;
                continue;
            }
            total += w;
            for (int i = 0; i < targets.size(); i++) {
                weights.get(i).merge(targets.get(i).value(), w, Double::sum);
            }
        }
        if (!(total > 0)) {
            throw new IllegalStateException(
                    "All " + samples + " samples had zero weight; the evidence is too unlikely to sample");
        }
        logger.info("Importance sampling drew {} samples ({} with zero weight)", samples, rejected);

        Map<Element<?, ?>, Distribution<?>> results = new IdentityHashMap<>();
        for (int i = 0; i < targets.size(); i++) {
            results.put(targets.get(i), Distribution.fromWeights(weights.get(i)));
        }
        return new InferenceResult(name(), samples, results);
    }
}
