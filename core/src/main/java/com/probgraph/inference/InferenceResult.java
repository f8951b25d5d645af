package com.probgraph.inference;

import com.probgraph.model.Element;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;

public class InferenceResult {
    private final String algorithm;
    private final int iterations;
    private final Map<Element<?, ?>, Distribution<?>> distributions;

    public InferenceResult(String algorithm, int iterations, Map<Element<?, ?>, Distribution<?>> distributions) {
        this.algorithm = algorithm;
        this.iterations = iterations;
        this.distributions = Collections.unmodifiableMap(new IdentityHashMap<>(distributions));
    }

    public String getAlgorithm() {
        return algorithm;
    }

    /**
     * Samples drawn, message-passing rounds run, or 1 for elimination.
     */
    public int getIterations() {
        return iterations;
    }

    @SuppressWarnings("unchecked")
    public <T> Distribution<T> distribution(Element<T, ?> target) {
        Distribution<?> d = distributions.get(target);
        if (d == null) {
            throw new IllegalArgumentException(target.getName() + " was not a query target of this run");
        }
        return (Distribution<T>) d;
    }

    public <T> double probability(Element<T, ?> target, T value) {
        return distribution(target).probability(value);
    }

    @Override
    public String toString() {
        return "InferenceResult{" +
                "algorithm='" + algorithm + '\'' +
                ", iterations=" + iterations +
                ", targets=" + distributions.size() +
                '}';
    }
}
