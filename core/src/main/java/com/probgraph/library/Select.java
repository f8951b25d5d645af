package com.probgraph.library;

import com.probgraph.model.FiniteAtomic;
import com.probgraph.model.Universe;
import com.probgraph.util.RandomSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Categorical element over explicit outcomes. Weights are normalized; repeated
 * outcomes have their weights merged. The randomness is a uniform draw in
 * [0, 1) mapped through the cumulative distribution.
 */
public class Select<T> extends FiniteAtomic<T, Double> {

    private final List<T> outcomes;
    private final double[] probabilities;

    public Select(String name, Universe universe, List<Double> weights, List<T> outcomes) {
        this(name, universe, normalize(weights, outcomes));
    }

    public Select(String name, Universe universe, Map<T, Double> weightedOutcomes) {
        this(name, universe, new ArrayList<>(weightedOutcomes.values()), new ArrayList<>(weightedOutcomes.keySet()));
    }

    private Select(String name, Universe universe, Normalized<T> normalized) {
        super(name, universe);
        this.outcomes = normalized.outcomes;
        this.probabilities = normalized.probabilities;
    }

    // Runs before registration so a rejected select never enters the universe.
    private static <T> Normalized<T> normalize(List<Double> weights, List<T> outcomes) {
        if (weights.size() != outcomes.size() || outcomes.isEmpty()) {
            throw new IllegalArgumentException("Select needs one weight per outcome and at least one outcome");
        }
        Map<T, Double> merged = new LinkedHashMap<>();
        double total = 0.0;
        for (int i = 0; i < outcomes.size(); i++) {
            double w = weights.get(i);
            if (w < 0 || Double.isNaN(w)) {
                throw new IllegalArgumentException("Select weights must be non-negative, got " + w);
            }
            merged.merge(outcomes.get(i), w, Double::sum);
            total += w;
        }
        if (total <= 0) {
            throw new IllegalArgumentException("Select weights must not all be zero");
        }
        double[] probabilities = new double[merged.size()];
        int i = 0;
        for (double w : merged.values()) {
            probabilities[i++] = w / total;
        }
        return new Normalized<>(Collections.unmodifiableList(new ArrayList<>(merged.keySet())), probabilities);
    }

    @Override
    public Double generateRandomness() {
        return RandomSource.nextDouble();
    }

    @Override
    public T generateValue(Double randomness) {
        double cumulative = 0.0;
        for (int i = 0; i < probabilities.length; i++) {
            cumulative += probabilities[i];
            if (randomness < cumulative) {
                return outcomes.get(i);
            }
        }
        // rounding left the last bucket short of 1.0
        return outcomes.get(outcomes.size() - 1);
    }

    @Override
    public double density(T value) {
        int idx = outcomes.indexOf(value);
        return idx >= 0 ? probabilities[idx] : 0.0;
    }

    @Override
    public List<T> support() {
        return outcomes;
    }

    private static final class Normalized<T> {
        private final List<T> outcomes;
        private final double[] probabilities;

        private Normalized(List<T> outcomes, double[] probabilities) {
            this.outcomes = outcomes;
            this.probabilities = probabilities;
        }
    }
}
