package com.probgraph.inference;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.ToDoubleFunction;

/**
 * Normalized posterior over the outcomes of one element, as a sequence of
 * (probability, outcome) pairs.
 */
public class Distribution<T> {

    private final List<Outcome<T>> outcomes;

    private Distribution(List<Outcome<T>> outcomes) {
        this.outcomes = Collections.unmodifiableList(outcomes);
    }

    /**
     * Normalizes non-negative weights. Zero-weight outcomes are kept so that
     * callers see the full support.
     *
     * @throws IllegalStateException if the weights sum to zero
     */
    public static <T> Distribution<T> fromWeights(Map<T, Double> weights) {
        double total = 0.0;
        for (double w : weights.values()) {
            total += w;
        }
        if (!(total > 0)) {
            throw new IllegalStateException("Cannot normalize: total weight is " + total
                    + " (evidence has zero probability)");
        }
        List<Outcome<T>> outcomes = new ArrayList<>(weights.size());
        for (Map.Entry<T, Double> e : weights.entrySet()) {
            outcomes.add(new Outcome<>(e.getValue() / total, e.getKey()));
        }
        return new Distribution<>(outcomes);
    }

    public List<Outcome<T>> getOutcomes() {
        return outcomes;
    }

    public double probability(T value) {
        double p = 0.0;
        for (Outcome<T> o : outcomes) {
            if (Objects.equals(o.value, value)) {
                p += o.probability;
            }
        }
        return p;
    }

    public T mostLikely() {
        Outcome<T> best = null;
        for (Outcome<T> o : outcomes) {
            if (best == null || o.probability > best.probability) {
                best = o;
            }
        }
        return best != null ? best.value : null;
    }

    public double expectation(ToDoubleFunction<? super T> f) {
        double e = 0.0;
        for (Outcome<T> o : outcomes) {
            e += o.probability * f.applyAsDouble(o.value);
        }
        return e;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Distribution{");
        for (Outcome<T> o : outcomes) {
            sb.append(String.format("%.4f", o.probability)).append("->").append(o.value).append(' ');
        }
        return sb.toString().trim() + "}";
    }

    public static final class Outcome<T> {
        private final double probability;
        private final T value;

        public Outcome(double probability, T value) {
            this.probability = probability;
            this.value = value;
        }

        public double getProbability() {
            return probability;
        }

        public T getValue() {
            return value;
        }
    }
}
