package com.probgraph.model;

/**
 * A candidate randomness produced by a proposal kernel, with the two ratios
 * the sampler needs for its acceptance test.
 *
 * <p>
 * {@code transitionRatio} is P(r1 -> r0) / P(r0 -> r1) and {@code modelRatio}
 * is P(r1) / P(r0). They are kept apart because annealed samplers weight them
 * differently.
 */
public class Proposal<R> {

    private final R randomness;
    private final double transitionRatio;
    private final double modelRatio;

    public Proposal(R randomness, double transitionRatio, double modelRatio) {
        if (transitionRatio < 0 || modelRatio < 0 || Double.isNaN(transitionRatio) || Double.isNaN(modelRatio)) {
            throw new IllegalArgumentException(
                    "Proposal ratios must be non-negative, got " + transitionRatio + " and " + modelRatio);
        }
        this.randomness = randomness;
        this.transitionRatio = transitionRatio;
        this.modelRatio = modelRatio;
    }

    public static <R> Proposal<R> symmetric(R randomness) {
        return new Proposal<>(randomness, 1.0, 1.0);
    }

    public R getRandomness() {
        return randomness;
    }

    public double getTransitionRatio() {
        return transitionRatio;
    }

    public double getModelRatio() {
        return modelRatio;
    }

    @Override
    public String toString() {
        return "Proposal{" +
                "randomness=" + randomness +
                ", transitionRatio=" + String.format("%.4f", transitionRatio) +
                ", modelRatio=" + String.format("%.4f", modelRatio) +
                '}';
    }
}
