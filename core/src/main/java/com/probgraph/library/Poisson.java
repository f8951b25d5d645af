package com.probgraph.library;

import com.probgraph.model.Atomic;
import com.probgraph.model.Proposal;
import com.probgraph.model.Universe;
import com.probgraph.util.RandomSource;
import org.apache.commons.math3.distribution.PoissonDistribution;

/**
 * Poisson-distributed count. The support is infinite, so it has no
 * enumeration or factor capability.
 *
 * <p>
 * Proposes by a random walk: from n > 0 step to n - 1 or n + 1 with equal
 * probability, from 0 always step to 1. The walk is asymmetric at 0, which the
 * transition ratio accounts for.
 */
public class Poisson extends Atomic<Integer, Integer> {

    private final double lambda;
    private final PoissonDistribution distribution;

    public Poisson(String name, Universe universe, double lambda) {
        super(name, checkRate(universe, lambda));
        this.lambda = lambda;
        this.distribution = new PoissonDistribution(RandomSource.generator(), lambda,
                PoissonDistribution.DEFAULT_EPSILON, PoissonDistribution.DEFAULT_MAX_ITERATIONS);
    }

    private static Universe checkRate(Universe universe, double lambda) {
        if (!(lambda > 0)) {
            throw new IllegalArgumentException("Poisson rate must be positive, got " + lambda);
        }
        return universe;
    }

    public double getLambda() {
        return lambda;
    }

    @Override
    public Integer generateRandomness() {
        synchronized (RandomSource.class) {
            return distribution.sample();
        }
    }

    @Override
    public Integer generateValue(Integer randomness) {
        return randomness;
    }

    @Override
    public double density(Integer value) {
        if (value == null || value < 0) {
            return 0.0;
        }
        return distribution.probability(value);
    }

    @Override
    public boolean hasCustomProposal() {
        return true;
    }

    @Override
    public Proposal<Integer> nextRandomness(Integer current) {
        int next;
        if (current == 0) {
            next = 1;
        } else {
            next = RandomSource.nextDouble() < 0.5 ? current - 1 : current + 1;
        }
        return new Proposal<>(next, transitionRatio(current, next), density(next) / density(current));
    }

    /**
     * P(to -> from) / P(from -> to) under the random walk.
     */
    public static double transitionRatio(int from, int to) {
        return transitionProbability(to, from) / transitionProbability(from, to);
    }

    static double transitionProbability(int from, int to) {
        if (Math.abs(from - to) != 1 || to < 0) {
            return 0.0;
        }
        return from == 0 ? 1.0 : 0.5;
    }
}
