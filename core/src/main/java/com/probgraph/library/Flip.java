package com.probgraph.library;

import com.probgraph.model.FiniteAtomic;
import com.probgraph.model.Universe;
import com.probgraph.util.RandomSource;

import java.util.Arrays;
import java.util.List;

/**
 * Boolean element that is true with a fixed probability. The randomness is a
 * uniform draw in [0, 1).
 */
public class Flip extends FiniteAtomic<Boolean, Double> {

    private static final List<Boolean> SUPPORT = Arrays.asList(Boolean.TRUE, Boolean.FALSE);

    private final double probability;

    public Flip(String name, Universe universe, double probability) {
        super(name, checkProbability(universe, probability));
        this.probability = probability;
    }

    // Checked before registration so a rejected flip never enters the universe.
    private static Universe checkProbability(Universe universe, double probability) {
        if (probability < 0.0 || probability > 1.0 || Double.isNaN(probability)) {
            throw new IllegalArgumentException("Flip probability must be in [0, 1], got " + probability);
        }
        return universe;
    }

    public double getProbability() {
        return probability;
    }

    @Override
    public Double generateRandomness() {
        return RandomSource.nextDouble();
    }

    @Override
    public Boolean generateValue(Double randomness) {
        return randomness < probability;
    }

    @Override
    public double density(Boolean value) {
        if (value == null) {
            return 0.0;
        }
        return value ? probability : 1.0 - probability;
    }

    @Override
    public List<Boolean> support() {
        return SUPPORT;
    }
}
