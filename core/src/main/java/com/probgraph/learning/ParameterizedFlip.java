package com.probgraph.learning;

import com.probgraph.inference.Distribution;
import com.probgraph.model.FiniteAtomic;
import com.probgraph.model.Universe;
import com.probgraph.model.capability.Parameter;
import com.probgraph.model.capability.Parameterized;
import com.probgraph.util.RandomSource;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Flip whose probability of true is the expected value of a
 * {@link BetaParameter}, read at generation time. Installing new
 * hyperparameters on the parameter changes this element's distribution
 * immediately.
 */
public class ParameterizedFlip extends FiniteAtomic<Boolean, Double> implements Parameterized<Boolean> {

    private static final List<Boolean> SUPPORT = Arrays.asList(Boolean.TRUE, Boolean.FALSE);

    private final BetaParameter parameter;

    public ParameterizedFlip(String name, Universe universe, BetaParameter parameter) {
        super(name, universe);
        if (parameter == null) {
            throw new IllegalArgumentException("ParameterizedFlip needs a parameter");
        }
        this.parameter = parameter;
    }

    public double getProbability() {
        return parameter.expectedValue();
    }

    @Override
    public Parameter<?> parameter() {
        return parameter;
    }

    @Override
    public double[] distributionToStatistics(Distribution<Boolean> distribution) {
        return new double[] { distribution.probability(Boolean.TRUE), distribution.probability(Boolean.FALSE) };
    }

    @Override
    public Double generateRandomness() {
        return RandomSource.nextDouble();
    }

    @Override
    public Boolean generateValue(Double randomness) {
        return randomness < getProbability();
    }

    @Override
    public double density(Boolean value) {
        if (value == null) {
            return 0.0;
        }
        double p = getProbability();
        return value ? p : 1.0 - p;
    }

    @Override
    public List<Boolean> support() {
        return SUPPORT;
    }

    @Override
    public Optional<Parameterized<Boolean>> asParameterized() {
        return Optional.of(this);
    }
}
