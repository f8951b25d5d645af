package com.probgraph.learning;

import com.probgraph.inference.Distribution;
import com.probgraph.model.DimensionMismatchException;
import com.probgraph.model.FiniteAtomic;
import com.probgraph.model.Universe;
import com.probgraph.model.capability.Parameter;
import com.probgraph.model.capability.Parameterized;
import com.probgraph.util.RandomSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

/**
 * Categorical element whose outcome probabilities are the expected value of a
 * {@link DirichletParameter}. Outcome i uses concentration i.
 */
public class ParameterizedSelect<T> extends FiniteAtomic<T, Double> implements Parameterized<T> {

    private final DirichletParameter parameter;
    private final List<T> outcomes;

    public ParameterizedSelect(String name, Universe universe, DirichletParameter parameter, List<T> outcomes) {
        super(name, checkOutcomes(universe, parameter, outcomes));
        this.parameter = parameter;
        this.outcomes = Collections.unmodifiableList(new ArrayList<>(outcomes));
    }

    private static Universe checkOutcomes(Universe universe, DirichletParameter parameter, List<?> outcomes) {
        if (parameter == null || outcomes == null) {
            throw new IllegalArgumentException("ParameterizedSelect needs a parameter and outcomes");
        }
        if (outcomes.size() != parameter.dimension()) {
            throw new DimensionMismatchException("outcomes of " + parameter.getName(), parameter.dimension(),
                    outcomes.size());
        }
        if (new HashSet<>(outcomes).size() != outcomes.size()) {
            throw new IllegalArgumentException("ParameterizedSelect outcomes must be distinct: " + outcomes);
        }
        return universe;
    }

    @Override
    public Parameter<?> parameter() {
        return parameter;
    }

    @Override
    public double[] distributionToStatistics(Distribution<T> distribution) {
        double[] stats = parameter.zeroSufficientStatistics();
        for (Distribution.Outcome<T> o : distribution.getOutcomes()) {
            int idx = outcomes.indexOf(o.getValue());
            if (idx >= 0) {
                stats[idx] += o.getProbability();
            }
        }
        return stats;
    }

    @Override
    public Double generateRandomness() {
        return RandomSource.nextDouble();
    }

    @Override
    public T generateValue(Double randomness) {
        double[] probabilities = parameter.expectedValue();
        double cumulative = 0.0;
        for (int i = 0; i < probabilities.length; i++) {
            cumulative += probabilities[i];
            if (randomness < cumulative) {
                return outcomes.get(i);
            }
        }
        return outcomes.get(outcomes.size() - 1);
    }

    @Override
    public double density(T value) {
        int idx = outcomes.indexOf(value);
        return idx >= 0 ? parameter.expectedValue()[idx] : 0.0;
    }

    @Override
    public List<T> support() {
        return outcomes;
    }

    @Override
    public Optional<Parameterized<T>> asParameterized() {
        return Optional.of(this);
    }
}
