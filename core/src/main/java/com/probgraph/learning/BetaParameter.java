package com.probgraph.learning;

import com.probgraph.model.Atomic;
import com.probgraph.model.DimensionMismatchException;
import com.probgraph.model.Universe;
import com.probgraph.model.capability.Parameter;
import com.probgraph.util.RandomSource;
import org.apache.commons.math3.distribution.BetaDistribution;
import org.apache.commons.math3.special.Beta;

import java.util.Optional;

/**
 * Beta-distributed probability with learnable hyperparameters (alpha, beta).
 * Statistics slot 0 counts true outcomes and slot 1 false outcomes, so a
 * conjugate update from counts (t, f) gives (alpha + t, beta + f).
 */
public class BetaParameter extends Atomic<Double, Double> implements Parameter<Double> {

    private final Hyperparameters prior;
    private volatile Hyperparameters learned;

    public BetaParameter(String name, Universe universe, double alpha, double beta) {
        this(name, universe, new Hyperparameters(alpha, beta));
    }

    private BetaParameter(String name, Universe universe, Hyperparameters prior) {
        super(name, universe);
        this.prior = prior;
        this.learned = prior;
    }

    @Override
    public int dimension() {
        return 2;
    }

    /**
     * One-hot statistics for a single observed outcome.
     */
    public double[] sufficientStatistics(boolean outcome) {
        return sufficientStatistics(outcome ? 0 : 1);
    }

    @Override
    public Hyperparameters prior() {
        return prior;
    }

    @Override
    public Hyperparameters learned() {
        return learned;
    }

    public double learnedAlpha() {
        return learned.get(0);
    }

    public double learnedBeta() {
        return learned.get(1);
    }

    @Override
    public void install(Hyperparameters hyperparameters) {
        if (hyperparameters.dimension() != dimension()) {
            throw new DimensionMismatchException("hyperparameters", dimension(),
                    hyperparameters.dimension());
        }
        this.learned = hyperparameters;
    }

    @Override
    public Double expectedValue() {
        Hyperparameters h = learned;
        return h.get(0) / h.total();
    }

    /**
     * Mode of the learned Beta; the mean when either hyperparameter is at most
     * 1 and the mode is not interior.
     */
    @Override
    public Double mapValue() {
        Hyperparameters h = learned;
        double a = h.get(0);
        double b = h.get(1);
        if (a > 1 && b > 1) {
            return (a - 1) / (a + b - 2);
        }
        return a / (a + b);
    }

    @Override
    public Double generateRandomness() {
        Hyperparameters h = learned;
        synchronized (RandomSource.class) {
            return new BetaDistribution(RandomSource.generator(), h.get(0), h.get(1)).sample();
        }
    }

    @Override
    public Double generateValue(Double randomness) {
        return randomness;
    }

    /**
     * Beta density under the learned hyperparameters. Outside [0, 1], and at an
     * endpoint where the density diverges, the result is 0.
     */
    @Override
    public double density(Double value) {
        if (value == null || value < 0.0 || value > 1.0) {
            return 0.0;
        }
        Hyperparameters h = learned;
        if ((value == 0.0 && h.get(0) < 1) || (value == 1.0 && h.get(1) < 1)) {
            return 0.0;
        }
        double a = h.get(0);
        double b = h.get(1);
        return Math.exp(logPower(a - 1, value) + logPower(b - 1, 1.0 - value) - Beta.logBeta(a, b));
    }

    // exponent * log(base), with 0 * log(0) taken as 0
    private static double logPower(double exponent, double base) {
        return exponent == 0.0 ? 0.0 : exponent * Math.log(base);
    }

    @Override
    public Optional<Parameter<?>> asParameter() {
        return Optional.of(this);
    }

    @Override
    public String toString() {
        return getName() + "(" + learnedAlpha() + ", " + learnedBeta() + ")";
    }
}
