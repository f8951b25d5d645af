package com.probgraph.learning;

import com.probgraph.model.Atomic;
import com.probgraph.model.DimensionMismatchException;
import com.probgraph.model.Universe;
import com.probgraph.model.capability.Parameter;
import com.probgraph.util.RandomSource;
import org.apache.commons.math3.distribution.GammaDistribution;
import org.apache.commons.math3.special.Gamma;

import java.util.Arrays;
import java.util.Optional;

/**
 * Dirichlet-distributed probability vector over k outcomes with learnable
 * concentrations. Statistics slot i counts outcome i.
 */
public class DirichletParameter extends Atomic<double[], double[]> implements Parameter<double[]> {

    private static final double SIMPLEX_TOLERANCE = 1e-9;

    private final Hyperparameters prior;
    private volatile Hyperparameters learned;

    public DirichletParameter(String name, Universe universe, double... concentrations) {
        this(name, universe, checkDimension(concentrations));
    }

    private DirichletParameter(String name, Universe universe, Hyperparameters prior) {
        super(name, universe);
        this.prior = prior;
        this.learned = prior;
    }

    private static Hyperparameters checkDimension(double[] concentrations) {
        if (concentrations.length < 2) {
            throw new IllegalArgumentException(
                    "A Dirichlet needs at least 2 concentrations, got " + concentrations.length);
        }
        return new Hyperparameters(concentrations);
    }

    @Override
    public int dimension() {
        return prior.dimension();
    }

    @Override
    public Hyperparameters prior() {
        return prior;
    }

    @Override
    public Hyperparameters learned() {
        return learned;
    }

    @Override
    public void install(Hyperparameters hyperparameters) {
        if (hyperparameters.dimension() != dimension()) {
            throw new DimensionMismatchException("hyperparameters", dimension(), hyperparameters.dimension());
        }
        this.learned = hyperparameters;
    }

    @Override
    public double[] expectedValue() {
        Hyperparameters h = learned;
        double total = h.total();
        double[] mean = new double[h.dimension()];
        for (int i = 0; i < mean.length; i++) {
            mean[i] = h.get(i) / total;
        }
        return mean;
    }

    /**
     * Mode of the learned Dirichlet, or the mean when some concentration is at
     * most 1.
     */
    @Override
    public double[] mapValue() {
        Hyperparameters h = learned;
        for (int i = 0; i < h.dimension(); i++) {
            if (h.get(i) <= 1) {
                return expectedValue();
            }
        }
        double denominator = h.total() - h.dimension();
        double[] mode = new double[h.dimension()];
        for (int i = 0; i < mode.length; i++) {
            mode[i] = (h.get(i) - 1) / denominator;
        }
        return mode;
    }

    /**
     * Independent Gamma(alpha_i, 1) draws, normalized.
     */
    @Override
    public double[] generateRandomness() {
        Hyperparameters h = learned;
        double[] draw = new double[h.dimension()];
        double total = 0.0;
        synchronized (RandomSource.class) {
            for (int i = 0; i < draw.length; i++) {
                draw[i] = new GammaDistribution(RandomSource.generator(), h.get(i), 1.0).sample();
                total += draw[i];
            }
        }
        for (int i = 0; i < draw.length; i++) {
            draw[i] /= total;
        }
        return draw;
    }

    @Override
    public double[] generateValue(double[] randomness) {
        return randomness;
    }

    /**
     * Dirichlet density under the learned concentrations; 0 off the simplex.
     */
    @Override
    public double density(double[] value) {
        Hyperparameters h = learned;
        if (value == null || value.length != h.dimension()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double x : value) {
            if (x < 0 || Double.isNaN(x)) {
                return 0.0;
            }
            sum += x;
        }
        if (Math.abs(sum - 1.0) > SIMPLEX_TOLERANCE) {
            return 0.0;
        }
        double logDensity = Gamma.logGamma(h.total());
        for (int i = 0; i < value.length; i++) {
            double a = h.get(i);
            logDensity -= Gamma.logGamma(a);
            if (a != 1.0) {
                logDensity += (a - 1) * Math.log(value[i]);
            }
        }
        double density = Math.exp(logDensity);
        return Double.isInfinite(density) ? 0.0 : density;
    }

    @Override
    public Optional<Parameter<?>> asParameter() {
        return Optional.of(this);
    }

    @Override
    public String toString() {
        return getName() + Arrays.toString(learned.values());
    }
}
