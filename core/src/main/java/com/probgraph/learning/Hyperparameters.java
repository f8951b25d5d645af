package com.probgraph.learning;

import com.probgraph.model.DimensionMismatchException;

import java.util.Arrays;

/**
 * Immutable vector of conjugate-prior hyperparameters, e.g. (alpha, beta) of a
 * Beta or the concentrations of a Dirichlet.
 */
public final class Hyperparameters {

    private final double[] values;

    public Hyperparameters(double... values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("Hyperparameters cannot be empty");
        }
        for (double v : values) {
            if (!(v > 0) || Double.isInfinite(v)) {
                throw new IllegalArgumentException("Hyperparameters must be positive and finite, got "
                        + Arrays.toString(values));
            }
        }
        this.values = values.clone();
    }

    public int dimension() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    public double total() {
        double total = 0.0;
        for (double v : values) {
            total += v;
        }
        return total;
    }

    public double[] values() {
        return values.clone();
    }

    /**
     * Element-wise sum with a sufficient statistics vector of the same length.
     */
    public Hyperparameters plus(double[] statistics) {
        if (statistics.length != values.length) {
            throw new DimensionMismatchException("sufficient statistics", values.length, statistics.length);
        }
        double[] updated = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            if (statistics[i] < 0 || Double.isNaN(statistics[i])) {
                throw new IllegalArgumentException("Sufficient statistics must be non-negative, got "
                        + Arrays.toString(statistics));
            }
            updated[i] = values[i] + statistics[i];
        }
        return new Hyperparameters(updated);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Hyperparameters)) {
            return false;
        }
        return Arrays.equals(values, ((Hyperparameters) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Hyperparameters" + Arrays.toString(values);
    }
}
