package com.probgraph.model.capability;

import com.probgraph.learning.Hyperparameters;

/**
 * A learnable hyperparameter.
 *
 * <p>
 * Learned hyperparameters are an immutable {@link Hyperparameters} value.
 * {@link #withUpdatedStatistics(double[])} computes the next value without
 * touching the parameter; {@link #install(Hyperparameters)} replaces the
 * current value, and is only called at an EM iteration boundary.
 *
 * @param <V> type of the expected and MAP values
 */
public interface Parameter<V> {

    String getName();

    /** Length of every sufficient statistics vector of this family. */
    int dimension();

    default double[] zeroSufficientStatistics() {
        return new double[dimension()];
    }

    /** One-hot vector for the outcome in slot {@code outcomeIndex}. */
    default double[] sufficientStatistics(int outcomeIndex) {
        if (outcomeIndex < 0 || outcomeIndex >= dimension()) {
            throw new IndexOutOfBoundsException(
                    "Outcome index " + outcomeIndex + " out of range for dimension " + dimension());
        }
        double[] stats = zeroSufficientStatistics();
        stats[outcomeIndex] = 1.0;
        return stats;
    }

    Hyperparameters prior();

    Hyperparameters learned();

    /**
     * Prior plus accumulated statistics. Fails with a dimension mismatch
     * rather than padding or truncating.
     */
    default Hyperparameters withUpdatedStatistics(double[] statistics) {
        return prior().plus(statistics);
    }

    void install(Hyperparameters learned);

    default void maximize(double[] statistics) {
        install(withUpdatedStatistics(statistics));
    }

    V expectedValue();

    V mapValue();
}
