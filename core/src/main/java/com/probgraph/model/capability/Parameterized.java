package com.probgraph.model.capability;

import com.probgraph.inference.Distribution;

/**
 * An element whose distribution is read from a shared {@link Parameter} at
 * generation time.
 */
public interface Parameterized<T> {

    Parameter<?> parameter();

    /**
     * Sums each outcome's posterior probability into that outcome's slot of a
     * sufficient statistics vector. Outcomes missing from the distribution
     * contribute 0.
     */
    double[] distributionToStatistics(Distribution<T> distribution);
}
