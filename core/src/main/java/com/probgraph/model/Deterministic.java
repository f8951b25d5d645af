package com.probgraph.model;

/**
 * An element whose value is a function of its arguments' values. Randomness
 * degenerates to {@link Void} and the density is trivially 1.
 */
public abstract class Deterministic<T> extends Element<T, Void> {

    protected Deterministic(String name, Universe universe) {
        super(name, universe);
    }

    @Override
    public Void generateRandomness() {
        return null;
    }

    @Override
    public double density(T value) {
        return 1.0;
    }

    @Override
    public boolean isStochastic() {
        return false;
    }
}
