package com.probgraph.library;

import com.probgraph.model.FiniteAtomic;
import com.probgraph.model.Universe;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class Constant<T> extends FiniteAtomic<T, Void> {

    private final T constant;

    public Constant(String name, Universe universe, T constant) {
        super(name, universe);
        this.constant = constant;
    }

    @Override
    public Void generateRandomness() {
        return null;
    }

    @Override
    public T generateValue(Void randomness) {
        return constant;
    }

    @Override
    public double density(T value) {
        return Objects.equals(value, constant) ? 1.0 : 0.0;
    }

    @Override
    public boolean isStochastic() {
        return false;
    }

    @Override
    public List<T> support() {
        return Collections.singletonList(constant);
    }
}
