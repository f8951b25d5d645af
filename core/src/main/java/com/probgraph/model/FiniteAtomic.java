package com.probgraph.model;

import com.probgraph.factor.Factor;
import com.probgraph.factor.Factors;
import com.probgraph.factor.VariableContext;
import com.probgraph.model.capability.Enumerable;
import com.probgraph.model.capability.FactorMaker;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Atomic element with a small, explicitly listed support. Enumeration returns
 * the support and the only factor is the density table over it.
 */
public abstract class FiniteAtomic<T, R> extends Atomic<T, R> implements Enumerable<T>, FactorMaker {

    protected FiniteAtomic(String name, Universe universe) {
        super(name, universe);
    }

    /**
     * Distinct values with non-zero density, in a fixed order.
     */
    public abstract List<T> support();

    @Override
    public List<T> makeValues(VariableContext context) {
        return support();
    }

    @Override
    public List<Factor> makeFactors(VariableContext context) {
        return Collections.singletonList(Factors.densityFactor(context, this));
    }

    @Override
    public Optional<Enumerable<T>> enumerable() {
        return Optional.of(this);
    }

    @Override
    public Optional<FactorMaker> factorMaker() {
        return Optional.of(this);
    }

    @Override
    public boolean hasSmallSupport() {
        return true;
    }
}
