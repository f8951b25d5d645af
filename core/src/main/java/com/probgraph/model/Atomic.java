package com.probgraph.model;

import java.util.Collections;
import java.util.List;

/**
 * An element with no arguments whose value is drawn directly from its own
 * distribution.
 */
public abstract class Atomic<T, R> extends Element<T, R> {

    protected Atomic(String name, Universe universe) {
        super(name, universe);
    }

    @Override
    public List<Element<?, ?>> args() {
        return Collections.emptyList();
    }

    @Override
    public boolean isStochastic() {
        return true;
    }
}
