package com.probgraph.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Apply over any number of parents sharing one value type.
 */
public class ApplyN<A, T> extends Apply<T> {

    private final Function<? super List<A>, ? extends T> fn;

    public ApplyN(String name, Universe universe, List<? extends Element<A, ?>> args,
            Function<? super List<A>, ? extends T> fn) {
        super(name, universe, new ArrayList<>(args));
        this.fn = fn;
    }

    @Override
    @SuppressWarnings("unchecked")
    protected T compute(List<Object> parentValues) {
        return fn.apply(Collections.unmodifiableList((List<A>) (List<?>) parentValues));
    }
}
